/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.cli;

import io.faultinject.sdk.extension.jvmprepare.JvmPreparationManager;
import io.faultinject.sdk.extension.jvmprepare.PrepareException;
import io.faultinject.sdk.extension.jvmprepare.PrepareResponse;
import io.faultinject.sdk.extension.jvmprepare.prepare.PrepareRequest;
import java.io.PrintWriter;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/** {@code prepare jvm}：将 agent attach 到目标 JVM */
@Command(
    name = "jvm",
    mixinStandardHelpOptions = true,
    description = "Attach a type agent to the jvm process for java framework experiment")
public final class PrepareJvmCommand implements Callable<Integer> {

  @ParentCommand PrepareCommand parent;

  @Spec CommandSpec spec;

  @Option(names = {"-j", "--javaHome"}, description = "the java jdk home path")
  String javaHome = "";

  @Option(names = {"-p", "--process"}, description = "the java application process name")
  String processName = "";

  @Option(names = {"-P", "--port"}, description = "the port used for agent server")
  int port;

  @Option(names = "--pid", description = "the target java process id")
  String processId = "";

  @Option(names = {"-a", "--async"}, description = "whether to attach asynchronously")
  boolean async;

  @Option(names = {"-u", "--uid"}, hidden = true, description = "used internally")
  String uid = "";

  @Option(names = {"-n", "--nohup"}, hidden = true, description = "used internally")
  boolean nohup;

  @Option(names = {"-e", "--endpoint"}, description = "the report endpoint of async preparation")
  String endpoint = "";

  @Override
  public Integer call() {
    PrepareResponse response;
    try (JvmPreparationManager manager = parent.openManager()) {
      response = manager.prepare(buildRequest());
    } catch (IllegalArgumentException e) {
      response = PrepareResponse.failed(PrepareException.invalidInput(e.getMessage()), uid);
    } catch (PrepareException e) {
      response = PrepareResponse.failed(e, uid);
    }
    PrintWriter out = spec.commandLine().getOut();
    out.println(response.toJson());
    out.flush();
    return response.isSuccess() ? 0 : 1;
  }

  PrepareRequest buildRequest() {
    return PrepareRequest.builder()
        .setJavaHome(javaHome)
        .setProcessName(processName)
        .setPort(port)
        .setProcessId(processId)
        .setAsync(async)
        .setUid(uid)
        .setNohup(nohup)
        .setEndpoint(endpoint)
        .build();
  }
}
