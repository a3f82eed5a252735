/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.cli;

import io.faultinject.sdk.extension.jvmprepare.JvmPreparationManager;
import io.faultinject.sdk.extension.jvmprepare.PrepareException;
import io.faultinject.sdk.extension.jvmprepare.PrepareResponse;
import java.io.PrintWriter;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/** {@code prepare status}：查询准备记录 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Query a preparation record")
public final class PrepareStatusCommand implements Callable<Integer> {

  @ParentCommand PrepareCommand parent;

  @Spec CommandSpec spec;

  @Option(names = {"-u", "--uid"}, required = true, description = "the preparation uid")
  String uid = "";

  @Override
  public Integer call() {
    PrepareResponse response;
    try (JvmPreparationManager manager = parent.openManager()) {
      response = manager.status(uid);
    } catch (IllegalArgumentException e) {
      response = PrepareResponse.failed(PrepareException.invalidInput(e.getMessage()), "");
    } catch (PrepareException e) {
      response = PrepareResponse.failed(e, "");
    }
    PrintWriter out = spec.commandLine().getOut();
    out.println(response.toJson());
    out.flush();
    return response.isSuccess() ? 0 : 1;
  }
}
