/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.cli;

import io.faultinject.sdk.extension.jvmprepare.JvmPreparationManager;
import io.faultinject.sdk.extension.jvmprepare.PrepareException;
import io.faultinject.sdk.extension.jvmprepare.PrepareResponse;
import io.faultinject.sdk.extension.jvmprepare.config.PrepareConfig;
import io.opentelemetry.sdk.autoconfigure.spi.internal.DefaultConfigProperties;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.Collections;
import java.util.function.Supplier;
import java.util.logging.LogManager;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * 准备命令入口
 *
 * <pre>
 *   prepare jvm --process tomcat
 *   prepare jvm --pid 1234 --port 34000 --async --endpoint http://collector/report
 *   prepare status --uid 4f3c...
 * </pre>
 *
 * <p>标准输出只包含一行 JSON 响应，日志输出到标准错误。
 */
@Command(
    name = "prepare",
    mixinStandardHelpOptions = true,
    description = "Prepare a running JVM for fault injection experiments",
    subcommands = {PrepareJvmCommand.class, PrepareStatusCommand.class})
public final class PrepareCommand implements Runnable {

  private static final String LOGGING_CONFIG_PROPERTY = "java.util.logging.config.file";
  private static final String LOGGING_RESOURCE = "/jvmprepare-logging.properties";

  private final Supplier<JvmPreparationManager> managerFactory;

  @Spec CommandSpec spec;

  PrepareCommand(Supplier<JvmPreparationManager> managerFactory) {
    this.managerFactory = managerFactory;
  }

  @Override
  public void run() {
    spec.commandLine().usage(spec.commandLine().getOut());
  }

  /** 由子命令调用，每次命令执行创建一个管理器 */
  JvmPreparationManager openManager() {
    return managerFactory.get();
  }

  /**
   * 创建命令行
   *
   * <p>参数解析失败同样输出 JSON 响应并以 1 退出。
   *
   * @param managerFactory 管理器工厂
   * @return 命令行
   */
  public static CommandLine newCommandLine(Supplier<JvmPreparationManager> managerFactory) {
    CommandLine commandLine = new CommandLine(new PrepareCommand(managerFactory));
    commandLine.setParameterExceptionHandler(
        (ex, args) -> {
          PrintWriter out = ex.getCommandLine().getOut();
          out.println(
              PrepareResponse.failed(PrepareException.invalidInput(ex.getMessage()), "").toJson());
          out.flush();
          return 1;
        });
    return commandLine;
  }

  public static void main(String[] args) {
    configureLogging();
    int exitCode =
        newCommandLine(
                () ->
                    JvmPreparationManager.create(
                        PrepareConfig.create(
                            DefaultConfigProperties.create(Collections.emptyMap()))))
            .execute(args);
    System.exit(exitCode);
  }

  private static void configureLogging() {
    if (System.getProperty(LOGGING_CONFIG_PROPERTY) != null) {
      return;
    }
    try (InputStream in = PrepareCommand.class.getResourceAsStream(LOGGING_RESOURCE)) {
      if (in != null) {
        LogManager.getLogManager().readConfiguration(in);
      }
    } catch (IOException e) {
      System.err.println("Failed to load logging configuration: " + e.getMessage());
    }
  }
}
