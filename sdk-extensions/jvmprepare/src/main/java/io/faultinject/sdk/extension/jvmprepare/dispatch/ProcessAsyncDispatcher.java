/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.dispatch;

import io.faultinject.sdk.extension.jvmprepare.PrepareException;
import io.faultinject.sdk.extension.jvmprepare.config.PrepareConfig;
import io.faultinject.sdk.extension.jvmprepare.prepare.PrepareRequest;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 以独立进程执行异步再调用
 *
 * <p>命令格式：
 * <pre>
 *   [nohup] java [-Djvmprepare.*] -cp &lt;classpath&gt; &lt;main class&gt; jvm --uid U --nohup --port P ...
 * </pre>
 *
 * <p>子进程标准输入关闭，标准输出和错误追加到异步日志文件，父进程不等待其结束。
 */
public final class ProcessAsyncDispatcher implements AsyncDispatcher {

  private static final Logger logger = Logger.getLogger(ProcessAsyncDispatcher.class.getName());

  /** 命令行入口 */
  static final String MAIN_CLASS = "io.faultinject.sdk.extension.jvmprepare.cli.PrepareCommand";

  private static final String PROPERTY_PREFIX = "jvmprepare.";
  private static final String LOGGING_CONFIG_PROPERTY = "java.util.logging.config.file";
  private static final Path NOHUP = Paths.get("/usr/bin/nohup");

  private final Path logFile;
  private final String javaExecutable;
  private final String classPath;
  private final Properties systemProperties;

  public ProcessAsyncDispatcher(PrepareConfig config) {
    this(
        config.getAsyncLogFile(),
        currentJavaExecutable(),
        System.getProperty("java.class.path", ""),
        System.getProperties());
  }

  ProcessAsyncDispatcher(
      Path logFile, String javaExecutable, String classPath, Properties systemProperties) {
    this.logFile = logFile;
    this.javaExecutable = javaExecutable;
    this.classPath = classPath;
    this.systemProperties = systemProperties;
  }

  @Override
  public void dispatch(PrepareRequest request) {
    List<String> command = buildCommand(request);
    if (Files.isExecutable(NOHUP)) {
      command.add(0, NOHUP.toString());
    }
    try {
      Path parent = logFile.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      File log = logFile.toFile();
      Process process =
          new ProcessBuilder(command)
              .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
              .redirectOutput(ProcessBuilder.Redirect.appendTo(log))
              .redirectError(ProcessBuilder.Redirect.appendTo(log))
              .start();
      logger.log(
          Level.INFO,
          "Started detached preparation: uid={0}, childPid={1}, log={2}",
          new Object[] {request.getUid(), process.pid(), logFile});
    } catch (IOException e) {
      throw PrepareException.serverError("start async prepare process failed, " + e.getMessage(), e);
    }
  }

  /**
   * 构造子进程命令（不含 nohup 前缀）
   *
   * @param request 再调用请求
   * @return 命令行
   */
  List<String> buildCommand(PrepareRequest request) {
    List<String> command = new ArrayList<>();
    command.add(javaExecutable);
    for (Map.Entry<String, String> property : forwardedProperties().entrySet()) {
      command.add("-D" + property.getKey() + "=" + property.getValue());
    }
    if (!classPath.isEmpty()) {
      command.add("-cp");
      command.add(classPath);
    }
    command.add(MAIN_CLASS);
    command.add("jvm");
    command.add("--uid");
    command.add(request.getUid());
    command.add("--nohup");
    command.add("--port");
    command.add(String.valueOf(request.getPort()));
    if (!request.getProcessName().isEmpty()) {
      command.add("-p");
      command.add(request.getProcessName());
    }
    if (!request.getJavaHome().isEmpty()) {
      command.add("-j");
      command.add(request.getJavaHome());
    }
    if (!request.getProcessId().isEmpty()) {
      command.add("--pid");
      command.add(request.getProcessId());
    }
    if (request.isAsync()) {
      command.add("--async");
    }
    if (!request.getEndpoint().isEmpty()) {
      command.add("--endpoint");
      command.add(request.getEndpoint());
    }
    return command;
  }

  private Map<String, String> forwardedProperties() {
    Map<String, String> forwarded = new TreeMap<>();
    for (String name : systemProperties.stringPropertyNames()) {
      if (name.startsWith(PROPERTY_PREFIX) || name.equals(LOGGING_CONFIG_PROPERTY)) {
        forwarded.put(name, systemProperties.getProperty(name));
      }
    }
    return forwarded;
  }

  private static String currentJavaExecutable() {
    return ProcessHandle.current()
        .info()
        .command()
        .orElse(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
  }

  private static File nullDevice() {
    boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    return new File(windows ? "NUL" : "/dev/null");
  }
}
