/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.process;

import io.faultinject.sdk.extension.jvmprepare.PrepareException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 基于 {@link ProcessHandle} 的本机进程解析
 *
 * <p>只考虑 java 进程，排除当前进程和准备命令自身的进程。进程名按命令行包含关系匹配。
 */
public final class LocalProcessResolver implements ProcessResolver {

  private static final Logger logger = Logger.getLogger(LocalProcessResolver.class.getName());

  /** 准备命令自身的主类，命令行包含它的进程不作为目标 */
  private static final String SELF_MAIN_CLASS =
      "io.faultinject.sdk.extension.jvmprepare.cli.PrepareCommand";

  private final Supplier<Stream<ProcessHandle>> processes;
  private final long selfPid;

  public LocalProcessResolver() {
    this(ProcessHandle::allProcesses, ProcessHandle.current().pid());
  }

  LocalProcessResolver(Supplier<Stream<ProcessHandle>> processes, long selfPid) {
    this.processes = processes;
    this.selfPid = selfPid;
  }

  @Override
  public String resolveProcessId(String processName, String processId) {
    if (processName.isEmpty() && processId.isEmpty()) {
      throw PrepareException.invalidInput("less --process or --pid flags");
    }
    if (!processId.isEmpty()) {
      return checkProcessId(processName, processId);
    }

    List<ProcessHandle> matched =
        processes.get()
            .filter(ProcessHandle::isAlive)
            .filter(this::isCandidate)
            .filter(handle -> commandLine(handle).contains(processName))
            .collect(Collectors.toList());
    if (matched.isEmpty()) {
      throw PrepareException.targetNotFound(
          "cannot find the java process by name: " + processName);
    }
    if (matched.size() > 1) {
      String pids =
          matched.stream().map(h -> String.valueOf(h.pid())).collect(Collectors.joining(","));
      throw PrepareException.invalidInput(
          "too many java processes match " + processName + ": " + pids + ", please use --pid");
    }
    String pid = String.valueOf(matched.get(0).pid());
    logger.log(Level.INFO, "Resolved process {0} to pid {1}", new Object[] {processName, pid});
    return pid;
  }

  private String checkProcessId(String processName, String processId) {
    long pid;
    try {
      pid = Long.parseLong(processId.trim());
    } catch (NumberFormatException e) {
      throw PrepareException.invalidInput("illegal pid: " + processId);
    }
    Optional<ProcessHandle> handle =
        processes.get().filter(h -> h.pid() == pid).findFirst();
    if (!handle.isPresent() || !handle.get().isAlive()) {
      throw PrepareException.targetNotFound("the java process does not exist, pid: " + processId);
    }
    if (!processName.isEmpty() && !commandLine(handle.get()).contains(processName)) {
      throw PrepareException.targetNotFound(
          "the process " + processId + " does not match the process name " + processName);
    }
    return String.valueOf(pid);
  }

  // ===== 辅助方法 =====

  private boolean isCandidate(ProcessHandle handle) {
    if (handle.pid() == selfPid) {
      return false;
    }
    Optional<String> command = handle.info().command();
    if (!command.isPresent() || !isJavaCommand(command.get())) {
      return false;
    }
    return !commandLine(handle).contains(SELF_MAIN_CLASS);
  }

  static boolean isJavaCommand(String command) {
    Path fileName = Paths.get(command).getFileName();
    String name = fileName == null ? command : fileName.toString();
    name = name.toLowerCase(Locale.ROOT);
    return name.equals("java") || name.equals("java.exe");
  }

  private static String commandLine(ProcessHandle handle) {
    ProcessHandle.Info info = handle.info();
    Optional<String> line = info.commandLine();
    if (line.isPresent()) {
      return line.get();
    }
    StringBuilder sb = new StringBuilder(info.command().orElse(""));
    info.arguments().ifPresent(args -> {
      for (String arg : args) {
        sb.append(' ').append(arg);
      }
    });
    return sb.toString();
  }
}
