/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.attach;

import com.sun.tools.attach.VirtualMachine;
import io.faultinject.sdk.extension.jvmprepare.config.PrepareConfig;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * 基于 sandbox agent 的 attach 客户端
 *
 * <p>执行流程：
 * <pre>
 *   1. 识别目标进程所属用户（用于失败后的旁路端口恢复）
 *   2. 加载 agent：未指定 javaHome 时使用当前 JVM 的 Attach API，否则调用 javaHome/bin/jcmd
 *   3. 通过 HTTP 探测 agent 版本接口，确认 agent 在指定端口提供服务
 * </pre>
 *
 * <p>所有失败都转换为 {@link AttachOutcome#failed}，失败消息包含完整的异常链，
 * 以便上层识别 "Connection refused"。
 */
public final class SandboxAttachClient implements AttachClient, Closeable {

  private static final Logger logger = Logger.getLogger(SandboxAttachClient.class.getName());

  private static final String LOOPBACK = "127.0.0.1";
  private static final String VERSION_PATH_FORMAT =
      "http://%s:%d/sandbox/%s/module/http/sandbox-info/version";

  private final PrepareConfig config;
  private final OkHttpClient httpClient;

  /**
   * 创建 attach 客户端
   *
   * @param config 准备配置
   */
  public SandboxAttachClient(PrepareConfig config) {
    this.config = config;
    long timeoutMillis = config.getAttachTimeout().toMillis();
    this.httpClient =
        new OkHttpClient.Builder()
            .connectTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
            .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
            .writeTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
            .retryOnConnectionFailure(false)
            .build();
  }

  @Override
  public AttachOutcome attach(int port, String javaHome, String processId) {
    String identity = resolveIdentity(processId);
    logger.log(
        Level.INFO,
        "Attaching sandbox agent: pid={0}, port={1}, user={2}",
        new Object[] {processId, port, identity});

    Path agentJar = config.getSandboxAgentJar();
    if (!Files.isRegularFile(agentJar)) {
      return AttachOutcome.failed(port, "sandbox agent jar not found: " + agentJar, identity);
    }

    String agentArgs = buildAgentArgs(port);
    try {
      if (javaHome.isEmpty()) {
        loadWithAttachApi(processId, agentJar, agentArgs);
      } else {
        loadWithJcmd(javaHome, processId, agentJar, agentArgs);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return AttachOutcome.failed(port, "attach JVM interrupted", identity);
    } catch (Exception e) {
      logger.log(Level.WARNING, "Failed to load sandbox agent into pid " + processId, e);
      return AttachOutcome.failed(port, "attach JVM failed, " + describe(e), identity);
    }

    return probe(port, identity);
  }

  /**
   * 构造 agent 参数
   *
   * @param port agent 端口
   * @return {@code home=..;token=..;server.ip=..;server.port=..;namespace=..}
   */
  String buildAgentArgs(int port) {
    return "home="
        + config.getSandboxHome()
        + ";token="
        + UUID.randomUUID().toString().replace("-", "")
        + ";server.ip="
        + LOOPBACK
        + ";server.port="
        + port
        + ";namespace="
        + config.getSandboxNamespace();
  }

  // ===== agent 加载 =====

  private static void loadWithAttachApi(String processId, Path agentJar, String agentArgs)
      throws Exception {
    VirtualMachine vm = VirtualMachine.attach(processId);
    try {
      vm.loadAgent(agentJar.toString(), agentArgs);
    } finally {
      try {
        vm.detach();
      } catch (IOException e) {
        logger.log(Level.FINE, "Failed to detach from pid {0}: {1}",
            new Object[] {processId, e.getMessage()});
      }
    }
  }

  private void loadWithJcmd(String javaHome, String processId, Path agentJar, String agentArgs)
      throws IOException, InterruptedException {
    Path jcmd = Paths.get(javaHome, "bin", "jcmd");
    List<String> command = new ArrayList<>();
    command.add(jcmd.toString());
    command.add(processId);
    command.add("JVMTI.agent_load");
    command.add(agentJar.toString());
    command.add(agentArgs);

    Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
    long timeoutMillis = config.getAttachTimeout().toMillis();
    // 输出在等待前并发读取，避免管道写满后 jcmd 阻塞
    CompletableFuture<String> output =
        CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
    boolean exited;
    try {
      exited = process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      process.destroyForcibly();
      throw e;
    }
    if (!exited) {
      process.destroyForcibly();
      throw new IOException("jcmd timed out after " + timeoutMillis + "ms");
    }
    String text;
    try {
      text = output.get(timeoutMillis, TimeUnit.MILLISECONDS).trim();
    } catch (ExecutionException | TimeoutException e) {
      throw new IOException("failed to read jcmd output", e);
    }
    if (process.exitValue() != 0 || text.toLowerCase(Locale.ROOT).contains("error")) {
      throw new IOException("jcmd exit code " + process.exitValue() + ": " + text);
    }
  }

  // ===== 握手 =====

  private AttachOutcome probe(int port, String identity) {
    String url =
        String.format(
            Locale.ROOT, VERSION_PATH_FORMAT, LOOPBACK, port, config.getSandboxNamespace());
    Request request = new Request.Builder().url(url).get().build();
    try (Response response = httpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        return AttachOutcome.failed(
            port, "sandbox agent answered HTTP " + response.code() + " on port " + port, identity);
      }
      String body = response.body() != null ? response.body().string().trim() : "";
      logger.log(Level.INFO, "Sandbox agent ready on port {0}: {1}", new Object[] {port, body});
      return AttachOutcome.success(port, body.isEmpty() ? "success" : body, identity);
    } catch (IOException e) {
      return AttachOutcome.failed(port, "access sandbox failed, " + describe(e), identity);
    }
  }

  // ===== 辅助方法 =====

  private static String resolveIdentity(String processId) {
    try {
      Optional<ProcessHandle> handle = ProcessHandle.of(Long.parseLong(processId));
      if (handle.isPresent()) {
        return handle.get().info().user().orElse("");
      }
    } catch (NumberFormatException e) {
      logger.log(Level.FINE, "Illegal pid: {0}", processId);
    }
    return "";
  }

  /** 拼接异常链消息 */
  static String describe(Throwable throwable) {
    StringBuilder sb = new StringBuilder();
    Throwable current = throwable;
    while (current != null) {
      if (sb.length() > 0) {
        sb.append(": ");
      }
      sb.append(current.getMessage() != null ? current.getMessage() : current.getClass().getName());
      current = current.getCause() == current ? null : current.getCause();
    }
    return sb.toString();
  }

  private static String drain(InputStream in) {
    try (InputStream stream = in) {
      return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void close() {
    httpClient.dispatcher().executorService().shutdown();
    httpClient.connectionPool().evictAll();
  }
}
