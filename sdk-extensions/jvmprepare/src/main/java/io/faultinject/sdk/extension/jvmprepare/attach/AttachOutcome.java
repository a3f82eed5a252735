/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.attach;

import java.util.Locale;

/**
 * attach 结果
 *
 * <p>封装一次 attach 的最终状态：
 * <ul>
 *   <li>是否成功及失败信息
 *   <li>实际使用的端口（重试后可能与请求端口不同）
 *   <li>恢复出的身份标识（目标进程所属用户），用于旁路查找 agent 端口
 * </ul>
 *
 * <pre>{@code
 * AttachOutcome.success(34000, "agent attached");
 * AttachOutcome.failed(34000, "connection refused", "admin");
 * }</pre>
 */
public final class AttachOutcome {

  private final boolean success;
  private final int port;
  private final String message;
  private final String recoveredIdentity;

  private AttachOutcome(boolean success, int port, String message, String recoveredIdentity) {
    this.success = success;
    this.port = port;
    this.message = message;
    this.recoveredIdentity = recoveredIdentity;
  }

  // ===== 工厂方法 =====

  public static AttachOutcome success(int port, String message) {
    return success(port, message, "");
  }

  public static AttachOutcome success(int port, String message, String recoveredIdentity) {
    return new AttachOutcome(true, port, message, recoveredIdentity);
  }

  public static AttachOutcome failed(int port, String message) {
    return failed(port, message, "");
  }

  public static AttachOutcome failed(int port, String message, String recoveredIdentity) {
    return new AttachOutcome(false, port, message, recoveredIdentity);
  }

  // ===== Getters =====

  public boolean isSuccess() {
    return success;
  }

  public int getPort() {
    return port;
  }

  public String getMessage() {
    return message;
  }

  /** 恢复出的身份标识，未知时为空串 */
  public String getRecoveredIdentity() {
    return recoveredIdentity;
  }

  /**
   * 是否为"连接被拒绝"类失败
   *
   * @return 失败且消息包含 connection refused
   */
  public boolean isConnectionRefused() {
    return !success && message.toLowerCase(Locale.ROOT).contains("connection refused");
  }

  @Override
  public String toString() {
    return String.format(
        Locale.ROOT,
        "AttachOutcome{success=%s, port=%d, message=%s, identity=%s}",
        success,
        port,
        message,
        recoveredIdentity);
  }
}
