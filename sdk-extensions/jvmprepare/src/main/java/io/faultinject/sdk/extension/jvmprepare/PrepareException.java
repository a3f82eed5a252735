/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare;

import javax.annotation.Nullable;

/**
 * 准备流程异常
 *
 * <p>覆盖记录解析、端口分配、持久化和 attach 过程中的全部失败类型，每种类型对应一个稳定的响应码。
 */
public class PrepareException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** 异常类型 */
  public enum Type {
    /** 参数非法（缺少目标、匹配到多个进程、uid 为空） */
    INVALID_INPUT(47000),
    /** 已有 Running 记录但请求端口不一致 */
    CONFLICTING_PARAMETERS(47001),
    /** 目标进程或记录不存在 */
    TARGET_NOT_FOUND(47002),
    /** 记录存储读写失败 */
    PERSISTENCE_ERROR(47003),
    /** attach 失败（含重试后） */
    ATTACH_FAILURE(47004),
    /** 本地服务错误（端口分配、子进程启动） */
    SERVER_ERROR(47005);

    private final int code;

    Type(int code) {
      this.code = code;
    }

    public int getCode() {
      return code;
    }
  }

  private final Type type;

  /**
   * 创建准备异常
   *
   * @param type 异常类型
   * @param message 异常消息
   */
  public PrepareException(Type type, String message) {
    this(type, message, null);
  }

  /**
   * 创建准备异常
   *
   * @param type 异常类型
   * @param message 异常消息
   * @param cause 原始异常
   */
  public PrepareException(Type type, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.type = type;
  }

  public Type getType() {
    return type;
  }

  /** 响应码 */
  public int getCode() {
    return type.getCode();
  }

  /**
   * 是否属于参数类错误
   *
   * <p>端口冲突也归入参数错误族：调用方需要修改参数后重试。
   *
   * @return 是否参数错误
   */
  public boolean isInvalidInput() {
    return type == Type.INVALID_INPUT || type == Type.CONFLICTING_PARAMETERS;
  }

  // ===== 便捷工厂方法 =====

  public static PrepareException invalidInput(String message) {
    return new PrepareException(Type.INVALID_INPUT, message);
  }

  public static PrepareException conflictingParameters(String message) {
    return new PrepareException(Type.CONFLICTING_PARAMETERS, message);
  }

  public static PrepareException targetNotFound(String message) {
    return new PrepareException(Type.TARGET_NOT_FOUND, message);
  }

  public static PrepareException persistenceError(String message, @Nullable Throwable cause) {
    return new PrepareException(Type.PERSISTENCE_ERROR, message, cause);
  }

  public static PrepareException attachFailure(String message) {
    return new PrepareException(Type.ATTACH_FAILURE, message);
  }

  public static PrepareException serverError(String message, @Nullable Throwable cause) {
    return new PrepareException(Type.SERVER_ERROR, message, cause);
  }
}
