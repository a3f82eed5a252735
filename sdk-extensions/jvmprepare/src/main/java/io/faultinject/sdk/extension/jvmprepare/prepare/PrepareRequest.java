/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.prepare;

import java.util.Objects;

/**
 * 准备请求
 *
 * <p>对应 {@code prepare jvm} 命令的全部参数。{@code uid} 与 {@code nohup} 只由异步再调用使用。
 */
public final class PrepareRequest {

  private final String processName;
  private final String processId;
  private final int port;
  private final String uid;
  private final boolean async;
  private final boolean nohup;
  private final String javaHome;
  private final String endpoint;

  private PrepareRequest(Builder builder) {
    this.processName = builder.processName;
    this.processId = builder.processId;
    this.port = builder.port;
    this.uid = builder.uid;
    this.async = builder.async;
    this.nohup = builder.nohup;
    this.javaHome = builder.javaHome;
    this.endpoint = builder.endpoint;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** 以当前请求为基础创建构建器 */
  public Builder toBuilder() {
    return new Builder()
        .setProcessName(processName)
        .setProcessId(processId)
        .setPort(port)
        .setUid(uid)
        .setAsync(async)
        .setNohup(nohup)
        .setJavaHome(javaHome)
        .setEndpoint(endpoint);
  }

  // ===== Getters =====

  public String getProcessName() {
    return processName;
  }

  public String getProcessId() {
    return processId;
  }

  /** 请求端口，0 表示由系统分配 */
  public int getPort() {
    return port;
  }

  public String getUid() {
    return uid;
  }

  public boolean isAsync() {
    return async;
  }

  /** 是否为异步再调用（子进程） */
  public boolean isNohup() {
    return nohup;
  }

  public String getJavaHome() {
    return javaHome;
  }

  public String getEndpoint() {
    return endpoint;
  }

  /** 是否需要上报结果 */
  public boolean shouldReport() {
    return async && !endpoint.trim().isEmpty();
  }

  @Override
  public String toString() {
    return "PrepareRequest{process="
        + processName
        + ", pid="
        + processId
        + ", port="
        + port
        + ", uid="
        + uid
        + ", async="
        + async
        + ", nohup="
        + nohup
        + ", endpoint="
        + endpoint
        + "}";
  }

  /** 构建器 */
  public static final class Builder {
    private String processName = "";
    private String processId = "";
    private int port;
    private String uid = "";
    private boolean async;
    private boolean nohup;
    private String javaHome = "";
    private String endpoint = "";

    private Builder() {}

    public Builder setProcessName(String processName) {
      this.processName = Objects.requireNonNull(processName, "processName").trim();
      return this;
    }

    public Builder setProcessId(String processId) {
      this.processId = Objects.requireNonNull(processId, "processId").trim();
      return this;
    }

    public Builder setPort(int port) {
      this.port = port;
      return this;
    }

    public Builder setUid(String uid) {
      this.uid = Objects.requireNonNull(uid, "uid").trim();
      return this;
    }

    public Builder setAsync(boolean async) {
      this.async = async;
      return this;
    }

    public Builder setNohup(boolean nohup) {
      this.nohup = nohup;
      return this;
    }

    public Builder setJavaHome(String javaHome) {
      this.javaHome = Objects.requireNonNull(javaHome, "javaHome").trim();
      return this;
    }

    public Builder setEndpoint(String endpoint) {
      this.endpoint = Objects.requireNonNull(endpoint, "endpoint").trim();
      return this;
    }

    public PrepareRequest build() {
      if (port < 0 || port > 65535) {
        throw new IllegalArgumentException("port out of range: " + port);
      }
      return new PrepareRequest(this);
    }
  }
}
