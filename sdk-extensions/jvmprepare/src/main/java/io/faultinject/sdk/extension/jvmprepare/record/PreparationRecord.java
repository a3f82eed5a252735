/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.record;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * 准备记录
 *
 * <p>一条记录对应一次针对目标进程的 agent attach。记录不可变，字段修正通过 {@code withXxx} 生成新实例，
 * {@code uid} 在所有副本间保持不变。
 *
 * <p>JSON 结构（同时作为上报 body 的 {@code data} 字段）：
 * <pre>{@code
 * {
 *   "uid": "...", "type": "jvm", "process": "tomcat", "pid": "1234", "port": 34000,
 *   "status": "Running", "error": "", "running": true,
 *   "createTime": "2026-01-01T00:00:00Z", "updateTime": "2026-01-01T00:00:01Z"
 * }
 * }</pre>
 */
@JsonIgnoreProperties(value = {"running"}, allowGetters = true, ignoreUnknown = true)
public final class PreparationRecord {

  private final String uid;
  private final String type;
  private final String process;
  private final String pid;
  private final int port;
  private final PreparationStatus status;
  private final String error;
  private final String createTime;
  private final String updateTime;

  @JsonCreator
  public PreparationRecord(
      @JsonProperty("uid") String uid,
      @JsonProperty("type") String type,
      @JsonProperty("process") @Nullable String process,
      @JsonProperty("pid") @Nullable String pid,
      @JsonProperty("port") int port,
      @JsonProperty("status") @Nullable PreparationStatus status,
      @JsonProperty("error") @Nullable String error,
      @JsonProperty("createTime") @Nullable String createTime,
      @JsonProperty("updateTime") @Nullable String updateTime) {
    this.uid = Objects.requireNonNull(uid, "uid");
    this.type = Objects.requireNonNull(type, "type");
    this.process = process != null ? process : "";
    this.pid = pid != null ? pid : "";
    this.port = port;
    this.status = status != null ? status : PreparationStatus.CREATED;
    this.error = error != null ? error : "";
    this.createTime = createTime != null ? createTime : "";
    this.updateTime = updateTime != null ? updateTime : "";
  }

  /**
   * 创建新记录，生成新的 uid
   *
   * @param type 准备类型
   * @param process 进程名（可为空串）
   * @param pid 进程号
   * @param port agent 端口
   * @return 状态为 Created 的新记录
   */
  public static PreparationRecord create(String type, String process, String pid, int port) {
    String now = Instant.now().toString();
    return new PreparationRecord(
        newUid(), type, process, pid, port, PreparationStatus.CREATED, "", now, now);
  }

  /** 生成 uid：去掉连字符的随机 UUID */
  static String newUid() {
    return UUID.randomUUID().toString().replace("-", "");
  }

  // ===== 字段修正 =====

  public PreparationRecord withPort(int newPort) {
    return new PreparationRecord(
        uid, type, process, pid, newPort, status, error, createTime, Instant.now().toString());
  }

  public PreparationRecord withPid(String newPid) {
    return new PreparationRecord(
        uid, type, process, newPid, port, status, error, createTime, Instant.now().toString());
  }

  public PreparationRecord withStatus(PreparationStatus newStatus, String newError) {
    return new PreparationRecord(
        uid, type, process, pid, port, newStatus, newError, createTime, Instant.now().toString());
  }

  // ===== Getters =====

  @JsonProperty("uid")
  public String getUid() {
    return uid;
  }

  @JsonProperty("type")
  public String getType() {
    return type;
  }

  @JsonProperty("process")
  public String getProcess() {
    return process;
  }

  @JsonProperty("pid")
  public String getPid() {
    return pid;
  }

  @JsonProperty("port")
  public int getPort() {
    return port;
  }

  @JsonProperty("status")
  public PreparationStatus getStatus() {
    return status;
  }

  @JsonProperty("error")
  public String getError() {
    return error;
  }

  @JsonProperty("running")
  public boolean isRunning() {
    return status == PreparationStatus.RUNNING;
  }

  @JsonProperty("createTime")
  public String getCreateTime() {
    return createTime;
  }

  @JsonProperty("updateTime")
  public String getUpdateTime() {
    return updateTime;
  }

  /**
   * 判断记录是否属于给定目标
   *
   * <p>请求带进程名时按进程名匹配（pid 可以不同，由调用方随后修正）；只带 pid 时按 pid 匹配。
   *
   * @param processName 请求的进程名
   * @param processId 请求的进程号
   * @return 是否匹配
   */
  public boolean matchesTarget(String processName, String processId) {
    if (!processName.isEmpty()) {
      return processName.equals(process);
    }
    return !processId.isEmpty() && processId.equals(pid);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PreparationRecord)) {
      return false;
    }
    PreparationRecord that = (PreparationRecord) o;
    return port == that.port
        && uid.equals(that.uid)
        && type.equals(that.type)
        && process.equals(that.process)
        && pid.equals(that.pid)
        && status == that.status
        && error.equals(that.error)
        && createTime.equals(that.createTime)
        && updateTime.equals(that.updateTime);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uid, type, process, pid, port, status, error, createTime, updateTime);
  }

  @Override
  public String toString() {
    return "PreparationRecord{uid="
        + uid
        + ", type="
        + type
        + ", process="
        + process
        + ", pid="
        + pid
        + ", port="
        + port
        + ", status="
        + status.getValue()
        + "}";
  }
}
