/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.attach;

import io.faultinject.sdk.extension.jvmprepare.PrepareException;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationRecord;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationRecordStore;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * attach 重试引擎
 *
 * <p>在 {@link AttachClient} 之上实现一次有界重试：
 * <ul>
 *   <li>首次 attach 失败、能识别目标用户且失败原因为 connection refused 时，
 *       从旁路来源查找 agent 实际监听的端口并重试一次
 *   <li>重试成功后修正记录中的端口，修正失败只记录告警
 * </ul>
 *
 * <p>另外负责在 attach 之后修正记录中的进程号。
 */
public final class AttachRetryEngine {

  private static final Logger logger = Logger.getLogger(AttachRetryEngine.class.getName());

  private final AttachClient attachClient;
  private final PortRecoverySource portRecoverySource;
  private final PreparationRecordStore store;

  public AttachRetryEngine(
      AttachClient attachClient,
      PortRecoverySource portRecoverySource,
      PreparationRecordStore store) {
    this.attachClient = attachClient;
    this.portRecoverySource = portRecoverySource;
    this.store = store;
  }

  /**
   * 执行 attach，必要时重试一次
   *
   * @param uid 记录 uid
   * @param port 首次尝试的端口
   * @param javaHome JDK 目录
   * @param processId 目标进程号
   * @return 最终结果，端口为实际使用的端口
   */
  public AttachOutcome attach(String uid, int port, String javaHome, String processId) {
    AttachOutcome first = attachClient.attach(port, javaHome, processId);
    if (first.isSuccess()) {
      return first;
    }
    if (first.getRecoveredIdentity().isEmpty() || !first.isConnectionRefused()) {
      logger.log(Level.INFO, "Attach failed without retry: {0}", first);
      return first;
    }

    Optional<Integer> recovered = lookupPort(first.getRecoveredIdentity());
    if (!recovered.isPresent()) {
      logger.log(
          Level.INFO,
          "No alternate port found for user {0}, uid={1}",
          new Object[] {first.getRecoveredIdentity(), uid});
      return first;
    }

    int retryPort = recovered.get();
    logger.log(
        Level.INFO,
        "Retrying attach on recovered port: uid={0}, port={1} -> {2}",
        new Object[] {uid, port, retryPort});
    AttachOutcome retry = attachClient.attach(retryPort, javaHome, processId);
    if (!retry.isSuccess()) {
      logger.log(Level.INFO, "Retry attach failed: {0}", retry);
      return retry;
    }

    try {
      store.updatePort(uid, retryPort);
    } catch (PrepareException e) {
      logger.log(
          Level.WARNING,
          "Failed to persist corrected port {0} for uid {1}: {2}",
          new Object[] {retryPort, uid, e.getMessage()});
    }
    return retry;
  }

  /**
   * 修正记录中的进程号
   *
   * <p>目标进程重启后 pid 发生变化，记录按实时 pid 更新。失败只记录告警。
   *
   * @param record 准备记录
   * @param liveProcessId 实时进程号
   */
  public void correctProcessId(PreparationRecord record, String liveProcessId) {
    if (liveProcessId.isEmpty() || liveProcessId.equals(record.getPid())) {
      return;
    }
    try {
      store.updateProcessId(record.getUid(), liveProcessId);
      logger.log(
          Level.INFO,
          "Corrected pid for uid {0}: {1} -> {2}",
          new Object[] {record.getUid(), record.getPid(), liveProcessId});
    } catch (PrepareException e) {
      logger.log(
          Level.WARNING,
          "Failed to correct pid for uid {0}: {1}",
          new Object[] {record.getUid(), e.getMessage()});
    }
  }

  private Optional<Integer> lookupPort(String identity) {
    try {
      return portRecoverySource.lookupPort(identity);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Port recovery lookup failed for user " + identity, e);
      return Optional.empty();
    }
  }
}
