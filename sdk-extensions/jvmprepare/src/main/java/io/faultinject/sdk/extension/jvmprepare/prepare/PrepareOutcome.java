/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.prepare;

import io.faultinject.sdk.extension.jvmprepare.record.PreparationRecord;

/**
 * 协调结果
 *
 * <ul>
 *   <li>resolved：记录已确定，调用方继续执行 attach
 *   <li>shortCircuit：已交给异步子进程处理，调用方直接返回 uid
 * </ul>
 */
public final class PrepareOutcome {

  private final PreparationRecord record;
  private final String processId;
  private final int attachPort;
  private final boolean shortCircuit;

  private PrepareOutcome(
      PreparationRecord record, String processId, int attachPort, boolean shortCircuit) {
    this.record = record;
    this.processId = processId;
    this.attachPort = attachPort;
    this.shortCircuit = shortCircuit;
  }

  public static PrepareOutcome resolved(
      PreparationRecord record, String processId, int attachPort) {
    return new PrepareOutcome(record, processId, attachPort, false);
  }

  public static PrepareOutcome shortCircuit(PreparationRecord record, String processId) {
    return new PrepareOutcome(record, processId, record.getPort(), true);
  }

  public PreparationRecord getRecord() {
    return record;
  }

  public String getUid() {
    return record.getUid();
  }

  /** 实时解析出的进程号，可能与记录中的不同 */
  public String getProcessId() {
    return processId;
  }

  public int getAttachPort() {
    return attachPort;
  }

  public boolean isShortCircuit() {
    return shortCircuit;
  }
}
