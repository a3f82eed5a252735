/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.record;

import io.faultinject.sdk.extension.jvmprepare.PrepareException;
import java.util.Optional;
import java.util.function.IntSupplier;

/**
 * 准备记录存储
 *
 * <p>所有方法在存储不可用时抛出 {@link PrepareException.Type#PERSISTENCE_ERROR}。更新方法只修改指定字段，
 * {@code uid} 永不变化。
 */
public interface PreparationRecordStore {

  /**
   * 查询目标进程当前的 Running 记录
   *
   * @param type 准备类型
   * @param processName 进程名（可为空串）
   * @param processId 进程号（可为空串）
   * @return Running 记录
   */
  Optional<PreparationRecord> findRunning(String type, String processName, String processId);

  /**
   * 原子地"目标不存在活跃记录则插入，否则返回已有记录"
   *
   * <p>活跃记录指 Running 记录或 attach 仍在进行中的 Created 记录。
   *
   * <p>端口只在真正插入时才通过 {@code portSupplier} 获取，复用记录不会消耗端口。
   *
   * @param type 准备类型
   * @param processName 进程名
   * @param processId 进程号
   * @param portSupplier 新记录的端口来源
   * @return 插入结果
   */
  InsertResult insertIfNoneRunning(
      String type, String processName, String processId, IntSupplier portSupplier);

  /**
   * 按 uid 查询
   *
   * @param uid 记录 uid
   * @return 记录
   */
  Optional<PreparationRecord> findByUid(String uid);

  /**
   * 修正端口
   *
   * @param uid 记录 uid
   * @param port 新端口
   * @return 更新后的记录
   */
  PreparationRecord updatePort(String uid, int port);

  /**
   * 修正进程号（目标进程被替换后）
   *
   * @param uid 记录 uid
   * @param processId 新进程号
   * @return 更新后的记录
   */
  PreparationRecord updateProcessId(String uid, String processId);

  /**
   * 更新状态
   *
   * <p>提升为 Running 时，若同一目标已有其他 Running 记录，本记录改为 Error，调用方以返回值为准。
   *
   * @param uid 记录 uid
   * @param status 新状态
   * @param error 错误信息，成功时为空串
   * @return 更新后的记录
   */
  PreparationRecord updateStatus(String uid, PreparationStatus status, String error);

  /** 插入结果 */
  final class InsertResult {
    private final PreparationRecord record;
    private final boolean created;

    public InsertResult(PreparationRecord record, boolean created) {
      this.record = record;
      this.created = created;
    }

    public static InsertResult created(PreparationRecord record) {
      return new InsertResult(record, true);
    }

    public static InsertResult existing(PreparationRecord record) {
      return new InsertResult(record, false);
    }

    public PreparationRecord getRecord() {
      return record;
    }

    /** 是否本次新建 */
    public boolean isCreated() {
      return created;
    }
  }
}
