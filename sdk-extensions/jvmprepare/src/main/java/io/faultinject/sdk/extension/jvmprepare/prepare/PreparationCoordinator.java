/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.prepare;

import io.faultinject.sdk.extension.jvmprepare.PrepareException;
import io.faultinject.sdk.extension.jvmprepare.attach.PortAllocator;
import io.faultinject.sdk.extension.jvmprepare.dispatch.AsyncDispatcher;
import io.faultinject.sdk.extension.jvmprepare.process.ProcessResolver;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationRecord;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationRecordStore;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationRecordStore.InsertResult;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationStatus;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 准备协调器
 *
 * <p>负责把一次准备请求落到唯一的准备记录上：
 * <pre>
 *   1. 校验目标参数并解析实时进程号
 *   2. 异步再调用（nohup）：按 uid 找回父进程创建的记录，不再派生
 *   3. 否则原子地"无活跃记录则插入"，端口只在新建时分配
 *   4. 复用活跃记录时，请求端口与记录端口不一致则拒绝
 *   5. 异步模式：派发再调用，等待 grace 后直接返回 uid；
 *      复用的记录仍在 Created 状态时说明已有流程在处理，不重复派发
 * </pre>
 */
public final class PreparationCoordinator {

  private static final Logger logger = Logger.getLogger(PreparationCoordinator.class.getName());

  /** 准备类型 */
  public static final String TYPE = "jvm";

  private final PreparationRecordStore store;
  private final ProcessResolver processResolver;
  private final PortAllocator portAllocator;
  private final AsyncDispatcher asyncDispatcher;
  private final Duration asyncGrace;

  public PreparationCoordinator(
      PreparationRecordStore store,
      ProcessResolver processResolver,
      PortAllocator portAllocator,
      AsyncDispatcher asyncDispatcher,
      Duration asyncGrace) {
    this.store = store;
    this.processResolver = processResolver;
    this.portAllocator = portAllocator;
    this.asyncDispatcher = asyncDispatcher;
    this.asyncGrace = asyncGrace;
  }

  /**
   * 协调一次准备请求
   *
   * @param request 准备请求
   * @return 协调结果
   * @throws PrepareException 参数、解析、持久化或派发失败
   */
  public PrepareOutcome coordinate(PrepareRequest request) {
    if (request.getProcessName().isEmpty() && request.getProcessId().isEmpty()) {
      throw PrepareException.invalidInput("less --process or --pid flags");
    }
    String processId =
        processResolver.resolveProcessId(request.getProcessName(), request.getProcessId());

    if (request.isNohup() && !request.getUid().isEmpty()) {
      return resumeByUid(request, processId);
    }

    InsertResult inserted =
        store.insertIfNoneRunning(
            TYPE,
            request.getProcessName(),
            processId,
            () -> request.getPort() != 0 ? request.getPort() : portAllocator.allocateUnusedPort());
    PreparationRecord record = inserted.getRecord();

    if (inserted.isCreated()) {
      logger.log(Level.INFO, "Created preparation record: {0}", record);
    } else {
      checkPortConflict(request, record);
      logger.log(Level.INFO, "Reusing active preparation record: {0}", record);
    }

    if (request.isNohup()) {
      return PrepareOutcome.resolved(record, processId, attachPort(request, record));
    }
    if (request.isAsync()) {
      if (!inserted.isCreated() && record.getStatus() == PreparationStatus.CREATED) {
        logger.log(
            Level.INFO, "Preparation already in flight, uid={0}, skip dispatch", record.getUid());
        return PrepareOutcome.shortCircuit(record, processId);
      }
      return dispatch(request, record, processId);
    }
    return PrepareOutcome.resolved(record, processId, record.getPort());
  }

  // ===== 异步 =====

  private PrepareOutcome resumeByUid(PrepareRequest request, String processId) {
    PreparationRecord record =
        store.findByUid(request.getUid())
            .orElseThrow(
                () ->
                    PrepareException.targetNotFound(
                        "preparation record not found, uid: " + request.getUid()));
    logger.log(Level.INFO, "Resuming preparation in detached process: {0}", record);
    return PrepareOutcome.resolved(record, processId, attachPort(request, record));
  }

  private PrepareOutcome dispatch(
      PrepareRequest request, PreparationRecord record, String processId) {
    PrepareRequest child =
        request.toBuilder()
            .setUid(record.getUid())
            .setPort(record.getPort())
            .setProcessId(processId)
            .setNohup(true)
            .build();
    asyncDispatcher.dispatch(child);
    logger.log(Level.INFO, "Dispatched asynchronous preparation, uid={0}", record.getUid());

    if (!asyncGrace.isZero()) {
      try {
        Thread.sleep(asyncGrace.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    return PrepareOutcome.shortCircuit(record, processId);
  }

  // ===== 辅助方法 =====

  private static void checkPortConflict(PrepareRequest request, PreparationRecord record) {
    if (request.getPort() != 0 && request.getPort() != record.getPort()) {
      throw PrepareException.conflictingParameters(
          "the process has been executed prepare command, if you want to re-prepare, "
              + "please append or modify the --port "
              + record.getPort()
              + " argument in prepare command for retry");
    }
  }

  private static int attachPort(PrepareRequest request, PreparationRecord record) {
    return request.getPort() != 0 ? request.getPort() : record.getPort();
  }
}
