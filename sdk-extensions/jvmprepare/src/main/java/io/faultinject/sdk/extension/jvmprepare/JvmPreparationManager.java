/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare;

import io.faultinject.sdk.extension.jvmprepare.attach.AttachClient;
import io.faultinject.sdk.extension.jvmprepare.attach.AttachOutcome;
import io.faultinject.sdk.extension.jvmprepare.attach.AttachRetryEngine;
import io.faultinject.sdk.extension.jvmprepare.attach.LocalPortAllocator;
import io.faultinject.sdk.extension.jvmprepare.attach.PortAllocator;
import io.faultinject.sdk.extension.jvmprepare.attach.PortRecoverySource;
import io.faultinject.sdk.extension.jvmprepare.attach.SandboxAttachClient;
import io.faultinject.sdk.extension.jvmprepare.attach.SandboxTokenPortRecovery;
import io.faultinject.sdk.extension.jvmprepare.config.PrepareConfig;
import io.faultinject.sdk.extension.jvmprepare.dispatch.AsyncDispatcher;
import io.faultinject.sdk.extension.jvmprepare.dispatch.ProcessAsyncDispatcher;
import io.faultinject.sdk.extension.jvmprepare.prepare.PreparationCoordinator;
import io.faultinject.sdk.extension.jvmprepare.prepare.PrepareOutcome;
import io.faultinject.sdk.extension.jvmprepare.prepare.PrepareRequest;
import io.faultinject.sdk.extension.jvmprepare.process.LocalProcessResolver;
import io.faultinject.sdk.extension.jvmprepare.process.ProcessResolver;
import io.faultinject.sdk.extension.jvmprepare.record.FilePreparationRecordStore;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationRecord;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationRecordStore;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationStatus;
import io.faultinject.sdk.extension.jvmprepare.report.HttpResultReporter;
import io.faultinject.sdk.extension.jvmprepare.report.ResultReporter;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * JVM 准备管理器
 *
 * <p>串联完整的准备流程：
 * <pre>
 *   协调（记录复用/创建、异步派发）
 *     → attach（含一次有界重试与端口修正）
 *     → 状态更新（Running / Error）
 *     → 进程号修正
 *     → 结果上报（异步且配置了 endpoint）
 * </pre>
 *
 * <p>状态更新、进程号修正和上报的失败只记录日志，不改变返回结果。
 */
public final class JvmPreparationManager implements Closeable {

  private static final Logger logger = Logger.getLogger(JvmPreparationManager.class.getName());

  private final PreparationRecordStore store;
  private final PreparationCoordinator coordinator;
  private final AttachRetryEngine retryEngine;
  private final ResultReporter resultReporter;
  private final List<Closeable> resources;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private JvmPreparationManager(Builder builder, PrepareConfig config) {
    this.store = builder.store;
    this.coordinator =
        new PreparationCoordinator(
            builder.store,
            builder.processResolver,
            builder.portAllocator,
            builder.asyncDispatcher,
            config.getAsyncGrace());
    this.retryEngine =
        new AttachRetryEngine(builder.attachClient, builder.portRecoverySource, builder.store);
    this.resultReporter = builder.resultReporter;
    this.resources = builder.resources;
  }

  /**
   * Creates a manager wired with the local implementations.
   *
   * @param config the preparation configuration
   * @return the manager
   */
  public static JvmPreparationManager create(PrepareConfig config) {
    return builder().setConfig(config).build();
  }

  /**
   * Creates a new builder.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * 执行一次准备
   *
   * @param request 准备请求
   * @return 命令响应，成功时 result 为记录 uid
   */
  public PrepareResponse prepare(PrepareRequest request) {
    logger.log(Level.INFO, "Preparing jvm: {0}", request);

    PrepareOutcome outcome;
    try {
      outcome = coordinator.coordinate(request);
    } catch (PrepareException e) {
      logger.log(Level.WARNING, "Preparation rejected: {0}", e.getMessage());
      return PrepareResponse.failed(e, request.getUid());
    }

    PreparationRecord record = outcome.getRecord();
    if (outcome.isShortCircuit()) {
      return PrepareResponse.success(record.getUid());
    }

    AttachOutcome attach =
        retryEngine.attach(
            record.getUid(),
            outcome.getAttachPort(),
            request.getJavaHome(),
            outcome.getProcessId());
    boolean promoted = updateStatus(record.getUid(), attach);
    retryEngine.correctProcessId(record, outcome.getProcessId());

    if (request.shouldReport()) {
      resultReporter.report(record.getUid(), request.getEndpoint());
    }

    if (attach.isSuccess() && !promoted) {
      return PrepareResponse.failed(
          PrepareException.conflictingParameters(
              "another running preparation record exists for the target"),
          record.getUid());
    }
    if (attach.isSuccess()) {
      logger.log(
          Level.INFO,
          "Preparation succeeded: uid={0}, port={1}",
          new Object[] {record.getUid(), attach.getPort()});
      return PrepareResponse.success(record.getUid());
    }
    return PrepareResponse.failed(
        PrepareException.attachFailure(attach.getMessage()), record.getUid());
  }

  /**
   * 查询准备记录
   *
   * @param uid 记录 uid
   * @return 命令响应，成功时 result 为记录
   */
  public PrepareResponse status(String uid) {
    try {
      if (uid.trim().isEmpty()) {
        throw PrepareException.invalidInput("less --uid flag");
      }
      PreparationRecord record =
          store.findByUid(uid.trim())
              .orElseThrow(
                  () -> PrepareException.targetNotFound("preparation record not found, uid: " + uid));
      return PrepareResponse.success(record);
    } catch (PrepareException e) {
      return PrepareResponse.failed(e, "");
    }
  }

  /** 更新记录状态，返回 attach 成功时记录是否成为 Running；存储失败只记录日志 */
  private boolean updateStatus(String uid, AttachOutcome attach) {
    try {
      if (attach.isSuccess()) {
        return store.updateStatus(uid, PreparationStatus.RUNNING, "").isRunning();
      }
      store.updateStatus(uid, PreparationStatus.ERROR, attach.getMessage());
    } catch (PrepareException e) {
      logger.log(
          Level.WARNING,
          "Failed to update preparation status, uid={0}: {1}",
          new Object[] {uid, e.getMessage()});
    }
    return true;
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      for (Closeable resource : resources) {
        try {
          resource.close();
        } catch (IOException e) {
          logger.log(Level.FINE, "Failed to close {0}: {1}", new Object[] {resource, e.getMessage()});
        }
      }
    }
  }

  /** Builder for {@link JvmPreparationManager}. */
  public static final class Builder {
    @Nullable private PrepareConfig config;
    @Nullable private PreparationRecordStore store;
    @Nullable private ProcessResolver processResolver;
    @Nullable private PortAllocator portAllocator;
    @Nullable private AttachClient attachClient;
    @Nullable private PortRecoverySource portRecoverySource;
    @Nullable private AsyncDispatcher asyncDispatcher;
    @Nullable private ResultReporter resultReporter;
    private final List<Closeable> resources = new ArrayList<>();

    private Builder() {}

    public Builder setConfig(PrepareConfig config) {
      this.config = config;
      return this;
    }

    public Builder setStore(PreparationRecordStore store) {
      this.store = store;
      return this;
    }

    public Builder setProcessResolver(ProcessResolver processResolver) {
      this.processResolver = processResolver;
      return this;
    }

    public Builder setPortAllocator(PortAllocator portAllocator) {
      this.portAllocator = portAllocator;
      return this;
    }

    public Builder setAttachClient(AttachClient attachClient) {
      this.attachClient = attachClient;
      return this;
    }

    public Builder setPortRecoverySource(PortRecoverySource portRecoverySource) {
      this.portRecoverySource = portRecoverySource;
      return this;
    }

    public Builder setAsyncDispatcher(AsyncDispatcher asyncDispatcher) {
      this.asyncDispatcher = asyncDispatcher;
      return this;
    }

    public Builder setResultReporter(ResultReporter resultReporter) {
      this.resultReporter = resultReporter;
      return this;
    }

    /**
     * Builds the manager, filling unset collaborators with the local implementations.
     *
     * @return the manager
     */
    public JvmPreparationManager build() {
      if (config == null) {
        throw new IllegalStateException("config is required");
      }
      if (store == null) {
        store = FilePreparationRecordStore.create(config);
      }
      if (processResolver == null) {
        processResolver = new LocalProcessResolver();
      }
      if (portAllocator == null) {
        portAllocator = new LocalPortAllocator();
      }
      if (attachClient == null) {
        SandboxAttachClient client = new SandboxAttachClient(config);
        resources.add(client);
        attachClient = client;
      }
      if (portRecoverySource == null) {
        portRecoverySource = new SandboxTokenPortRecovery(config);
      }
      if (asyncDispatcher == null) {
        asyncDispatcher = new ProcessAsyncDispatcher(config);
      }
      if (resultReporter == null) {
        HttpResultReporter reporter = new HttpResultReporter(store, config);
        resources.add(reporter);
        resultReporter = reporter;
      }
      return new JvmPreparationManager(this, config);
    }
  }
}
