/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.dispatch;

import io.faultinject.sdk.extension.jvmprepare.PrepareException;
import io.faultinject.sdk.extension.jvmprepare.prepare.PrepareRequest;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 进程内异步分发器
 *
 * <p>把再调用请求作为后台任务交给 {@link Executor}，适用于嵌入式调用。任务异常只记录日志。
 */
public final class ExecutorAsyncDispatcher implements AsyncDispatcher {

  private static final Logger logger = Logger.getLogger(ExecutorAsyncDispatcher.class.getName());

  private final Executor executor;
  private final Consumer<PrepareRequest> handler;

  /**
   * 创建分发器
   *
   * @param executor 执行后台任务的线程池
   * @param handler 再调用处理逻辑，通常为 {@code manager::prepare}
   */
  public ExecutorAsyncDispatcher(Executor executor, Consumer<PrepareRequest> handler) {
    this.executor = executor;
    this.handler = handler;
  }

  @Override
  public void dispatch(PrepareRequest request) {
    try {
      executor.execute(() -> run(request));
    } catch (RejectedExecutionException e) {
      throw PrepareException.serverError("async prepare task rejected, uid: " + request.getUid(), e);
    }
  }

  private void run(PrepareRequest request) {
    try {
      handler.accept(request);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Async preparation failed, uid=" + request.getUid(), e);
    }
  }
}
