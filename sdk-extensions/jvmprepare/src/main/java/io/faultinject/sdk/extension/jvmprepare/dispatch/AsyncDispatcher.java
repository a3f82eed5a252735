/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.dispatch;

import io.faultinject.sdk.extension.jvmprepare.prepare.PrepareRequest;

/**
 * 异步再调用分发器
 *
 * <p>把带有 uid、端口和 nohup 标记的请求交给独立的执行单元，调用方不等待其完成。
 */
public interface AsyncDispatcher {

  /**
   * 分发再调用请求
   *
   * @param request 已填充 uid、port 且 nohup 为 true 的请求
   * @throws io.faultinject.sdk.extension.jvmprepare.PrepareException 无法启动时为 SERVER_ERROR
   */
  void dispatch(PrepareRequest request);
}
