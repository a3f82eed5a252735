/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.attach;

/** 本地端口分配 */
@FunctionalInterface
public interface PortAllocator {

  /**
   * 分配一个当前未被占用的本地端口
   *
   * @return 端口
   * @throws io.faultinject.sdk.extension.jvmprepare.PrepareException 分配失败（SERVER_ERROR）
   */
  int allocateUnusedPort();
}
