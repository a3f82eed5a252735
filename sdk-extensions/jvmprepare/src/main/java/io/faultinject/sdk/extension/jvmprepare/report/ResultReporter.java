/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.report;

/**
 * 准备结果上报
 *
 * <p>尽力而为：任何失败都只记录日志，不影响准备结果。
 */
public interface ResultReporter {

  /**
   * 上报指定记录的最终状态
   *
   * @param uid 记录 uid
   * @param endpoint 上报地址
   */
  void report(String uid, String endpoint);
}
