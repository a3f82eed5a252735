/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.process;

/**
 * 目标进程解析
 *
 * <p>把请求中的进程名和进程号解析为一个存活的 JVM 进程号。
 */
public interface ProcessResolver {

  /**
   * 解析目标进程号
   *
   * @param processName 进程名关键字，可为空串
   * @param processId 进程号，可为空串
   * @return 存活的进程号
   * @throws io.faultinject.sdk.extension.jvmprepare.PrepareException 进程不存在时为
   *     TARGET_NOT_FOUND，参数非法或匹配到多个进程时为 INVALID_INPUT
   */
  String resolveProcessId(String processName, String processId);
}
