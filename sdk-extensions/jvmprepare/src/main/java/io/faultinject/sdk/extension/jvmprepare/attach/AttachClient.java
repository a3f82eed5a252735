/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.attach;

/**
 * agent attach 客户端
 *
 * <p>只负责 attach 与握手，不读写准备记录。实现必须把所有失败转换为 {@link AttachOutcome#failed}，不抛出异常。
 */
public interface AttachClient {

  /**
   * 将 agent attach 到目标进程并确认其在指定端口提供服务
   *
   * @param port agent 端口
   * @param javaHome JDK 目录，空串表示使用当前 JVM
   * @param processId 目标进程号
   * @return attach 结果
   */
  AttachOutcome attach(int port, String javaHome, String processId);
}
