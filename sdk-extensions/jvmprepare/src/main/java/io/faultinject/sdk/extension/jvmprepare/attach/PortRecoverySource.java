/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.attach;

import java.util.Optional;

/**
 * 旁路端口恢复
 *
 * <p>只在 attach 以"连接被拒绝"失败后查询，用于发现 agent 实际绑定的端口。查询失败一律返回空。
 */
@FunctionalInterface
public interface PortRecoverySource {

  /**
   * 根据身份标识查找 agent 端口
   *
   * @param identity 身份标识（目标进程所属用户）
   * @return 端口
   */
  Optional<Integer> lookupPort(String identity);
}
