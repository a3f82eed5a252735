/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.record;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * 准备记录状态
 *
 * <pre>
 *   Created ──attach 成功──▶ Running
 *      │
 *      └────attach 失败──▶ Error
 * </pre>
 *
 * <p>Running 和进行中的 Created 参与去重；Error 记录和遗留的 Created 记录不会阻止新的准备流程。
 */
public enum PreparationStatus {
  /** 已创建，attach 尚未完成 */
  CREATED("Created"),
  /** agent 已 attach */
  RUNNING("Running"),
  /** attach 失败 */
  ERROR("Error");

  private final String value;

  PreparationStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * 从存储值解析状态，大小写不敏感
   *
   * @param value 存储值
   * @return 状态
   */
  @JsonCreator
  public static PreparationStatus fromValue(String value) {
    for (PreparationStatus status : values()) {
      if (status.value.equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException(
        "Unknown preparation status: " + value.toLowerCase(Locale.ROOT));
  }
}
