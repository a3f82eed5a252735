/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationRecord;

/** 上报 body：{@code {"data": <record>, "type": "JAVA_AGENT_PREPARE"}} */
public final class ReportEnvelope {

  private final PreparationRecord data;
  private final String type;

  @JsonCreator
  public ReportEnvelope(
      @JsonProperty("data") PreparationRecord data, @JsonProperty("type") String type) {
    this.data = data;
    this.type = type;
  }

  @JsonProperty("data")
  public PreparationRecord getData() {
    return data;
  }

  @JsonProperty("type")
  public String getType() {
    return type;
  }
}
