/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import javax.annotation.Nullable;

/**
 * 命令响应
 *
 * <p>每次命令输出一行 JSON：
 * <pre>{@code
 * {"code":200,"success":true,"result":"4f3c..."}
 * {"code":47001,"success":false,"result":"4f3c...","error":"..."}
 * }</pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PrepareResponse {

  /** 成功响应码 */
  public static final int OK = 200;

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private final int code;
  private final boolean success;
  @Nullable private final Object result;
  @Nullable private final String error;

  @JsonCreator
  public PrepareResponse(
      @JsonProperty("code") int code,
      @JsonProperty("success") boolean success,
      @JsonProperty("result") @Nullable Object result,
      @JsonProperty("error") @Nullable String error) {
    this.code = code;
    this.success = success;
    this.result = result;
    this.error = error;
  }

  public static PrepareResponse success(Object result) {
    return new PrepareResponse(OK, true, result, null);
  }

  /**
   * 失败响应
   *
   * @param exception 失败原因
   * @param uid 已知的记录 uid，未知时为空串
   * @return 响应
   */
  public static PrepareResponse failed(PrepareException exception, String uid) {
    return new PrepareResponse(
        exception.getCode(), false, uid.isEmpty() ? null : uid, exception.getMessage());
  }

  @JsonProperty("code")
  public int getCode() {
    return code;
  }

  @JsonProperty("success")
  public boolean isSuccess() {
    return success;
  }

  @Nullable
  @JsonProperty("result")
  public Object getResult() {
    return result;
  }

  @Nullable
  @JsonProperty("error")
  public String getError() {
    return error;
  }

  /** 序列化为单行 JSON */
  public String toJson() {
    try {
      return objectMapper.writeValueAsString(this);
    } catch (JsonProcessingException e) {
      return "{\"code\":"
          + PrepareException.Type.SERVER_ERROR.getCode()
          + ",\"success\":false,\"error\":\"serialize response failed\"}";
    }
  }

  @Override
  public String toString() {
    return toJson();
  }
}
