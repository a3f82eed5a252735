/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.faultinject.sdk.extension.jvmprepare.PrepareException;
import io.faultinject.sdk.extension.jvmprepare.config.PrepareConfig;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationRecord;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationRecordStore;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * 基于 OkHttp 的结果上报
 *
 * <p>按 uid 读取记录，封装为 {@link ReportEnvelope} 后以 JSON POST 到上报地址。HTTP 200 视为成功，
 * 其余情况只记录告警，不重试。
 */
public final class HttpResultReporter implements ResultReporter, Closeable {

  private static final Logger logger = Logger.getLogger(HttpResultReporter.class.getName());
  private static final MediaType JSON_TYPE = MediaType.parse("application/json");

  /** 上报类型 */
  public static final String TYPE = "JAVA_AGENT_PREPARE";

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private final PreparationRecordStore store;
  private final OkHttpClient httpClient;

  public HttpResultReporter(PreparationRecordStore store, PrepareConfig config) {
    this.store = store;
    Duration timeout = config.getReportTimeout();
    this.httpClient =
        new OkHttpClient.Builder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .writeTimeout(timeout)
            .retryOnConnectionFailure(false)
            .build();
  }

  @Override
  public void report(String uid, String endpoint) {
    byte[] body;
    try {
      Optional<PreparationRecord> record = store.findByUid(uid);
      if (!record.isPresent()) {
        logger.log(Level.WARNING, "Skip report, preparation record not found, uid: {0}", uid);
        return;
      }
      body = objectMapper.writeValueAsBytes(new ReportEnvelope(record.get(), TYPE));
    } catch (PrepareException | JsonProcessingException e) {
      logger.log(
          Level.WARNING,
          "Skip report, cannot build report body for uid {0}: {1}",
          new Object[] {uid, e.getMessage()});
      return;
    }

    Request request;
    try {
      request = new Request.Builder().url(endpoint).post(RequestBody.create(body, JSON_TYPE)).build();
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Skip report, illegal endpoint: {0}", endpoint);
      return;
    }

    try (Response response = httpClient.newCall(request).execute()) {
      if (response.code() != 200) {
        logger.log(
            Level.WARNING,
            "Report preparation result failed, uid={0}, endpoint={1}, code={2}",
            new Object[] {uid, endpoint, response.code()});
        return;
      }
      logger.log(
          Level.INFO, "Reported preparation result, uid={0}, endpoint={1}",
          new Object[] {uid, endpoint});
    } catch (IOException e) {
      logger.log(
          Level.WARNING,
          "Report preparation result failed, uid={0}, endpoint={1}: {2}",
          new Object[] {uid, endpoint, e.getMessage()});
    }
  }

  @Override
  public void close() {
    httpClient.dispatcher().executorService().shutdown();
    httpClient.connectionPool().evictAll();
  }
}
