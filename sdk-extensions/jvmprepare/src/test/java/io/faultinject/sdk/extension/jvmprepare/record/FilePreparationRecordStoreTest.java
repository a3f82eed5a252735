/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.record;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.faultinject.sdk.extension.jvmprepare.PrepareException;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationRecordStore.InsertResult;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FilePreparationRecordStoreTest {

  @TempDir Path tempDir;

  private FilePreparationRecordStore store;

  @BeforeEach
  void setUp() {
    store = new FilePreparationRecordStore(tempDir.resolve("records"));
  }

  @Test
  void insertCreatesRecordWithSuppliedPort() {
    InsertResult result = store.insertIfNoneRunning("jvm", "tomcat", "1234", () -> 34000);

    assertThat(result.isCreated()).isTrue();
    assertThat(result.getRecord().getPort()).isEqualTo(34000);
    assertThat(result.getRecord().getStatus()).isEqualTo(PreparationStatus.CREATED);
    assertThat(store.findByUid(result.getRecord().getUid())).contains(result.getRecord());
  }

  @Test
  void inFlightCreatedRecordIsReused() {
    InsertResult first = store.insertIfNoneRunning("jvm", "tomcat", "1234", () -> 34000);
    InsertResult second = store.insertIfNoneRunning("jvm", "tomcat", "1234", () -> 34001);

    assertThat(second.isCreated()).isFalse();
    assertThat(second.getRecord().getUid()).isEqualTo(first.getRecord().getUid());
    assertThat(second.getRecord().getPort()).isEqualTo(34000);
  }

  @Test
  void staleCreatedRecordDoesNotBlockNewInsert() {
    FilePreparationRecordStore expiring =
        new FilePreparationRecordStore(tempDir.resolve("records"), Duration.ZERO);
    InsertResult first = expiring.insertIfNoneRunning("jvm", "tomcat", "1234", () -> 34000);
    InsertResult second = expiring.insertIfNoneRunning("jvm", "tomcat", "1234", () -> 34001);

    assertThat(second.isCreated()).isTrue();
    assertThat(second.getRecord().getUid()).isNotEqualTo(first.getRecord().getUid());
  }

  @Test
  void errorRecordDoesNotBlockNewInsert() {
    InsertResult first = store.insertIfNoneRunning("jvm", "tomcat", "1234", () -> 34000);
    store.updateStatus(first.getRecord().getUid(), PreparationStatus.ERROR, "refused");

    InsertResult second = store.insertIfNoneRunning("jvm", "tomcat", "1234", () -> 34001);

    assertThat(second.isCreated()).isTrue();
    assertThat(second.getRecord().getPort()).isEqualTo(34001);
  }

  @Test
  void promotionIsRefusedWhenTargetAlreadyRunning() {
    FilePreparationRecordStore expiring =
        new FilePreparationRecordStore(tempDir.resolve("records"), Duration.ZERO);
    PreparationRecord stale =
        expiring.insertIfNoneRunning("jvm", "tomcat", "1234", () -> 34000).getRecord();
    PreparationRecord fresh =
        expiring.insertIfNoneRunning("jvm", "tomcat", "1234", () -> 34001).getRecord();
    expiring.updateStatus(fresh.getUid(), PreparationStatus.RUNNING, "");

    PreparationRecord refused =
        expiring.updateStatus(stale.getUid(), PreparationStatus.RUNNING, "");

    assertThat(refused.getStatus()).isEqualTo(PreparationStatus.ERROR);
    assertThat(refused.getError()).contains(fresh.getUid());
    assertThat(expiring.findRunning("jvm", "tomcat", "1234"))
        .hasValueSatisfying(r -> assertThat(r.getUid()).isEqualTo(fresh.getUid()));
  }

  @Test
  void runningRecordIsReusedWithoutConsumingPort() {
    InsertResult first = store.insertIfNoneRunning("jvm", "tomcat", "1234", () -> 34000);
    store.updateStatus(first.getRecord().getUid(), PreparationStatus.RUNNING, "");
    AtomicInteger allocations = new AtomicInteger();

    InsertResult second =
        store.insertIfNoneRunning(
            "jvm", "tomcat", "1234", () -> 30000 + allocations.incrementAndGet());

    assertThat(second.isCreated()).isFalse();
    assertThat(second.getRecord().getUid()).isEqualTo(first.getRecord().getUid());
    assertThat(allocations.get()).isZero();
  }

  @Test
  void findRunningMatchesByNameOrPid() {
    InsertResult named = store.insertIfNoneRunning("jvm", "tomcat", "1234", () -> 34000);
    store.updateStatus(named.getRecord().getUid(), PreparationStatus.RUNNING, "");
    InsertResult byPid = store.insertIfNoneRunning("jvm", "", "5678", () -> 34001);
    store.updateStatus(byPid.getRecord().getUid(), PreparationStatus.RUNNING, "");

    assertThat(store.findRunning("jvm", "tomcat", "9999"))
        .hasValueSatisfying(r -> assertThat(r.getUid()).isEqualTo(named.getRecord().getUid()));
    assertThat(store.findRunning("jvm", "", "5678"))
        .hasValueSatisfying(r -> assertThat(r.getUid()).isEqualTo(byPid.getRecord().getUid()));
    assertThat(store.findRunning("jvm", "jetty", "")).isEmpty();
    assertThat(store.findRunning("cplus", "tomcat", "1234")).isEmpty();
  }

  @Test
  void updatesChangeOnlyTheirField() {
    PreparationRecord record =
        store.insertIfNoneRunning("jvm", "tomcat", "1234", () -> 34000).getRecord();

    store.updatePort(record.getUid(), 35000);
    store.updateProcessId(record.getUid(), "5678");
    PreparationRecord updated =
        store.updateStatus(record.getUid(), PreparationStatus.ERROR, "boom");

    assertThat(updated.getUid()).isEqualTo(record.getUid());
    assertThat(updated.getPort()).isEqualTo(35000);
    assertThat(updated.getPid()).isEqualTo("5678");
    assertThat(updated.getProcess()).isEqualTo("tomcat");
    assertThat(updated.getStatus()).isEqualTo(PreparationStatus.ERROR);
    assertThat(updated.getError()).isEqualTo("boom");
    assertThat(store.findByUid(record.getUid())).contains(updated);
  }

  @Test
  void updateOfUnknownUidIsPersistenceError() {
    assertThatThrownBy(() -> store.updatePort("missing", 1))
        .isInstanceOf(PrepareException.class)
        .satisfies(
            e ->
                assertThat(((PrepareException) e).getType())
                    .isEqualTo(PrepareException.Type.PERSISTENCE_ERROR));
  }

  @Test
  void findByUnknownUidIsEmpty() {
    assertThat(store.findByUid("missing")).isEmpty();
  }

  @Test
  void illegalUidIsRejected() {
    assertThatThrownBy(() -> store.findByUid("../etc/passwd"))
        .isInstanceOf(PrepareException.class)
        .satisfies(e -> assertThat(((PrepareException) e).isInvalidInput()).isTrue());
  }

  @Test
  void corruptFileIsSkipped() throws Exception {
    Files.write(
        tempDir.resolve("records").resolve("broken.json"),
        "{not json".getBytes(StandardCharsets.UTF_8));

    InsertResult result = store.insertIfNoneRunning("jvm", "tomcat", "1234", () -> 34000);

    assertThat(result.isCreated()).isTrue();
  }

  @Test
  void recordsSurviveReopen() {
    PreparationRecord record =
        store.insertIfNoneRunning("jvm", "tomcat", "1234", () -> 34000).getRecord();
    store.updateStatus(record.getUid(), PreparationStatus.RUNNING, "");

    FilePreparationRecordStore reopened =
        new FilePreparationRecordStore(tempDir.resolve("records"));

    assertThat(reopened.findRunning("jvm", "tomcat", "1234"))
        .hasValueSatisfying(r -> assertThat(r.getUid()).isEqualTo(record.getUid()));
  }

  @Test
  void concurrentPreparationsOfEmptyTargetShareOneRecord() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(4);
    CountDownLatch start = new CountDownLatch(1);
    Set<String> uids = ConcurrentHashMap.newKeySet();
    AtomicInteger allocations = new AtomicInteger();
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < 8; i++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  String uid =
                      store.insertIfNoneRunning(
                              "jvm", "tomcat", "1234", () -> 35000 + allocations.getAndIncrement())
                          .getRecord()
                          .getUid();
                  uids.add(uid);
                  store.updateStatus(uid, PreparationStatus.RUNNING, "");
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(uids).hasSize(1);
    assertThat(allocations.get()).isEqualTo(1);
    try (Stream<Path> files = Files.list(tempDir.resolve("records"))) {
      assertThat(files.filter(f -> f.toString().endsWith(".json"))).hasSize(1);
    }
  }
}
