/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.prepare;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.faultinject.sdk.extension.jvmprepare.PrepareException;
import io.faultinject.sdk.extension.jvmprepare.dispatch.AsyncDispatcher;
import io.faultinject.sdk.extension.jvmprepare.process.ProcessResolver;
import io.faultinject.sdk.extension.jvmprepare.record.FilePreparationRecordStore;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationRecord;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationStatus;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

class PreparationCoordinatorTest {

  @TempDir Path tempDir;

  private FilePreparationRecordStore store;
  private ProcessResolver processResolver;
  private AsyncDispatcher asyncDispatcher;
  private AtomicInteger allocations;
  private PreparationCoordinator coordinator;

  @BeforeEach
  void setUp() {
    store = new FilePreparationRecordStore(tempDir.resolve("records"));
    processResolver = mock(ProcessResolver.class);
    when(processResolver.resolveProcessId("tomcat", "")).thenReturn("1234");
    when(processResolver.resolveProcessId("tomcat", "1234")).thenReturn("1234");
    asyncDispatcher = mock(AsyncDispatcher.class);
    allocations = new AtomicInteger();
    coordinator =
        new PreparationCoordinator(
            store,
            processResolver,
            () -> 34000 + allocations.getAndIncrement(),
            asyncDispatcher,
            Duration.ofMillis(50));
  }

  private static PrepareRequest.Builder tomcat() {
    return PrepareRequest.builder().setProcessName("tomcat");
  }

  @Test
  void missingTargetIsInvalidInput() {
    assertThatThrownBy(() -> coordinator.coordinate(PrepareRequest.builder().build()))
        .isInstanceOf(PrepareException.class)
        .satisfies(
            e ->
                assertThat(((PrepareException) e).getType())
                    .isEqualTo(PrepareException.Type.INVALID_INPUT));
    verify(processResolver, never()).resolveProcessId(any(), any());
  }

  @Test
  void resolutionFailureAborts() {
    when(processResolver.resolveProcessId("jetty", ""))
        .thenThrow(PrepareException.targetNotFound("no jetty"));

    assertThatThrownBy(
            () -> coordinator.coordinate(PrepareRequest.builder().setProcessName("jetty").build()))
        .isInstanceOf(PrepareException.class)
        .hasMessage("no jetty");
    assertThat(allocations.get()).isZero();
  }

  @Test
  void createsRecordWithAllocatedPort() {
    PrepareOutcome outcome = coordinator.coordinate(tomcat().build());

    assertThat(outcome.isShortCircuit()).isFalse();
    assertThat(outcome.getProcessId()).isEqualTo("1234");
    assertThat(outcome.getAttachPort()).isEqualTo(34000);
    assertThat(outcome.getRecord().getType()).isEqualTo(PreparationCoordinator.TYPE);
    assertThat(outcome.getRecord().getStatus()).isEqualTo(PreparationStatus.CREATED);
  }

  @Test
  void requestedPortIsUsedWithoutAllocation() {
    PrepareOutcome outcome = coordinator.coordinate(tomcat().setPort(36000).build());

    assertThat(outcome.getAttachPort()).isEqualTo(36000);
    assertThat(allocations.get()).isZero();
  }

  @Test
  void runningRecordIsReused() {
    PrepareOutcome first = coordinator.coordinate(tomcat().build());
    store.updateStatus(first.getUid(), PreparationStatus.RUNNING, "");

    PrepareOutcome second = coordinator.coordinate(tomcat().build());
    PrepareOutcome third = coordinator.coordinate(tomcat().setPort(34000).build());

    assertThat(second.getUid()).isEqualTo(first.getUid());
    assertThat(third.getUid()).isEqualTo(first.getUid());
    assertThat(allocations.get()).isEqualTo(1);
  }

  @Test
  void conflictingPortIsRejectedAndRecordUnchanged() {
    PrepareOutcome first = coordinator.coordinate(tomcat().build());
    PreparationRecord running =
        store.updateStatus(first.getUid(), PreparationStatus.RUNNING, "");

    assertThatThrownBy(() -> coordinator.coordinate(tomcat().setPort(35000).build()))
        .isInstanceOf(PrepareException.class)
        .hasMessageContaining("--port 34000")
        .satisfies(e -> assertThat(((PrepareException) e).isInvalidInput()).isTrue());
    assertThat(store.findByUid(first.getUid())).contains(running);
  }

  @Test
  void asyncDispatchesChildAndShortCircuits() {
    long start = System.nanoTime();
    PrepareOutcome outcome =
        coordinator.coordinate(tomcat().setAsync(true).setEndpoint("http://collector").build());
    long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

    assertThat(outcome.isShortCircuit()).isTrue();
    assertThat(elapsedMillis).isGreaterThanOrEqualTo(50);

    ArgumentCaptor<PrepareRequest> captor = ArgumentCaptor.forClass(PrepareRequest.class);
    verify(asyncDispatcher).dispatch(captor.capture());
    PrepareRequest child = captor.getValue();
    assertThat(child.getUid()).isEqualTo(outcome.getUid());
    assertThat(child.isNohup()).isTrue();
    assertThat(child.getPort()).isEqualTo(34000);
    assertThat(child.getProcessId()).isEqualTo("1234");
    assertThat(child.isAsync()).isTrue();
    assertThat(child.getEndpoint()).isEqualTo("http://collector");
  }

  @Test
  void asyncRequestForInFlightTargetIsNotDispatchedAgain() {
    PrepareOutcome first = coordinator.coordinate(tomcat().setAsync(true).build());
    PrepareOutcome second = coordinator.coordinate(tomcat().setAsync(true).build());

    assertThat(second.isShortCircuit()).isTrue();
    assertThat(second.getUid()).isEqualTo(first.getUid());
    assertThat(allocations.get()).isEqualTo(1);
    verify(asyncDispatcher).dispatch(any());
  }

  @Test
  void nohupResumesByUidWithoutSpawning() {
    PrepareOutcome parent = coordinator.coordinate(tomcat().setAsync(true).build());

    PrepareOutcome child =
        coordinator.coordinate(
            tomcat()
                .setProcessId("1234")
                .setUid(parent.getUid())
                .setNohup(true)
                .setAsync(true)
                .setPort(34000)
                .build());

    assertThat(child.isShortCircuit()).isFalse();
    assertThat(child.getUid()).isEqualTo(parent.getUid());
    assertThat(child.getAttachPort()).isEqualTo(34000);
    assertThat(allocations.get()).isEqualTo(1);
    verify(asyncDispatcher).dispatch(any());
  }

  @Test
  void nohupInheritsRecordPort() {
    PrepareOutcome parent = coordinator.coordinate(tomcat().setAsync(true).build());

    PrepareOutcome child =
        coordinator.coordinate(tomcat().setUid(parent.getUid()).setNohup(true).build());

    assertThat(child.getAttachPort()).isEqualTo(parent.getRecord().getPort());
  }

  @Test
  void nohupWithUnknownUidIsTargetNotFound() {
    assertThatThrownBy(
            () -> coordinator.coordinate(tomcat().setUid("missing").setNohup(true).build()))
        .isInstanceOf(PrepareException.class)
        .satisfies(
            e ->
                assertThat(((PrepareException) e).getType())
                    .isEqualTo(PrepareException.Type.TARGET_NOT_FOUND));
  }

  @Test
  void dispatchFailurePropagates() {
    doThrow(PrepareException.serverError("spawn failed", null))
        .when(asyncDispatcher)
        .dispatch(any());

    assertThatThrownBy(() -> coordinator.coordinate(tomcat().setAsync(true).build()))
        .isInstanceOf(PrepareException.class)
        .hasMessage("spawn failed");
  }
}
