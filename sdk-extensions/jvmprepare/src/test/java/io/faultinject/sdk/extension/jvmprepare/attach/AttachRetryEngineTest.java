/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.attach;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.faultinject.sdk.extension.jvmprepare.PrepareException;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationRecord;
import io.faultinject.sdk.extension.jvmprepare.record.PreparationRecordStore;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AttachRetryEngineTest {

  private static final String UID = "u1";

  private AttachClient attachClient;
  private PortRecoverySource recoverySource;
  private PreparationRecordStore store;
  private AttachRetryEngine engine;

  @BeforeEach
  void setUp() {
    attachClient = mock(AttachClient.class);
    recoverySource = mock(PortRecoverySource.class);
    store = mock(PreparationRecordStore.class);
    engine = new AttachRetryEngine(attachClient, recoverySource, store);
  }

  @Test
  void successDoesNotRetry() {
    when(attachClient.attach(34000, "", "1234")).thenReturn(AttachOutcome.success(34000, "ok"));

    AttachOutcome outcome = engine.attach(UID, 34000, "", "1234");

    assertThat(outcome.isSuccess()).isTrue();
    verify(attachClient, times(1)).attach(anyInt(), anyString(), anyString());
    verify(recoverySource, never()).lookupPort(anyString());
    verify(store, never()).updatePort(anyString(), anyInt());
  }

  @Test
  void connectionRefusedRetriesOnRecoveredPortAndPersistsIt() {
    when(attachClient.attach(34000, "", "1234"))
        .thenReturn(AttachOutcome.failed(34000, "connection refused", "admin"));
    when(recoverySource.lookupPort("admin")).thenReturn(Optional.of(41000));
    when(attachClient.attach(41000, "", "1234")).thenReturn(AttachOutcome.success(41000, "ok"));

    AttachOutcome outcome = engine.attach(UID, 34000, "", "1234");

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.getPort()).isEqualTo(41000);
    verify(store).updatePort(UID, 41000);
  }

  @Test
  void noRecoveredPortSurfacesFirstFailure() {
    AttachOutcome refused = AttachOutcome.failed(34000, "Connection refused", "admin");
    when(attachClient.attach(34000, "", "1234")).thenReturn(refused);
    when(recoverySource.lookupPort("admin")).thenReturn(Optional.empty());

    AttachOutcome outcome = engine.attach(UID, 34000, "", "1234");

    assertThat(outcome).isSameAs(refused);
    verify(attachClient, times(1)).attach(anyInt(), anyString(), anyString());
    verify(store, never()).updatePort(anyString(), anyInt());
  }

  @Test
  void recoveryLookupFailureMeansNoRetry() {
    when(attachClient.attach(34000, "", "1234"))
        .thenReturn(AttachOutcome.failed(34000, "connection refused", "admin"));
    when(recoverySource.lookupPort("admin")).thenThrow(new IllegalStateException("io"));

    AttachOutcome outcome = engine.attach(UID, 34000, "", "1234");

    assertThat(outcome.isSuccess()).isFalse();
    assertThat(outcome.getPort()).isEqualTo(34000);
    verify(attachClient, times(1)).attach(anyInt(), anyString(), anyString());
  }

  @Test
  void otherFailureIsNotRetried() {
    when(attachClient.attach(34000, "", "1234"))
        .thenReturn(AttachOutcome.failed(34000, "permission denied", "admin"));

    AttachOutcome outcome = engine.attach(UID, 34000, "", "1234");

    assertThat(outcome.isSuccess()).isFalse();
    verify(recoverySource, never()).lookupPort(anyString());
  }

  @Test
  void unknownIdentityIsNotRetried() {
    when(attachClient.attach(34000, "", "1234"))
        .thenReturn(AttachOutcome.failed(34000, "connection refused", ""));

    AttachOutcome outcome = engine.attach(UID, 34000, "", "1234");

    assertThat(outcome.isSuccess()).isFalse();
    verify(recoverySource, never()).lookupPort(anyString());
  }

  @Test
  void retryFailureIsReturned() {
    when(attachClient.attach(34000, "", "1234"))
        .thenReturn(AttachOutcome.failed(34000, "connection refused", "admin"));
    when(recoverySource.lookupPort("admin")).thenReturn(Optional.of(41000));
    when(attachClient.attach(41000, "", "1234"))
        .thenReturn(AttachOutcome.failed(41000, "connection refused", "admin"));

    AttachOutcome outcome = engine.attach(UID, 34000, "", "1234");

    assertThat(outcome.isSuccess()).isFalse();
    assertThat(outcome.getPort()).isEqualTo(41000);
    verify(attachClient, times(2)).attach(anyInt(), anyString(), anyString());
    verify(store, never()).updatePort(anyString(), anyInt());
  }

  @Test
  void portPersistFailureStillSucceeds() {
    when(attachClient.attach(34000, "", "1234"))
        .thenReturn(AttachOutcome.failed(34000, "connection refused", "admin"));
    when(recoverySource.lookupPort("admin")).thenReturn(Optional.of(41000));
    when(attachClient.attach(41000, "", "1234")).thenReturn(AttachOutcome.success(41000, "ok"));
    when(store.updatePort(UID, 41000))
        .thenThrow(PrepareException.persistenceError("disk full", null));

    AttachOutcome outcome = engine.attach(UID, 34000, "", "1234");

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.getPort()).isEqualTo(41000);
  }

  @Test
  void correctsPidOnlyWhenDifferent() {
    PreparationRecord record = PreparationRecord.create("jvm", "tomcat", "1234", 34000);

    engine.correctProcessId(record, "1234");
    verify(store, never()).updateProcessId(anyString(), anyString());

    engine.correctProcessId(record, "5678");
    verify(store).updateProcessId(record.getUid(), "5678");
  }

  @Test
  void pidCorrectionFailureIsSwallowed() {
    PreparationRecord record = PreparationRecord.create("jvm", "tomcat", "1234", 34000);
    when(store.updateProcessId(record.getUid(), "5678"))
        .thenThrow(PrepareException.persistenceError("disk full", null));

    engine.correctProcessId(record, "5678");

    verify(store).updateProcessId(record.getUid(), "5678");
  }
}
