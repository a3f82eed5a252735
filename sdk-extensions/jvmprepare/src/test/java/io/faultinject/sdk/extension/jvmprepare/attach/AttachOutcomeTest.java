/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.attach;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AttachOutcomeTest {

  @Test
  void successHasNoIdentityByDefault() {
    AttachOutcome outcome = AttachOutcome.success(34000, "1.3.3");

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.getPort()).isEqualTo(34000);
    assertThat(outcome.getRecoveredIdentity()).isEmpty();
    assertThat(outcome.isConnectionRefused()).isFalse();
  }

  @Test
  void connectionRefusedIsCaseInsensitive() {
    AttachOutcome outcome =
        AttachOutcome.failed(
            34000, "access sandbox failed, Failed to connect: Connection refused", "admin");

    assertThat(outcome.isConnectionRefused()).isTrue();
    assertThat(outcome.getRecoveredIdentity()).isEqualTo("admin");
  }

  @Test
  void otherFailuresAreNotConnectionRefused() {
    assertThat(AttachOutcome.failed(34000, "timeout", "admin").isConnectionRefused()).isFalse();
  }
}
