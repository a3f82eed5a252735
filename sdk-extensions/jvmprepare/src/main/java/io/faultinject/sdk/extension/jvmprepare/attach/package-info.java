/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** agent attach、端口分配与端口恢复 */
@ParametersAreNonnullByDefault
package io.faultinject.sdk.extension.jvmprepare.attach;

import javax.annotation.ParametersAreNonnullByDefault;
