/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 异步再调用分发 */
@ParametersAreNonnullByDefault
package io.faultinject.sdk.extension.jvmprepare.dispatch;

import javax.annotation.ParametersAreNonnullByDefault;
