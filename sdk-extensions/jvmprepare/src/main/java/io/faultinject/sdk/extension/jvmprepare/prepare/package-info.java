/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 准备请求协调 */
@ParametersAreNonnullByDefault
package io.faultinject.sdk.extension.jvmprepare.prepare;

import javax.annotation.ParametersAreNonnullByDefault;
