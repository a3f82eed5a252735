/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 准备记录与存储 */
@ParametersAreNonnullByDefault
package io.faultinject.sdk.extension.jvmprepare.record;

import javax.annotation.ParametersAreNonnullByDefault;
