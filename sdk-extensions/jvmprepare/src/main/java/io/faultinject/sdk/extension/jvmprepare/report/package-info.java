/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 准备结果上报 */
@ParametersAreNonnullByDefault
package io.faultinject.sdk.extension.jvmprepare.report;

import javax.annotation.ParametersAreNonnullByDefault;
