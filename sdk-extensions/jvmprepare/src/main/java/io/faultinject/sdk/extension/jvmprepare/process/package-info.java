/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 目标进程解析 */
@ParametersAreNonnullByDefault
package io.faultinject.sdk.extension.jvmprepare.process;

import javax.annotation.ParametersAreNonnullByDefault;
