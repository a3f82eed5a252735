/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 准备配置 */
@ParametersAreNonnullByDefault
package io.faultinject.sdk.extension.jvmprepare.config;

import javax.annotation.ParametersAreNonnullByDefault;
