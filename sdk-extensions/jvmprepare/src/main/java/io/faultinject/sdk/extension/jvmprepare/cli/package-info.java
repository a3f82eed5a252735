/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/** 命令行入口 */
@ParametersAreNonnullByDefault
package io.faultinject.sdk.extension.jvmprepare.cli;

import javax.annotation.ParametersAreNonnullByDefault;
