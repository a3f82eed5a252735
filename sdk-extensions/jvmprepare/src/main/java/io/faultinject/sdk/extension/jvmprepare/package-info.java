/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * JVM agent 准备
 *
 * <p>负责把 sandbox agent attach 到运行中的 JVM，并以准备记录追踪每次 attach：
 *
 * <ul>
 *   <li>同一目标的重复准备复用 Running 记录
 *   <li>connection refused 时按 token 文件中的端口重试一次
 *   <li>异步模式由独立进程完成 attach 并上报结果
 * </ul>
 *
 * @see io.faultinject.sdk.extension.jvmprepare.JvmPreparationManager
 */
@ParametersAreNonnullByDefault
package io.faultinject.sdk.extension.jvmprepare;

import javax.annotation.ParametersAreNonnullByDefault;
