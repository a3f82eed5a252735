/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.attach;

import io.faultinject.sdk.extension.jvmprepare.PrepareException;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.logging.Level;
import java.util.logging.Logger;

/** 通过绑定 0 端口让操作系统挑选空闲端口 */
public final class LocalPortAllocator implements PortAllocator {

  private static final Logger logger = Logger.getLogger(LocalPortAllocator.class.getName());

  @Override
  public int allocateUnusedPort() {
    try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      socket.setReuseAddress(true);
      int port = socket.getLocalPort();
      logger.log(Level.FINE, "Allocated unused port: {0}", port);
      return port;
    } catch (IOException e) {
      throw PrepareException.serverError("get sandbox port err, " + e.getMessage(), e);
    }
  }
}
