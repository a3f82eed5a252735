/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.attach;

import io.faultinject.sdk.extension.jvmprepare.config.PrepareConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 从 sandbox token 文件恢复 agent 端口
 *
 * <p>sandbox agent 启动后会在目标进程所属用户的 home 目录追加一行：
 * <pre>
 *   namespace;token;ip;port
 * </pre>
 *
 * <p>取最后一条属于当前 namespace 的记录的端口字段。
 */
public final class SandboxTokenPortRecovery implements PortRecoverySource {

  private static final Logger logger = Logger.getLogger(SandboxTokenPortRecovery.class.getName());
  private static final Path PASSWD = Paths.get("/etc/passwd");

  private final String namespace;
  private final String tokenFileName;
  private final Function<String, Optional<Path>> homeResolver;

  /**
   * 从配置创建
   *
   * @param config 准备配置
   */
  public SandboxTokenPortRecovery(PrepareConfig config) {
    this(
        config.getSandboxNamespace(),
        config.getTokenFileName(),
        SandboxTokenPortRecovery::resolveUserHome);
  }

  SandboxTokenPortRecovery(
      String namespace, String tokenFileName, Function<String, Optional<Path>> homeResolver) {
    this.namespace = namespace;
    this.tokenFileName = tokenFileName;
    this.homeResolver = homeResolver;
  }

  @Override
  public Optional<Integer> lookupPort(String identity) {
    if (identity.isEmpty()) {
      return Optional.empty();
    }
    Optional<Path> home = homeResolver.apply(identity);
    if (!home.isPresent()) {
      logger.log(Level.WARNING, "Cannot resolve home directory of user {0}", identity);
      return Optional.empty();
    }
    Path tokenFile = home.get().resolve(tokenFileName);
    if (!Files.isReadable(tokenFile)) {
      logger.log(Level.INFO, "Sandbox token file not readable: {0}", tokenFile);
      return Optional.empty();
    }
    try {
      return parsePort(Files.readAllLines(tokenFile, StandardCharsets.UTF_8));
    } catch (IOException e) {
      logger.log(Level.WARNING, "Failed to read sandbox token file: " + tokenFile, e);
      return Optional.empty();
    }
  }

  /**
   * 解析 token 文件内容
   *
   * @param lines 文件行
   * @return 最后一条匹配 namespace 的端口
   */
  Optional<Integer> parsePort(List<String> lines) {
    String port = null;
    for (String line : lines) {
      String[] fields = line.trim().split(";");
      if (fields.length >= 4 && namespace.equals(fields[0].trim())) {
        port = fields[3].trim();
      }
    }
    if (port == null) {
      return Optional.empty();
    }
    try {
      int value = Integer.parseInt(port);
      if (value <= 0 || value > 65535) {
        logger.log(Level.WARNING, "Illegal port in sandbox token file: {0}", port);
        return Optional.empty();
      }
      return Optional.of(value);
    } catch (NumberFormatException e) {
      logger.log(Level.WARNING, "Illegal port in sandbox token file: {0}", port);
      return Optional.empty();
    }
  }

  /**
   * 解析用户 home 目录
   *
   * <p>优先读取 /etc/passwd，其次当前用户的 user.home，最后按惯例推断。
   */
  static Optional<Path> resolveUserHome(String username) {
    String fromPasswd = homeFromPasswd(username);
    if (fromPasswd != null) {
      return Optional.of(Paths.get(fromPasswd));
    }
    if (username.equals(System.getProperty("user.name"))) {
      return Optional.of(Paths.get(System.getProperty("user.home")));
    }
    if ("root".equals(username)) {
      return Optional.of(Paths.get("/root"));
    }
    return Optional.of(Paths.get("/home", username));
  }

  @Nullable
  private static String homeFromPasswd(String username) {
    if (!Files.isReadable(PASSWD)) {
      return null;
    }
    try {
      for (String line : Files.readAllLines(PASSWD, StandardCharsets.UTF_8)) {
        // name:password:uid:gid:gecos:home:shell
        String[] fields = line.split(":");
        if (fields.length >= 6 && username.equals(fields[0])) {
          return fields[5];
        }
      }
    } catch (IOException e) {
      logger.log(Level.FINE, "Failed to read /etc/passwd: {0}", e.getMessage());
    }
    return null;
  }
}
