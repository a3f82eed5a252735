/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.config;

import io.opentelemetry.sdk.autoconfigure.spi.ConfigProperties;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * JVM 准备配置
 *
 * <p>通过系统属性或环境变量覆盖，例如 {@code -Djvmprepare.storage.dir=/data/prepare} 或
 * {@code JVMPREPARE_STORAGE_DIR=/data/prepare}。
 */
public final class PrepareConfig {

  // ===== 配置键常量 =====

  // 记录存储
  private static final String STORAGE_DIR = "jvmprepare.storage.dir";

  // sandbox agent
  private static final String SANDBOX_HOME = "jvmprepare.sandbox.home";
  private static final String SANDBOX_NAMESPACE = "jvmprepare.sandbox.namespace";
  private static final String TOKEN_FILE = "jvmprepare.token.file";
  private static final String ATTACH_TIMEOUT = "jvmprepare.attach.timeout";

  // 异步准备
  private static final String ASYNC_GRACE = "jvmprepare.async.grace";
  private static final String ASYNC_LOG = "jvmprepare.async.log";

  // 结果上报
  private static final String REPORT_TIMEOUT = "jvmprepare.report.timeout";

  // ===== 默认值常量 =====
  private static final String DEFAULT_HOME_DIR = ".jvmprepare";
  private static final String DEFAULT_SANDBOX_NAMESPACE = "default";
  private static final String DEFAULT_TOKEN_FILE = ".sandbox.token";
  private static final String DEFAULT_ASYNC_LOG_NAME = "async-prepare.log";
  private static final Duration DEFAULT_ATTACH_TIMEOUT = Duration.ofSeconds(30);
  private static final Duration DEFAULT_ASYNC_GRACE = Duration.ofSeconds(1);
  private static final Duration DEFAULT_REPORT_TIMEOUT = Duration.ofSeconds(10);

  // ===== 配置字段 =====
  private final Path storageDir;
  private final Path sandboxHome;
  private final String sandboxNamespace;
  private final String tokenFileName;
  private final Duration attachTimeout;
  private final Duration asyncGrace;
  private final Path asyncLogFile;
  private final Duration reportTimeout;

  private PrepareConfig(Builder builder) {
    this.storageDir = builder.storageDir;
    this.sandboxHome = builder.sandboxHome != null
        ? builder.sandboxHome
        : builder.storageDir.resolve("sandbox");
    this.sandboxNamespace = builder.sandboxNamespace;
    this.tokenFileName = builder.tokenFileName;
    this.attachTimeout = builder.attachTimeout;
    this.asyncGrace = builder.asyncGrace;
    this.asyncLogFile = builder.asyncLogFile != null
        ? builder.asyncLogFile
        : builder.storageDir.resolve(DEFAULT_ASYNC_LOG_NAME);
    this.reportTimeout = builder.reportTimeout;
  }

  /**
   * 从 ConfigProperties 创建配置实例
   *
   * @param properties 配置属性
   * @return 准备配置
   */
  public static PrepareConfig create(ConfigProperties properties) {
    return builder().fromConfigProperties(properties).build();
  }

  /**
   * 创建构建器
   *
   * @return 构建器实例
   */
  public static Builder builder() {
    return new Builder();
  }

  // ===== Getters =====

  /** 记录存储目录 */
  public Path getStorageDir() {
    return storageDir;
  }

  /** sandbox 安装目录，agent jar 位于 {@code lib/sandbox-agent.jar} */
  public Path getSandboxHome() {
    return sandboxHome;
  }

  public Path getSandboxAgentJar() {
    return sandboxHome.resolve("lib").resolve("sandbox-agent.jar");
  }

  public String getSandboxNamespace() {
    return sandboxNamespace;
  }

  public String getTokenFileName() {
    return tokenFileName;
  }

  public Duration getAttachTimeout() {
    return attachTimeout;
  }

  /** 异步模式下父进程在返回前等待子进程拉起的时间 */
  public Duration getAsyncGrace() {
    return asyncGrace;
  }

  public Path getAsyncLogFile() {
    return asyncLogFile;
  }

  public Duration getReportTimeout() {
    return reportTimeout;
  }

  /** 构建器 */
  public static final class Builder {
    private Path storageDir = Paths.get(System.getProperty("user.home"), DEFAULT_HOME_DIR);
    @Nullable private Path sandboxHome;
    private String sandboxNamespace = DEFAULT_SANDBOX_NAMESPACE;
    private String tokenFileName = DEFAULT_TOKEN_FILE;
    private Duration attachTimeout = DEFAULT_ATTACH_TIMEOUT;
    private Duration asyncGrace = DEFAULT_ASYNC_GRACE;
    @Nullable private Path asyncLogFile;
    private Duration reportTimeout = DEFAULT_REPORT_TIMEOUT;

    private Builder() {}

    /**
     * 从 ConfigProperties 加载配置
     *
     * @param properties 配置属性
     * @return 构建器
     */
    public Builder fromConfigProperties(ConfigProperties properties) {
      String storage = properties.getString(STORAGE_DIR);
      if (storage != null && !storage.isEmpty()) {
        this.storageDir = Paths.get(storage);
      }

      String home = properties.getString(SANDBOX_HOME);
      if (home != null && !home.isEmpty()) {
        this.sandboxHome = Paths.get(home);
      }

      String namespace = properties.getString(SANDBOX_NAMESPACE);
      if (namespace != null && !namespace.isEmpty()) {
        this.sandboxNamespace = namespace;
      }

      String tokenFile = properties.getString(TOKEN_FILE);
      if (tokenFile != null && !tokenFile.isEmpty()) {
        this.tokenFileName = tokenFile;
      }

      Duration attach = properties.getDuration(ATTACH_TIMEOUT);
      if (attach != null) {
        this.attachTimeout = attach;
      }

      Duration grace = properties.getDuration(ASYNC_GRACE);
      if (grace != null) {
        this.asyncGrace = grace;
      }

      String asyncLog = properties.getString(ASYNC_LOG);
      if (asyncLog != null && !asyncLog.isEmpty()) {
        this.asyncLogFile = Paths.get(asyncLog);
      }

      Duration report = properties.getDuration(REPORT_TIMEOUT);
      if (report != null) {
        this.reportTimeout = report;
      }

      return this;
    }

    public Builder setStorageDir(Path storageDir) {
      this.storageDir = Objects.requireNonNull(storageDir, "storageDir");
      return this;
    }

    public Builder setSandboxHome(Path sandboxHome) {
      this.sandboxHome = Objects.requireNonNull(sandboxHome, "sandboxHome");
      return this;
    }

    public Builder setSandboxNamespace(String sandboxNamespace) {
      this.sandboxNamespace = Objects.requireNonNull(sandboxNamespace, "sandboxNamespace");
      return this;
    }

    public Builder setTokenFileName(String tokenFileName) {
      this.tokenFileName = Objects.requireNonNull(tokenFileName, "tokenFileName");
      return this;
    }

    public Builder setAttachTimeout(Duration attachTimeout) {
      this.attachTimeout = Objects.requireNonNull(attachTimeout, "attachTimeout");
      return this;
    }

    public Builder setAsyncGrace(Duration asyncGrace) {
      this.asyncGrace = Objects.requireNonNull(asyncGrace, "asyncGrace");
      return this;
    }

    public Builder setAsyncLogFile(Path asyncLogFile) {
      this.asyncLogFile = Objects.requireNonNull(asyncLogFile, "asyncLogFile");
      return this;
    }

    public Builder setReportTimeout(Duration reportTimeout) {
      this.reportTimeout = Objects.requireNonNull(reportTimeout, "reportTimeout");
      return this;
    }

    /**
     * 构建配置实例
     *
     * @return 配置实例
     */
    public PrepareConfig build() {
      validate();
      return new PrepareConfig(this);
    }

    private void validate() {
      if (attachTimeout.isNegative() || attachTimeout.isZero()) {
        throw new IllegalArgumentException("attachTimeout must be positive");
      }
      if (asyncGrace.isNegative()) {
        throw new IllegalArgumentException("asyncGrace must not be negative");
      }
      if (reportTimeout.isNegative() || reportTimeout.isZero()) {
        throw new IllegalArgumentException("reportTimeout must be positive");
      }
      if (sandboxNamespace.contains(";")) {
        throw new IllegalArgumentException("sandboxNamespace must not contain ';'");
      }
    }
  }
}
