/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.faultinject.sdk.extension.jvmprepare.record;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.faultinject.sdk.extension.jvmprepare.PrepareException;
import io.faultinject.sdk.extension.jvmprepare.config.PrepareConfig;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.IntSupplier;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 基于本地文件的准备记录存储
 *
 * <p>每条记录一个 {@code <uid>.json} 文件，写入采用"临时文件 + 原子改名"。
 *
 * <p>并发控制：
 * <ul>
 *   <li>同一 JVM 内通过对象锁串行化
 *   <li>跨进程通过 {@code .lock} 文件上的排他 {@link FileLock} 串行化
 * </ul>
 *
 * <p>因此 {@link #insertIfNoneRunning} 对并发的 CLI 调用和异步子进程都是原子的。
 *
 * <p>去重时 Running 记录和仍在进行中的 Created 记录都视为目标的活跃记录。Created 记录超过
 * {@code inFlightTimeout} 未更新即视为遗留（进程中途退出），不再阻止新的准备。状态提升为 Running
 * 同样在锁内检查，同一目标已有其他 Running 记录时改为 Error。
 */
public final class FilePreparationRecordStore implements PreparationRecordStore {

  private static final Logger logger = Logger.getLogger(FilePreparationRecordStore.class.getName());
  private static final String FILE_EXTENSION = ".json";
  private static final String TEMP_SUFFIX = ".tmp";
  private static final String LOCK_FILE = ".lock";
  private static final String RECORDS_DIR = "records";
  private static final Duration DEFAULT_IN_FLIGHT_TIMEOUT = Duration.ofMinutes(5);
  /** 一次准备最多两次 attach，每次包含加载和探测两段超时 */
  private static final int IN_FLIGHT_ATTACH_FACTOR = 10;

  private static final ObjectMapper objectMapper =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final Path recordsDir;
  private final Path lockFile;
  private final Duration inFlightTimeout;
  private final Object monitor = new Object();

  /**
   * 从配置创建存储
   *
   * @param config 准备配置
   * @return 存储实例
   */
  public static FilePreparationRecordStore create(PrepareConfig config) {
    return new FilePreparationRecordStore(
        config.getStorageDir().resolve(RECORDS_DIR),
        config.getAttachTimeout().multipliedBy(IN_FLIGHT_ATTACH_FACTOR));
  }

  /**
   * 创建存储
   *
   * @param recordsDir 记录目录
   */
  public FilePreparationRecordStore(Path recordsDir) {
    this(recordsDir, DEFAULT_IN_FLIGHT_TIMEOUT);
  }

  /**
   * 创建存储
   *
   * @param recordsDir 记录目录
   * @param inFlightTimeout Created 记录被视为进行中的最长时间
   */
  public FilePreparationRecordStore(Path recordsDir, Duration inFlightTimeout) {
    this.recordsDir = recordsDir;
    this.lockFile = recordsDir.resolve(LOCK_FILE);
    this.inFlightTimeout = inFlightTimeout;
    ensureStorageDirectory();
  }

  private void ensureStorageDirectory() {
    try {
      if (!Files.exists(recordsDir)) {
        Files.createDirectories(recordsDir);
        logger.log(Level.FINE, "Created record directory: {0}", recordsDir);
      }
    } catch (IOException e) {
      throw PrepareException.persistenceError(
          "failed to create record directory " + recordsDir + ", " + e.getMessage(), e);
    }
  }

  @Override
  public Optional<PreparationRecord> findRunning(
      String type, String processName, String processId) {
    return withLock(() -> findRunningUnlocked(type, processName, processId));
  }

  @Override
  public InsertResult insertIfNoneRunning(
      String type, String processName, String processId, IntSupplier portSupplier) {
    return withLock(
        () -> {
          Optional<PreparationRecord> active = findActiveUnlocked(type, processName, processId);
          if (active.isPresent()) {
            return InsertResult.existing(active.get());
          }
          int port = portSupplier.getAsInt();
          PreparationRecord record = PreparationRecord.create(type, processName, processId, port);
          write(record);
          logger.log(Level.INFO, "Inserted preparation record: {0}", record);
          return InsertResult.created(record);
        });
  }

  @Override
  public Optional<PreparationRecord> findByUid(String uid) {
    return withLock(() -> read(uid));
  }

  @Override
  public PreparationRecord updatePort(String uid, int port) {
    return update(uid, record -> record.withPort(port));
  }

  @Override
  public PreparationRecord updateProcessId(String uid, String processId) {
    return update(uid, record -> record.withPid(processId));
  }

  @Override
  public PreparationRecord updateStatus(String uid, PreparationStatus status, String error) {
    if (status != PreparationStatus.RUNNING) {
      return update(uid, record -> record.withStatus(status, error));
    }
    return update(
        uid,
        record -> {
          Optional<PreparationRecord> other =
              loadAll().stream()
                  .filter(r -> !r.getUid().equals(uid))
                  .filter(r -> r.getType().equals(record.getType()))
                  .filter(PreparationRecord::isRunning)
                  .filter(r -> r.matchesTarget(record.getProcess(), record.getPid()))
                  .findFirst();
          if (other.isPresent()) {
            logger.log(
                Level.WARNING,
                "Refusing to promote {0}, target already has running record {1}",
                new Object[] {uid, other.get().getUid()});
            return record.withStatus(
                PreparationStatus.ERROR,
                "another running preparation record exists, uid: " + other.get().getUid());
          }
          return record.withStatus(status, error);
        });
  }

  private PreparationRecord update(String uid, UnaryOperator<PreparationRecord> change) {
    return withLock(
        () -> {
          PreparationRecord current =
              read(uid)
                  .orElseThrow(
                      () -> PrepareException.persistenceError(
                          "preparation record not found, uid: " + uid, null));
          PreparationRecord updated = change.apply(current);
          write(updated);
          logger.log(Level.FINE, "Updated preparation record: {0}", updated);
          return updated;
        });
  }

  // ===== 未加锁的内部实现，调用方必须持有锁 =====

  private Optional<PreparationRecord> findRunningUnlocked(
      String type, String processName, String processId) {
    return loadAll().stream()
        .filter(r -> r.getType().equals(type))
        .filter(PreparationRecord::isRunning)
        .filter(r -> r.matchesTarget(processName, processId))
        .max(Comparator.comparing(PreparationRecord::getUpdateTime));
  }

  private Optional<PreparationRecord> findActiveUnlocked(
      String type, String processName, String processId) {
    Instant now = Instant.now();
    return loadAll().stream()
        .filter(r -> r.getType().equals(type))
        .filter(r -> r.isRunning() || isInFlight(r, now))
        .filter(r -> r.matchesTarget(processName, processId))
        // Running 优先于进行中的 Created
        .max(
            Comparator.comparing(PreparationRecord::isRunning)
                .thenComparing(PreparationRecord::getUpdateTime));
  }

  private boolean isInFlight(PreparationRecord record, Instant now) {
    if (record.getStatus() != PreparationStatus.CREATED) {
      return false;
    }
    try {
      return Instant.parse(record.getUpdateTime()).plus(inFlightTimeout).isAfter(now);
    } catch (DateTimeParseException e) {
      logger.log(Level.FINE, "Illegal update time of record {0}", record.getUid());
      return false;
    }
  }

  private List<PreparationRecord> loadAll() {
    List<PreparationRecord> records = new ArrayList<>();
    try (DirectoryStream<Path> stream =
        Files.newDirectoryStream(recordsDir, "*" + FILE_EXTENSION)) {
      for (Path file : stream) {
        try {
          records.add(objectMapper.readValue(file.toFile(), PreparationRecord.class));
        } catch (IOException e) {
          // 损坏的单个文件不影响其他记录
          logger.log(Level.WARNING, "Skip unreadable record file: " + file, e);
        }
      }
    } catch (IOException e) {
      throw PrepareException.persistenceError(
          "failed to list preparation records, " + e.getMessage(), e);
    }
    return records;
  }

  private Optional<PreparationRecord> read(String uid) {
    Path file = recordFile(uid);
    try {
      return Optional.of(objectMapper.readValue(file.toFile(), PreparationRecord.class));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      if (!Files.exists(file)) {
        return Optional.empty();
      }
      throw PrepareException.persistenceError(
          "failed to read preparation record " + uid + ", " + e.getMessage(), e);
    }
  }

  private void write(PreparationRecord record) {
    Path target = recordFile(record.getUid());
    Path temp = recordsDir.resolve(record.getUid() + TEMP_SUFFIX);
    try {
      Files.write(temp, objectMapper.writeValueAsBytes(record));
      try {
        Files.move(
            temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw PrepareException.persistenceError(
          "failed to write preparation record " + record.getUid() + ", " + e.getMessage(), e);
    }
  }

  private Path recordFile(String uid) {
    if (uid.isEmpty() || uid.contains("/") || uid.contains("\\") || uid.contains("..")) {
      throw PrepareException.invalidInput("illegal uid: " + uid);
    }
    return recordsDir.resolve(uid + FILE_EXTENSION);
  }

  private <T> T withLock(LockedAction<T> action) {
    synchronized (monitor) {
      try (FileChannel channel =
              FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
          FileLock ignored = channel.lock()) {
        return action.run();
      } catch (IOException e) {
        throw PrepareException.persistenceError(
            "failed to lock record store " + lockFile + ", " + e.getMessage(), e);
      }
    }
  }

  @FunctionalInterface
  private interface LockedAction<T> {
    T run();
  }
}
