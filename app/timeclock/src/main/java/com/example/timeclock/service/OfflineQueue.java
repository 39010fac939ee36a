/*
 * どこで: Timeclock サービス層
 * 何を: 勤怠サービスへ未送信の打刻を保持する永続 FIFO
 * なぜ: キオスクで受け付けた打刻をネットワーク断やプロセス停止から守るため
 */
package com.example.timeclock.service;

import com.example.timeclock.config.PunchSyncProperties;
import com.example.timeclock.gateway.AttendanceSoapMessages;
import com.example.timeclock.model.PhotoState;
import com.example.timeclock.model.PunchRecord;
import com.example.timeclock.model.PunchStatus;
import com.example.timeclock.model.QueueSummary;
import com.example.timeclock.repository.PunchPhotoRepository;
import com.example.timeclock.repository.PunchQueueRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class OfflineQueue {

  private static final Logger logger = LoggerFactory.getLogger(OfflineQueue.class);

  private final PunchQueueRepository queueRepository;
  private final PunchPhotoRepository photoRepository;
  private final PunchSyncProperties properties;
  private final Clock clock;
  private final TransactionTemplate transactionTemplate;
  private final ReentrantLock writeLock = new ReentrantLock();

  public OfflineQueue(
      PunchQueueRepository queueRepository,
      PunchPhotoRepository photoRepository,
      PunchSyncProperties properties,
      Clock clock,
      PlatformTransactionManager transactionManager) {
    this.queueRepository = queueRepository;
    this.photoRepository = photoRepository;
    this.properties = properties;
    this.clock = clock;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /**
   * 打刻と写真を 1 トランザクションで保存する。
   *
   * @return 同じ punch id が既にキューにある場合は false
   * @throws OfflineQueueStorageException ストアの失敗時、またはキューが満杯のとき
   */
  public boolean enqueue(PunchRecord record, byte[] photoBytes) {
    if (record.status() != PunchStatus.OFFLINE_QUEUED) {
      throw new IllegalArgumentException(
          "only OFFLINE_QUEUED punches can be enqueued punchId="
              + record.punchId()
              + " status="
              + record.status());
    }
    final boolean withPhoto = record.photoState() == PhotoState.PENDING;
    if (withPhoto && (photoBytes == null || photoBytes.length == 0)) {
      throw new IllegalArgumentException(
          "punch with a pending photo needs photo bytes punchId=" + record.punchId());
    }
    final Instant now = Instant.now(clock);
    final boolean inserted =
        withWriteLock(
            "enqueue",
            record.punchId(),
            () ->
                transactionTemplate.execute(
                    status -> {
                      if (queueRepository.findById(record.punchId()).isPresent()) {
                        return false;
                      }
                      if (properties.maxRecords() > 0
                          && queueRepository.countActive() >= properties.maxRecords()) {
                        throw new OfflineQueueStorageException(
                            "offline queue is full maxRecords=" + properties.maxRecords());
                      }
                      if (!queueRepository.insertIfAbsent(record, now)) {
                        return false;
                      }
                      if (withPhoto) {
                        photoRepository.insert(
                            record.punchId(),
                            AttendanceSoapMessages.photoFileName(
                                record.imageEmployeeId(), record.punchTimestamp()),
                            photoBytes,
                            now);
                      }
                      return true;
                    }));
    if (!inserted) {
      logger.warn("punch already queued, duplicate enqueue ignored punchId={}", record.punchId());
    }
    return inserted;
  }

  /** 送信順の有効レコード。キューは変更しない。 */
  public List<PunchRecord> peekOldestUnsynced(int maxCount) {
    return read("peek", () -> queueRepository.findOldestActive(maxCount));
  }

  /** 待機中のレコードを SYNCING にする。既に SYNCING のものはそのまま再開する。 */
  public PunchRecord markSyncing(PunchRecord record) {
    if (record.status() == PunchStatus.SYNCING) {
      return record;
    }
    final PunchRecord syncing = record.transitionTo(PunchStatus.SYNCING);
    final int updated =
        withWriteLock(
            "markSyncing",
            record.punchId(),
            () ->
                queueRepository.updateStatus(
                    record.punchId(),
                    PunchStatus.OFFLINE_QUEUED,
                    PunchStatus.SYNCING,
                    Instant.now(clock)));
    if (updated == 0) {
      throw new IllegalStateException("punch is no longer queued punchId=" + record.punchId());
    }
    return syncing;
  }

  /** リモートが打刻を受理したことを保存し、二度と送信しないようにする。 */
  public void markSubmitted(UUID punchId) {
    final int updated =
        withWriteLock(
            "markSubmitted",
            punchId,
            () -> queueRepository.markAccepted(punchId, Instant.now(clock)));
    if (updated == 0) {
      logger.warn("punch acceptance not persisted, record missing punchId={}", punchId);
    }
  }

  /** 送信が成功し得ない写真を破棄する。打刻自体は引き続き同期する。 */
  public void markPhotoUnavailable(UUID punchId) {
    withWriteLock(
        "markPhotoUnavailable",
        punchId,
        () ->
            transactionTemplate.execute(
                status -> {
                  photoRepository.delete(punchId);
                  return queueRepository.updatePhotoState(
                      punchId, PhotoState.UNAVAILABLE, Instant.now(clock));
                }));
  }

  /** レコードを削除し、写真を解放する。 */
  public void markSynced(UUID punchId) {
    withWriteLock(
        "markSynced",
        punchId,
        () ->
            transactionTemplate.execute(
                status -> {
                  photoRepository.delete(punchId);
                  return queueRepository.delete(punchId);
                }));
  }

  /**
   * 役割:
   * - 一時的な失敗を記録し、次の試行時刻を決める。
   *
   * 動作:
   * - 打刻が受理済みのレコードは写真だけを再送する。maxAttempts に達したら写真を諦め、同期済みとして
   *   完了させる。
   * - 戻り値は再送が残っていれば OFFLINE_QUEUED、maxAttempts に達したら REJECTED、受理済み打刻の
   *   写真だけが残っていた場合は SYNCED。
   */
  public PunchStatus markFailed(PunchRecord record, String error) {
    final int nextAttempt = record.syncAttempts() + 1;
    final boolean exhausted = properties.maxAttempts() > 0 && nextAttempt >= properties.maxAttempts();
    if (exhausted && record.punchAccepted()) {
      return abandonPhoto(record, nextAttempt, error);
    }
    final PunchStatus next = exhausted ? PunchStatus.REJECTED : PunchStatus.OFFLINE_QUEUED;
    if (record.status() == PunchStatus.SYNCING) {
      record.transitionTo(next);
    }
    final Instant now = Instant.now(clock);
    final Instant nextRetryAt = exhausted ? null : now.plus(computeBackoffDuration(nextAttempt));
    final int updated =
        withWriteLock(
            "markFailed",
            record.punchId(),
            () ->
                queueRepository.markRetry(
                    record.punchId(),
                    nextAttempt,
                    truncateError(error),
                    nextRetryAt,
                    exhausted,
                    now));
    if (updated == 0) {
      logger.warn(
          "punch retry not recorded, record no longer active punchId={} attempt={}",
          record.punchId(),
          nextAttempt);
      return record.status();
    }
    if (exhausted) {
      logger.error(
          "punch rejected after max attempts punchId={} employee={} timestamp={} attempts={}",
          record.punchId(),
          record.rawEmployeeId(),
          record.punchTimestamp(),
          nextAttempt);
    } else {
      logger.warn(
          "punch retry scheduled punchId={} attempt={} nextRetryAt={}",
          record.punchId(),
          nextAttempt,
          nextRetryAt);
    }
    return next;
  }

  private PunchStatus abandonPhoto(PunchRecord record, int attempts, String error) {
    if (record.status() == PunchStatus.SYNCING) {
      record.transitionTo(PunchStatus.SYNCED);
    }
    withWriteLock(
        "abandonPhoto",
        record.punchId(),
        () ->
            transactionTemplate.execute(
                status -> {
                  photoRepository.delete(record.punchId());
                  return queueRepository.delete(record.punchId());
                }));
    logger.error(
        "punch photo given up after max attempts, swipe already recorded punchId={} imageEmployeeId={} attempts={} lastError={}",
        record.punchId(),
        record.imageEmployeeId(),
        attempts,
        truncateError(error));
    return PunchStatus.SYNCED;
  }

  /** 業務的な拒否を記録する。レコードは確認用に残し、再送しない。 */
  public void markRejected(PunchRecord record, String error) {
    if (record.status() == PunchStatus.SYNCING) {
      record.transitionTo(PunchStatus.REJECTED);
    }
    final int updated =
        withWriteLock(
            "markRejected",
            record.punchId(),
            () ->
                queueRepository.markRejected(
                    record.punchId(), truncateError(error), Instant.now(clock)));
    if (updated == 0) {
      logger.warn("punch rejection not recorded, record no longer active punchId={}", record.punchId());
    }
  }

  public Optional<byte[]> loadPhoto(UUID punchId) {
    return read("loadPhoto", () -> photoRepository.findBytes(punchId));
  }

  public boolean hasPendingFor(String rawEmployeeId) {
    return read("hasPendingFor", () -> queueRepository.existsActiveForEmployee(rawEmployeeId));
  }

  public int countActive() {
    return read("countActive", queueRepository::countActive);
  }

  public QueueSummary summary() {
    return read("summary", queueRepository::summarize);
  }

  public List<PunchRecord> findAll(int limit) {
    return read("findAll", () -> queueRepository.findAll(limit));
  }

  public Optional<PunchRecord> find(UUID punchId) {
    return read("find", () -> queueRepository.findById(punchId));
  }

  /**
   * 作成から {@code maxAgeDays} 日を超えたレコードを写真ごと削除する。
   *
   * @return 削除したレコード。いずれも同期されていない
   */
  public List<PunchRecord> purgeExpired(int maxAgeDays) {
    final Instant threshold = Instant.now(clock).minus(Duration.ofDays(maxAgeDays));
    final List<PunchRecord> purged =
        withWriteLock(
            "purgeExpired",
            null,
            () ->
                transactionTemplate.execute(
                    status -> {
                      final List<PunchRecord> expired =
                          queueRepository.findCreatedBefore(threshold);
                      for (PunchRecord record : expired) {
                        photoRepository.delete(record.punchId());
                      }
                      queueRepository.deleteCreatedBefore(threshold);
                      photoRepository.deleteOrphans();
                      return expired;
                    }));
    for (PunchRecord record : purged) {
      logger.error(
          "unsynced punch purged by retention, data lost punchId={} employee={} timestamp={} status={} attempts={} lastError={}",
          record.punchId(),
          record.rawEmployeeId(),
          record.punchTimestamp(),
          record.status(),
          record.syncAttempts(),
          record.lastError());
    }
    return purged;
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), attempt - 1);
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    return Duration.ofMillis((long) Math.ceil(capped));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (maxLength <= 0 || message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  private <T> T withWriteLock(String operation, UUID punchId, Supplier<T> action) {
    writeLock.lock();
    try {
      return action.get();
    } catch (DataAccessException | TransactionException ex) {
      throw new OfflineQueueStorageException(
          "offline queue " + operation + " failed punchId=" + punchId, ex);
    } finally {
      writeLock.unlock();
    }
  }

  private <T> T read(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (DataAccessException ex) {
      throw new OfflineQueueStorageException("offline queue " + operation + " failed", ex);
    }
  }
}
