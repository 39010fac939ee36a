/*
 * どこで: Timeclock サービス層
 * 何を: オフラインキューを古い順に 1 件ずつ排出する
 * なぜ: リモートの週次集計は従業員ごとに逐次なので、送信順序が重要なため
 */
package com.example.timeclock.service;

import com.example.timeclock.config.PunchSyncProperties;
import com.example.timeclock.gateway.PunchGateway;
import com.example.timeclock.gateway.PunchGatewayException;
import com.example.timeclock.model.PhotoState;
import com.example.timeclock.model.PunchRecord;
import com.example.timeclock.model.PunchStatus;
import com.example.timeclock.model.SyncReport;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SyncManager {

  private static final Logger logger = LoggerFactory.getLogger(SyncManager.class);

  private enum Step {
    SYNCED,
    REJECTED,
    FAILED
  }

  private final OfflineQueue offlineQueue;
  private final PunchGateway punchGateway;
  private final PunchSyncProperties properties;
  private final PunchMetrics metrics;
  private final Clock clock;
  private final ReentrantLock drainLock = new ReentrantLock();

  /** 排出を 1 回実行する。別の排出が実行中なら空のレポートを返す。 */
  public SyncReport drain() {
    if (!drainLock.tryLock()) {
      logger.debug("punch sync skipped, drain already running");
      return SyncReport.empty();
    }
    try {
      return drainBatch();
    } finally {
      drainLock.unlock();
    }
  }

  private SyncReport drainBatch() {
    final List<PunchRecord> batch;
    try {
      batch = offlineQueue.peekOldestUnsynced(properties.batchSize());
    } catch (OfflineQueueStorageException ex) {
      logger.error("punch sync could not read the offline queue", ex);
      return SyncReport.empty();
    }
    int examined = 0;
    int synced = 0;
    int failed = 0;
    int rejected = 0;
    for (PunchRecord record : batch) {
      final Instant now = Instant.now(clock);
      if (!record.isDue(now)) {
        logger.debug(
            "punch sync waiting for head of queue punchId={} nextRetryAt={}",
            record.punchId(),
            record.nextRetryAt());
        break;
      }
      examined++;
      final Step step;
      try {
        step = syncOne(record);
      } catch (OfflineQueueStorageException ex) {
        logger.error(
            "punch sync stopped, offline queue update failed punchId={}", record.punchId(), ex);
        failed++;
        break;
      }
      if (step == Step.SYNCED) {
        synced++;
      } else if (step == Step.REJECTED) {
        rejected++;
      } else {
        failed++;
        break;
      }
    }
    final SyncReport report =
        new SyncReport(examined, synced, failed, rejected, batch.size() - examined);
    updateBacklog();
    if (examined > 0) {
      logger.info(
          "punch sync finished examined={} synced={} failed={} rejected={} deferred={}",
          report.examined(),
          report.synced(),
          report.failed(),
          report.rejected(),
          report.deferred());
    }
    return report;
  }

  private Step syncOne(PunchRecord queued) {
    final PunchRecord syncing = offlineQueue.markSyncing(queued);
    if (!syncing.punchAccepted()) {
      try {
        punchGateway.submitPunch(
            syncing.rawEmployeeId(), syncing.punchTimestamp(), syncing.departmentOverride());
      } catch (PunchGatewayException ex) {
        if (!ex.isTransient()) {
          offlineQueue.markRejected(syncing, ex.getMessage());
          logger.warn(
              "queued punch rejected by attendance service punchId={} employee={} code={} message={}",
              syncing.punchId(),
              syncing.rawEmployeeId(),
              ex.exceptionCode(),
              ex.getMessage());
          metrics.recordSyncResult("rejected");
          return Step.REJECTED;
        }
        return fail(syncing, ex);
      }
      offlineQueue.markSubmitted(syncing.punchId());
    }
    // ここから先で未完了になり得るのは写真だけ
    final PunchRecord record = syncing.accepted();
    if (record.photoState() == PhotoState.PENDING) {
      final Optional<byte[]> photo = offlineQueue.loadPhoto(record.punchId());
      if (photo.isEmpty()) {
        logger.error(
            "queued punch photo missing, marked unavailable punchId={} imageEmployeeId={}",
            record.punchId(),
            record.imageEmployeeId());
        offlineQueue.markPhotoUnavailable(record.punchId());
      } else {
        try {
          punchGateway.uploadPhoto(record.imageEmployeeId(), photo.get(), record.punchTimestamp());
        } catch (PunchGatewayException ex) {
          if (ex.isTransient()) {
            return fail(record, ex);
          }
          logger.warn(
              "queued punch photo refused, marked unavailable punchId={} imageEmployeeId={} message={}",
              record.punchId(),
              record.imageEmployeeId(),
              ex.getMessage());
          offlineQueue.markPhotoUnavailable(record.punchId());
        }
      }
    }
    offlineQueue.markSynced(record.punchId());
    final Instant syncedAt = Instant.now(clock);
    metrics.recordSyncResult("synced");
    metrics.recordSyncDelay(record.punchTimestamp(), syncedAt);
    logger.info(
        "queued punch synced punchId={} employee={} timestamp={}",
        record.punchId(),
        record.rawEmployeeId(),
        record.punchTimestamp());
    return Step.SYNCED;
  }

  private Step fail(PunchRecord record, PunchGatewayException ex) {
    final PunchStatus next = offlineQueue.markFailed(record, ex.reason() + ": " + ex.getMessage());
    if (next == PunchStatus.SYNCED) {
      metrics.recordSyncResult("synced");
      metrics.recordSyncDelay(record.punchTimestamp(), Instant.now(clock));
      return Step.SYNCED;
    }
    logger.warn(
        "queued punch sync failed punchId={} reason={} next={}",
        record.punchId(),
        ex.reason(),
        next,
        ex);
    metrics.recordSyncResult(next == PunchStatus.REJECTED ? "exhausted" : "failed");
    return Step.FAILED;
  }

  private void updateBacklog() {
    try {
      metrics.updateQueueBacklog(offlineQueue.countActive());
    } catch (OfflineQueueStorageException ex) {
      logger.warn("punch backlog gauge not updated", ex);
    }
  }
}
