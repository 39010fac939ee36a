/*
 * どこで: Timeclock サービス層
 * 何を: キオスクからの打刻をライブ送信かオフラインキューへ振り分ける
 * なぜ: 従業員へ必ず応答し、受け付けた打刻を失わないため
 */
package com.example.timeclock.service;

import com.example.timeclock.camera.Camera;
import com.example.timeclock.gateway.AttendanceSoapMessages;
import com.example.timeclock.gateway.PunchGateway;
import com.example.timeclock.gateway.PunchGatewayException;
import com.example.timeclock.model.PhotoState;
import com.example.timeclock.model.PunchOutcome;
import com.example.timeclock.model.PunchRecord;
import com.example.timeclock.model.PunchResult;
import com.example.timeclock.model.PunchStatus;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

@Service
public class PunchCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(PunchCoordinator.class);

  static final String EMPTY_ID_MESSAGE = "Please enter or scan your employee id";
  static final String MALFORMED_ID_MESSAGE = "Employee id contains unsupported characters";

  private final PunchGateway punchGateway;
  private final OfflineQueue offlineQueue;
  private final Camera camera;
  private final RejectionThrottle rejectionThrottle;
  private final List<PunchResultListener> listeners;
  private final PunchMetrics metrics;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;
  private final Executor punchExecutor;
  private final ReentrantLock sequenceLock = new ReentrantLock();
  private final Map<String, CompletableFuture<PunchOutcome>> employeeTails = new HashMap<>();

  public PunchCoordinator(
      PunchGateway punchGateway,
      OfflineQueue offlineQueue,
      Camera camera,
      RejectionThrottle rejectionThrottle,
      List<PunchResultListener> listeners,
      PunchMetrics metrics,
      ApplicationEventPublisher eventPublisher,
      Clock clock,
      @Qualifier("punchTaskExecutor") Executor punchExecutor) {
    this.punchGateway = punchGateway;
    this.offlineQueue = offlineQueue;
    this.camera = camera;
    this.rejectionThrottle = rejectionThrottle;
    this.listeners = List.copyOf(listeners);
    this.metrics = metrics;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
    this.punchExecutor = punchExecutor;
  }

  /**
   * 役割:
   * - 呼び出しスレッドで ID を検証して打刻時刻を確定し、カメラ/ネットワーク/ディスクの処理を打刻
   *   Executor へ渡す。
   *
   * 動作:
   * - 同じ従業員の打刻は打刻時刻順に 1 件ずつ処理する。送信中やキュー投入中の打刻より後の打刻が
   *   先に勤怠サービスへ届くことはない。
   */
  public CompletableFuture<PunchOutcome> punch(String rawEmployeeId, Integer departmentOverride) {
    final String employeeId = rawEmployeeId == null ? "" : rawEmployeeId.strip();
    final Optional<String> invalid = validate(employeeId);
    if (invalid.isPresent()) {
      logger.info("punch refused before submission reason={}", invalid.get());
      return CompletableFuture.completedFuture(publish(PunchOutcome.invalid(invalid.get())));
    }
    final PunchRecord record;
    final CompletableFuture<PunchOutcome> processed;
    sequenceLock.lock();
    try {
      final Instant now = Instant.now(clock);
      record =
          PunchRecord.received(
              employeeId,
              IdentifierNormalizer.normalize(employeeId),
              now.truncatedTo(ChronoUnit.SECONDS),
              departmentOverride,
              now);
      // 同じ従業員の先行打刻が成功/失敗のどちらで終わっても、その後に実行する
      final CompletableFuture<PunchOutcome> previous = employeeTails.get(employeeId);
      final CompletableFuture<Void> ready =
          previous == null
              ? CompletableFuture.completedFuture(null)
              : previous.handle((outcome, ex) -> null);
      processed = ready.thenApplyAsync(ignored -> process(record), punchExecutor);
      employeeTails.put(employeeId, processed);
    } finally {
      sequenceLock.unlock();
    }
    processed.whenComplete((outcome, ex) -> releaseTail(employeeId, processed));
    return processed
        .handle((outcome, ex) -> ex == null ? outcome : failedToProcess(record, ex))
        .thenApply(this::publish);
  }

  private void releaseTail(String employeeId, CompletableFuture<PunchOutcome> finished) {
    sequenceLock.lock();
    try {
      employeeTails.remove(employeeId, finished);
    } finally {
      sequenceLock.unlock();
    }
  }

  private PunchOutcome failedToProcess(PunchRecord record, Throwable failure) {
    final Throwable cause =
        failure instanceof CompletionException && failure.getCause() != null
            ? failure.getCause()
            : failure;
    if (!(cause instanceof RejectedExecutionException)) {
      throw failure instanceof CompletionException
          ? (CompletionException) failure
          : new CompletionException(cause);
    }
    logger.error(
        "punch worker pool saturated, punch not recorded punchId={} employee={} timestamp={}",
        record.punchId(),
        record.rawEmployeeId(),
        record.punchTimestamp(),
        cause);
    return PunchOutcome.storageFailure(record.punchId());
  }

  private PunchOutcome process(PunchRecord received) {
    final PunchRecord submitting = received.transitionTo(PunchStatus.SUBMITTING);
    final Optional<PunchOutcome> throttled =
        rejectionThrottle.check(submitting.punchId(), submitting.rawEmployeeId());
    if (throttled.isPresent()) {
      submitting.transitionTo(PunchStatus.REJECTED);
      logger.info(
          "punch answered from rejection throttle punchId={} employee={}",
          submitting.punchId(),
          submitting.rawEmployeeId());
      return throttled.get();
    }
    final Optional<byte[]> photo = capturePhoto(submitting);
    try {
      if (offlineQueue.hasPendingFor(submitting.rawEmployeeId())) {
        logger.info(
            "punch queued behind pending punches punchId={} employee={}",
            submitting.punchId(),
            submitting.rawEmployeeId());
        final PunchOutcome outcome = enqueue(submitting, photo);
        eventPublisher.publishEvent(new ConnectivityRestoredEvent("backlog", Instant.now(clock)));
        return outcome;
      }
      return submitLive(submitting, photo);
    } catch (OfflineQueueStorageException ex) {
      logger.error(
          "punch could not be stored offline, operator action needed punchId={} employee={} timestamp={}",
          submitting.punchId(),
          submitting.rawEmployeeId(),
          submitting.punchTimestamp(),
          ex);
      return PunchOutcome.storageFailure(submitting.punchId());
    }
  }

  private PunchOutcome submitLive(PunchRecord submitting, Optional<byte[]> photo) {
    final PunchResult result;
    try {
      result =
          punchGateway.submitPunch(
              submitting.rawEmployeeId(),
              submitting.punchTimestamp(),
              submitting.departmentOverride());
    } catch (PunchGatewayException ex) {
      if (!ex.isTransient()) {
        submitting.transitionTo(PunchStatus.REJECTED);
        rejectionThrottle.recordRejection(
            submitting.rawEmployeeId(), ex.exceptionCode(), ex.getMessage());
        logger.info(
            "punch rejected by attendance service punchId={} employee={} code={} message={}",
            submitting.punchId(),
            submitting.rawEmployeeId(),
            ex.exceptionCode(),
            ex.getMessage());
        return PunchOutcome.rejected(submitting.punchId(), ex.getMessage(), ex.exceptionCode());
      }
      logger.warn(
          "live punch submission failed, queueing offline punchId={} reason={}",
          submitting.punchId(),
          ex.reason(),
          ex);
      return enqueue(submitting, photo);
    }
    final PunchRecord accepted = submitting.accepted();
    if (photo.isPresent()) {
      uploadLivePhoto(accepted, photo.get());
    }
    accepted.transitionTo(PunchStatus.SYNCED);
    logger.info(
        "punch recorded online punchId={} employee={} direction={}",
        accepted.punchId(),
        accepted.rawEmployeeId(),
        result.direction());
    signalBacklog();
    return PunchOutcome.online(accepted.punchId(), result);
  }

  private void uploadLivePhoto(PunchRecord accepted, byte[] photoBytes) {
    try {
      punchGateway.uploadPhoto(accepted.imageEmployeeId(), photoBytes, accepted.punchTimestamp());
    } catch (PunchGatewayException ex) {
      if (!ex.isTransient()) {
        logger.warn(
            "punch photo refused, marked unavailable punchId={} imageEmployeeId={} message={}",
            accepted.punchId(),
            accepted.imageEmployeeId(),
            ex.getMessage());
        return;
      }
      logger.warn(
          "punch photo upload failed, queueing photo punchId={} reason={}",
          accepted.punchId(),
          ex.reason(),
          ex);
      try {
        offlineQueue.enqueue(
            accepted.transitionTo(PunchStatus.OFFLINE_QUEUED).withPhotoState(PhotoState.PENDING),
            photoBytes);
      } catch (OfflineQueueStorageException storageEx) {
        logger.error(
            "punch photo could not be stored offline, photo lost punchId={} imageEmployeeId={}",
            accepted.punchId(),
            accepted.imageEmployeeId(),
            storageEx);
      }
    }
  }

  private PunchOutcome enqueue(PunchRecord submitting, Optional<byte[]> photo) {
    final PunchRecord queued =
        submitting
            .transitionTo(PunchStatus.OFFLINE_QUEUED)
            .withPhotoState(photo.isPresent() ? PhotoState.PENDING : PhotoState.NONE);
    offlineQueue.enqueue(queued, photo.orElse(null));
    logger.info(
        "punch queued offline punchId={} employee={} timestamp={} photo={}",
        queued.punchId(),
        queued.rawEmployeeId(),
        queued.punchTimestamp(),
        queued.photoState());
    return PunchOutcome.offline(queued.punchId());
  }

  private Optional<byte[]> capturePhoto(PunchRecord record) {
    try {
      return camera
          .capturePhoto(record.imageEmployeeId(), record.punchTimestamp())
          .filter(bytes -> bytes.length > 0);
    } catch (RuntimeException ex) {
      logger.warn(
          "camera failed, punch continues without photo punchId={}", record.punchId(), ex);
      return Optional.empty();
    }
  }

  private void signalBacklog() {
    try {
      if (offlineQueue.countActive() > 0) {
        eventPublisher.publishEvent(new ConnectivityRestoredEvent("live-punch", Instant.now(clock)));
      }
    } catch (OfflineQueueStorageException ex) {
      logger.warn("offline backlog check failed after live punch", ex);
    }
  }

  private PunchOutcome publish(PunchOutcome outcome) {
    metrics.recordPunchOutcome(outcome.kind().name().toLowerCase(Locale.ROOT));
    for (PunchResultListener listener : listeners) {
      try {
        listener.onPunchResult(outcome);
      } catch (RuntimeException ex) {
        logger.warn(
            "punch result listener failed listener={} punchId={}",
            listener.getClass().getSimpleName(),
            outcome.punchId(),
            ex);
      }
    }
    return outcome;
  }

  static Optional<String> validate(String employeeId) {
    if (employeeId.isEmpty()) {
      return Optional.of(EMPTY_ID_MESSAGE);
    }
    if (employeeId.contains(AttendanceSoapMessages.SWIPE_SEPARATOR)
        || employeeId.chars().anyMatch(Character::isISOControl)) {
      return Optional.of(MALFORMED_ID_MESSAGE);
    }
    return Optional.empty();
  }
}
