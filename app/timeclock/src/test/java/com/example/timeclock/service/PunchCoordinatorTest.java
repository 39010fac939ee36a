/*
 * どこで: Timeclock コーディネータのテスト
 * 何を: オンライン/オフライン/拒否/クラッシュ経路を打刻単位で検証する
 * なぜ: キオスクが必ず応答し、オフライン打刻が後で必ず送られることを保証するため
 */
package com.example.timeclock.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.timeclock.AbstractSqliteQueueTest;
import com.example.timeclock.camera.Camera;
import com.example.timeclock.config.PunchSubmissionProperties;
import com.example.timeclock.gateway.PunchGateway;
import com.example.timeclock.gateway.PunchGatewayException;
import com.example.timeclock.model.PhotoState;
import com.example.timeclock.model.PunchDirection;
import com.example.timeclock.model.PunchOutcome;
import com.example.timeclock.model.PunchRecord;
import com.example.timeclock.model.PunchResult;
import com.example.timeclock.model.PunchStatus;
import com.example.timeclock.model.SyncReport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class PunchCoordinatorTest extends AbstractSqliteQueueTest {

  private static final Instant PUNCH_TIME = FIXED_NOW.plusMillis(750);
  private static final Instant PUNCH_SECOND = FIXED_NOW;
  private static final byte[] PHOTO = {(byte) 0xFF, (byte) 0xD8, 0x10};
  private static final PunchResult CHECKED_IN =
      new PunchResult("Ada", "Lovelace", PunchDirection.CHECK_IN, new BigDecimal("12.50"));
  private static final Executor DIRECT = Runnable::run;

  @Mock private PunchGateway punchGateway;
  @Mock private ApplicationEventPublisher eventPublisher;

  private final List<PunchOutcome> shown = new CopyOnWriteArrayList<>();
  private Optional<byte[]> nextPhoto = Optional.empty();
  private SimpleMeterRegistry meterRegistry;
  private OfflineQueue offlineQueue;
  private PunchCoordinator coordinator;

  @BeforeEach
  void setUp() {
    clock.set(PUNCH_TIME);
    meterRegistry = new SimpleMeterRegistry();
    offlineQueue = newOfflineQueue();
    coordinator = newCoordinator(offlineQueue);
  }

  @Test
  void scenarioAOnlinePunchReportsNameDirectionAndHours() {
    when(punchGateway.submitPunch("12345", PUNCH_SECOND, null)).thenReturn(CHECKED_IN);

    final PunchOutcome outcome = coordinator.punch("12345", null).join();

    assertThat(outcome.kind()).isEqualTo(PunchOutcome.Kind.ONLINE_SUCCESS);
    assertThat(outcome.status()).isEqualTo(PunchStatus.SYNCED);
    assertThat(outcome.message()).isEqualTo("Welcome Ada!");
    assertThat(outcome.direction()).isEqualTo(PunchDirection.CHECK_IN);
    assertThat(outcome.weeklyHours()).isEqualByComparingTo("12.50");
    assertThat(outcome.offline()).isFalse();
    assertThat(shown).containsExactly(outcome);
    assertThat(offlineQueue.countActive()).isZero();
    verify(punchGateway, never()).uploadPhoto(anyString(), any(), any());
    assertThat(
            meterRegistry
                .get("timeclock.punch.total")
                .tag("outcome", "online_success")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void scenarioBPrefixedIdSubmitsFullIdAndUploadsPhotoUnderStrippedId() {
    nextPhoto = Optional.of(PHOTO);
    when(punchGateway.submitPunch("TE00700", PUNCH_SECOND, null)).thenReturn(CHECKED_IN);

    final PunchOutcome outcome = coordinator.punch("TE00700", null).join();

    assertThat(outcome.kind()).isEqualTo(PunchOutcome.Kind.ONLINE_SUCCESS);
    verify(punchGateway).uploadPhoto("00700", PHOTO, PUNCH_SECOND);
    assertThat(offlineQueue.countActive()).isZero();
  }

  @Test
  void scenarioCNetworkDownQueuesThenSyncsWithPhoto() {
    nextPhoto = Optional.of(PHOTO);
    when(punchGateway.submitPunch("TE00700", PUNCH_SECOND, null))
        .thenThrow(new PunchGatewayException(PunchGatewayException.Reason.NETWORK, "down"))
        .thenReturn(CHECKED_IN);

    final PunchOutcome outcome = coordinator.punch("TE00700", null).join();

    assertThat(outcome.kind()).isEqualTo(PunchOutcome.Kind.OFFLINE_SUCCESS);
    assertThat(outcome.offline()).isTrue();
    assertThat(outcome.acknowledged()).isTrue();
    final PunchRecord queued = offlineQueue.peekOldestUnsynced(10).get(0);
    assertThat(queued.punchId()).isEqualTo(outcome.punchId());
    assertThat(queued.punchTimestamp()).isEqualTo(PUNCH_SECOND);
    assertThat(queued.photoState()).isEqualTo(PhotoState.PENDING);
    verify(punchGateway, never()).uploadPhoto(anyString(), any(), any());

    final SyncReport report = newSyncManager(offlineQueue).drain();

    assertThat(report.synced()).isEqualTo(1);
    verify(punchGateway).uploadPhoto("00700", PHOTO, PUNCH_SECOND);
    assertThat(offlineQueue.countActive()).isZero();
  }

  @Test
  void scenarioDBusinessRejectionIsShownAndNotQueued() {
    when(punchGateway.submitPunch("99999", PUNCH_SECOND, null))
        .thenThrow(
            new PunchGatewayException(
                PunchGatewayException.Reason.SERVICE_FAULT,
                "Not Authorized. No punch recorded.",
                2,
                null));

    final PunchOutcome outcome = coordinator.punch("99999", null).join();

    assertThat(outcome.kind()).isEqualTo(PunchOutcome.Kind.REJECTED);
    assertThat(outcome.message()).isEqualTo("Not Authorized. No punch recorded.");
    assertThat(outcome.exceptionCode()).isEqualTo(2);
    assertThat(outcome.acknowledged()).isFalse();
    assertThat(offlineQueue.findAll(10)).isEmpty();
  }

  @Test
  void scenarioECrashAfterEnqueueLeavesOneRecordThatSyncsAfterRestart() {
    when(punchGateway.submitPunch("12345", PUNCH_SECOND, null))
        .thenThrow(new PunchGatewayException(PunchGatewayException.Reason.TIMEOUT, "timeout"))
        .thenReturn(CHECKED_IN);
    final PunchOutcome outcome = coordinator.punch("12345", null).join();
    assertThat(outcome.kind()).isEqualTo(PunchOutcome.Kind.OFFLINE_SUCCESS);

    // 同期を試みる前にクラッシュ: 新しいコンポーネントでストアを開き直す
    reopenDatabase();
    final OfflineQueue restarted = newOfflineQueue();
    assertThat(restarted.findAll(10))
        .singleElement()
        .extracting(PunchRecord::punchId)
        .isEqualTo(outcome.punchId());

    final SyncReport report = newSyncManager(restarted).drain();

    assertThat(report.synced()).isEqualTo(1);
    assertThat(restarted.findAll(10)).isEmpty();
    verify(punchGateway, times(2)).submitPunch("12345", PUNCH_SECOND, null);
  }

  @Test
  void repeatedNotAuthorizedPunchIsThrottled() {
    when(punchGateway.submitPunch(eq("99999"), any(), any()))
        .thenThrow(
            new PunchGatewayException(
                PunchGatewayException.Reason.SERVICE_FAULT,
                "Not Authorized. No punch recorded.",
                2,
                null));
    coordinator.punch("99999", null).join();

    final PunchOutcome second = coordinator.punch("99999", null).join();

    assertThat(second.kind()).isEqualTo(PunchOutcome.Kind.REJECTED);
    assertThat(second.message()).isEqualTo("Not Authorized. No punch recorded. (Throttled)");
    verify(punchGateway, times(1)).submitPunch(anyString(), any(), any());
  }

  @Test
  void punchForEmployeeWithQueuedBacklogSkipsLiveAttempt() {
    offlineQueue.enqueue(queued("12345", FIXED_NOW.minusSeconds(60)), null);

    final PunchOutcome outcome = coordinator.punch("12345", null).join();

    assertThat(outcome.kind()).isEqualTo(PunchOutcome.Kind.OFFLINE_SUCCESS);
    verifyNoInteractions(punchGateway);
    assertThat(offlineQueue.peekOldestUnsynced(10))
        .extracting(PunchRecord::rawEmployeeId)
        .containsExactly("12345", "12345");
    final ArgumentCaptor<ConnectivityRestoredEvent> event =
        ArgumentCaptor.forClass(ConnectivityRestoredEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().source()).isEqualTo("backlog");
  }

  @Test
  void liveSuccessWithOtherBacklogRequestsSync() {
    offlineQueue.enqueue(queued("55555", FIXED_NOW.minusSeconds(60)), null);
    when(punchGateway.submitPunch("12345", PUNCH_SECOND, null)).thenReturn(CHECKED_IN);

    coordinator.punch("12345", null).join();

    verify(eventPublisher).publishEvent(any(ConnectivityRestoredEvent.class));
  }

  @Test
  void transientPhotoFailureAfterAcceptedSwipeQueuesPhotoOnly() {
    nextPhoto = Optional.of(PHOTO);
    when(punchGateway.submitPunch("TE00700", PUNCH_SECOND, null)).thenReturn(CHECKED_IN);
    doThrow(new PunchGatewayException(PunchGatewayException.Reason.TIMEOUT, "timeout"))
        .doNothing()
        .when(punchGateway)
        .uploadPhoto(anyString(), any(), any());

    final PunchOutcome outcome = coordinator.punch("TE00700", null).join();

    assertThat(outcome.kind()).isEqualTo(PunchOutcome.Kind.ONLINE_SUCCESS);
    final PunchRecord queued = offlineQueue.peekOldestUnsynced(10).get(0);
    assertThat(queued.punchAccepted()).isTrue();
    assertThat(queued.photoState()).isEqualTo(PhotoState.PENDING);

    newSyncManager(offlineQueue).drain();

    verify(punchGateway, times(1)).submitPunch(anyString(), any(), any());
    verify(punchGateway, times(2)).uploadPhoto("00700", PHOTO, PUNCH_SECOND);
    assertThat(offlineQueue.countActive()).isZero();
  }

  @Test
  void invalidInputIsRefusedWithoutRemoteCallOrQueue() {
    final PunchOutcome blank = coordinator.punch("   ", null).join();
    final PunchOutcome separator = coordinator.punch("12|*|34", null).join();
    final PunchOutcome control = coordinator.punch("12\u000734", null).join();

    assertThat(blank.kind()).isEqualTo(PunchOutcome.Kind.INVALID);
    assertThat(separator.kind()).isEqualTo(PunchOutcome.Kind.INVALID);
    assertThat(control.kind()).isEqualTo(PunchOutcome.Kind.INVALID);
    verifyNoInteractions(punchGateway);
    assertThat(offlineQueue.findAll(10)).isEmpty();
    assertThat(shown).hasSize(3);
  }

  @Test
  void storageFailureIsReportedInsteadOfOfflineSuccess() {
    final OfflineQueue brokenQueue = mock(OfflineQueue.class);
    when(brokenQueue.hasPendingFor("12345")).thenReturn(false);
    when(brokenQueue.enqueue(any(), any()))
        .thenThrow(new OfflineQueueStorageException("disk full"));
    when(punchGateway.submitPunch("12345", PUNCH_SECOND, null))
        .thenThrow(new PunchGatewayException(PunchGatewayException.Reason.NETWORK, "down"));

    final PunchOutcome outcome = newCoordinator(brokenQueue).punch("12345", null).join();

    assertThat(outcome.kind()).isEqualTo(PunchOutcome.Kind.STORAGE_FAILURE);
    assertThat(outcome.acknowledged()).isFalse();
    assertThat(outcome.message()).isEqualTo("System Error - Please try again");
  }

  @Test
  void cameraFailureDegradesToPunchWithoutPhoto() {
    final Camera failingCamera =
        (imageId, timestamp) -> {
          throw new IllegalStateException("camera unplugged");
        };
    when(punchGateway.submitPunch("12345", PUNCH_SECOND, null)).thenReturn(CHECKED_IN);
    final PunchCoordinator withFailingCamera =
        new PunchCoordinator(
            punchGateway,
            offlineQueue,
            failingCamera,
            newThrottle(),
            List.of(shown::add),
            new PunchMetrics(meterRegistry),
            eventPublisher,
            clock,
            DIRECT);

    final PunchOutcome outcome = withFailingCamera.punch("12345", null).join();

    assertThat(outcome.kind()).isEqualTo(PunchOutcome.Kind.ONLINE_SUCCESS);
    verify(punchGateway, never()).uploadPhoto(anyString(), any(), any());
  }

  @Test
  void laterPunchWaitsWhileEarlierPunchOfSameEmployeeIsStillInFlight() throws Exception {
    final Instant firstSecond = PUNCH_SECOND;
    final Instant secondSecond = PUNCH_SECOND.plusSeconds(3);
    final CountDownLatch firstInFlight = new CountDownLatch(1);
    final CountDownLatch releaseFirst = new CountDownLatch(1);
    when(punchGateway.submitPunch(eq("12345"), eq(firstSecond), any()))
        .thenAnswer(
            invocation -> {
              firstInFlight.countDown();
              releaseFirst.await(5, TimeUnit.SECONDS);
              throw new PunchGatewayException(PunchGatewayException.Reason.TIMEOUT, "timed out");
            })
        .thenReturn(CHECKED_IN);
    when(punchGateway.submitPunch(eq("12345"), eq(secondSecond), any())).thenReturn(CHECKED_IN);
    final ExecutorService workers = Executors.newFixedThreadPool(2);
    try {
      final PunchCoordinator pooled = newCoordinator(offlineQueue, workers);

      final CompletableFuture<PunchOutcome> first = pooled.punch("12345", null);
      assertThat(firstInFlight.await(5, TimeUnit.SECONDS)).isTrue();
      clock.set(secondSecond);
      final CompletableFuture<PunchOutcome> second = pooled.punch("12345", null);

      verify(punchGateway, after(200).never()).submitPunch(eq("12345"), eq(secondSecond), any());
      releaseFirst.countDown();

      assertThat(first.get(5, TimeUnit.SECONDS).kind())
          .isEqualTo(PunchOutcome.Kind.OFFLINE_SUCCESS);
      assertThat(second.get(5, TimeUnit.SECONDS).kind())
          .isEqualTo(PunchOutcome.Kind.OFFLINE_SUCCESS);
    } finally {
      workers.shutdownNow();
    }

    newSyncManager(offlineQueue).drain();

    final ArgumentCaptor<Instant> remoteOrder = ArgumentCaptor.forClass(Instant.class);
    verify(punchGateway, times(3)).submitPunch(eq("12345"), remoteOrder.capture(), any());
    assertThat(remoteOrder.getAllValues()).containsExactly(firstSecond, firstSecond, secondSecond);
    assertThat(offlineQueue.countActive()).isZero();
  }

  @Test
  void saturatedWorkerPoolReportsStorageFailure() {
    final Executor saturated =
        task -> {
          throw new RejectedExecutionException("queue full");
        };

    final PunchOutcome outcome =
        newCoordinator(offlineQueue, saturated).punch("12345", null).join();

    assertThat(outcome.kind()).isEqualTo(PunchOutcome.Kind.STORAGE_FAILURE);
    assertThat(shown).containsExactly(outcome);
    verifyNoInteractions(punchGateway);
  }

  private PunchCoordinator newCoordinator(OfflineQueue queue) {
    return newCoordinator(queue, DIRECT);
  }

  private PunchCoordinator newCoordinator(OfflineQueue queue, Executor executor) {
    final Camera camera = (imageId, timestamp) -> nextPhoto;
    return new PunchCoordinator(
        punchGateway,
        queue,
        camera,
        newThrottle(),
        List.of(shown::add),
        new PunchMetrics(meterRegistry),
        eventPublisher,
        clock,
        executor);
  }

  private SyncManager newSyncManager(OfflineQueue queue) {
    return new SyncManager(
        queue, punchGateway, SYNC_PROPERTIES, new PunchMetrics(new SimpleMeterRegistry()), clock);
  }

  private static RejectionThrottle newThrottle() {
    return new RejectionThrottle(new PunchSubmissionProperties(2, 8, Duration.ofSeconds(5)));
  }
}
