package com.example.timeclock.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class PunchRecordTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Test
  void receivedRecordFollowsLiveAndOfflinePaths() {
    final PunchRecord received = PunchRecord.received("TE00700", "00700", NOW, null, NOW);

    final PunchRecord submitting = received.transitionTo(PunchStatus.SUBMITTING);
    final PunchRecord queued = submitting.transitionTo(PunchStatus.OFFLINE_QUEUED);
    final PunchRecord syncing = queued.transitionTo(PunchStatus.SYNCING);

    assertThat(received.status()).isEqualTo(PunchStatus.RECEIVED);
    assertThat(syncing.transitionTo(PunchStatus.OFFLINE_QUEUED).status())
        .isEqualTo(PunchStatus.OFFLINE_QUEUED);
    assertThat(syncing.transitionTo(PunchStatus.SYNCED).status().isTerminal()).isTrue();
    assertThat(syncing.punchId()).isEqualTo(received.punchId());
    assertThat(syncing.punchTimestamp()).isEqualTo(NOW);
  }

  @Test
  void illegalTransitionsThrow() {
    final PunchRecord received = PunchRecord.received("12345", "12345", NOW, null, NOW);

    assertThatThrownBy(() -> received.transitionTo(PunchStatus.SYNCED))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("RECEIVED -> SYNCED");
    assertThatThrownBy(
            () ->
                received
                    .transitionTo(PunchStatus.SUBMITTING)
                    .transitionTo(PunchStatus.REJECTED)
                    .transitionTo(PunchStatus.SYNCING))
        .isInstanceOf(IllegalStateException.class);
    assertThat(PunchStatus.OFFLINE_QUEUED.canTransitionTo(PunchStatus.SYNCED)).isFalse();
    assertThat(PunchStatus.SYNCED.canTransitionTo(PunchStatus.OFFLINE_QUEUED)).isFalse();
  }

  @Test
  void isDueWhenNoRetryIsScheduledOrRetryTimeHasPassed() {
    final PunchRecord record = PunchRecord.received("12345", "12345", NOW, null, NOW);
    final PunchRecord delayed =
        new PunchRecord(
            record.punchId(),
            "12345",
            "12345",
            NOW,
            null,
            PunchStatus.OFFLINE_QUEUED,
            PhotoState.NONE,
            false,
            1,
            "timeout",
            NOW.plusSeconds(5),
            NOW);

    assertThat(record.isDue(NOW)).isTrue();
    assertThat(delayed.isDue(NOW)).isFalse();
    assertThat(delayed.isDue(NOW.plusSeconds(5))).isTrue();
  }

  @Test
  void copiesKeepIdentityWhileChangingBookkeeping() {
    final PunchRecord record = PunchRecord.received("TE00700", "00700", NOW, 4, NOW);

    final PunchRecord accepted = record.accepted().withPhotoState(PhotoState.PENDING);

    assertThat(accepted.punchAccepted()).isTrue();
    assertThat(accepted.photoState()).isEqualTo(PhotoState.PENDING);
    assertThat(accepted.departmentOverride()).isEqualTo(4);
    assertThat(record.punchAccepted()).isFalse();
  }

  @Test
  void onlineOutcomeGreetsByDirection() {
    final PunchOutcome in =
        PunchOutcome.online(
            null, new PunchResult("Ada", "Lovelace", PunchDirection.CHECK_IN, BigDecimal.ONE));
    final PunchOutcome out =
        PunchOutcome.online(
            null, new PunchResult("Ada", "Lovelace", PunchDirection.CHECK_OUT, BigDecimal.ONE));

    assertThat(in.message()).isEqualTo("Welcome Ada!");
    assertThat(out.message()).isEqualTo("Goodbye Ada!");
    assertThat(PunchDirection.fromWire(" CheckOut ")).isEqualTo(PunchDirection.CHECK_OUT);
    assertThat(PunchDirection.fromWire("lunch")).isEqualTo(PunchDirection.UNKNOWN);
  }

  @Test
  void exceptionCodesMapToKioskMessages() {
    assertThat(PunchExceptionCode.fromCode(1).message())
        .isEqualTo("Shift not yet started. No punch recorded.");
    assertThat(PunchExceptionCode.fromCode(3).message())
        .isEqualTo("Shift has finished. No punch recorded.");
    assertThat(PunchExceptionCode.fromCode(42)).isEqualTo(PunchExceptionCode.NOT_AUTHORIZED);
    assertThat(SystemErrorCode.fromCode(-6)).map(SystemErrorCode::message).contains("Invalid date");
    assertThat(SystemErrorCode.fromCode(-9)).isEmpty();
  }
}
