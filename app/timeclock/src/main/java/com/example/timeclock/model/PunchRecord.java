/*
 * どこで: Timeclock ドメインモデル
 * 何を: 1 回の打刻とその送信状況を表す
 * なぜ: コーディネータからキュー、同期ワーカーまで同じスナップショットを流すため
 */
package com.example.timeclock.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record PunchRecord(
    UUID punchId,
    String rawEmployeeId,
    String imageEmployeeId,
    Instant punchTimestamp,
    Integer departmentOverride,
    PunchStatus status,
    PhotoState photoState,
    boolean punchAccepted,
    int syncAttempts,
    String lastError,
    Instant nextRetryAt,
    Instant createdAt) {

  public PunchRecord {
    Objects.requireNonNull(punchId, "punchId");
    Objects.requireNonNull(rawEmployeeId, "rawEmployeeId");
    Objects.requireNonNull(imageEmployeeId, "imageEmployeeId");
    Objects.requireNonNull(punchTimestamp, "punchTimestamp");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(photoState, "photoState");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public static PunchRecord received(
      String rawEmployeeId,
      String imageEmployeeId,
      Instant punchTimestamp,
      Integer departmentOverride,
      Instant createdAt) {
    return new PunchRecord(
        UUID.randomUUID(),
        rawEmployeeId,
        imageEmployeeId,
        punchTimestamp,
        departmentOverride,
        PunchStatus.RECEIVED,
        PhotoState.NONE,
        false,
        0,
        null,
        null,
        createdAt);
  }

  public PunchRecord transitionTo(PunchStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException(
          "illegal punch transition " + status + " -> " + next + " punchId=" + punchId);
    }
    return new PunchRecord(
        punchId,
        rawEmployeeId,
        imageEmployeeId,
        punchTimestamp,
        departmentOverride,
        next,
        photoState,
        punchAccepted,
        syncAttempts,
        lastError,
        nextRetryAt,
        createdAt);
  }

  public PunchRecord withPhotoState(PhotoState nextPhotoState) {
    return new PunchRecord(
        punchId,
        rawEmployeeId,
        imageEmployeeId,
        punchTimestamp,
        departmentOverride,
        status,
        nextPhotoState,
        punchAccepted,
        syncAttempts,
        lastError,
        nextRetryAt,
        createdAt);
  }

  public PunchRecord accepted() {
    return new PunchRecord(
        punchId,
        rawEmployeeId,
        imageEmployeeId,
        punchTimestamp,
        departmentOverride,
        status,
        photoState,
        true,
        syncAttempts,
        lastError,
        nextRetryAt,
        createdAt);
  }

  public boolean isDue(Instant now) {
    return nextRetryAt == null || !nextRetryAt.isAfter(now);
  }
}
