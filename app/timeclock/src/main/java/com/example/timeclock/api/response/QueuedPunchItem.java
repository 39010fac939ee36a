/*
 * どこで: Timeclock API レスポンス DTO
 * 何を: 管理者から見たキュー内の打刻 1 件を表す
 * なぜ: 打刻ごとの状態と最終エラーを確認できるようにするため
 */
package com.example.timeclock.api.response;

import com.example.timeclock.model.PunchRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueuedPunchItem(
    String punchId,
    String rawEmployeeId,
    Instant punchTimestamp,
    Integer departmentOverride,
    String status,
    String photoState,
    boolean punchAccepted,
    int syncAttempts,
    String lastError,
    Instant nextRetryAt,
    Instant createdAt) {

  public static QueuedPunchItem from(PunchRecord record) {
    return new QueuedPunchItem(
        record.punchId().toString(),
        record.rawEmployeeId(),
        record.punchTimestamp(),
        record.departmentOverride(),
        record.status().name(),
        record.photoState().name(),
        record.punchAccepted(),
        record.syncAttempts(),
        record.lastError(),
        record.nextRetryAt(),
        record.createdAt());
  }
}
