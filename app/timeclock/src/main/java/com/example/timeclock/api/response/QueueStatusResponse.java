/*
 * どこで: Timeclock API レスポンス DTO
 * 何を: デバッグ用エンドポイントのキュー件数と明細を表す
 * なぜ: 待機中や拒否済みの打刻は管理用の状態表示からしか見えないため
 */
package com.example.timeclock.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "response DTO record is serialized once and never mutated")
public record QueueStatusResponse(
    int queued,
    int syncing,
    int rejected,
    Instant oldestPunchTimestamp,
    List<QueuedPunchItem> items) {}
