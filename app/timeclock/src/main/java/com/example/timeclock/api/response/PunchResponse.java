/*
 * どこで: Timeclock API レスポンス DTO
 * 何を: 従業員に表示する打刻 1 件の結果を表す
 * なぜ: オンライン成功/オフライン成功/拒否をキオスクが区別できるようにするため
 */
package com.example.timeclock.api.response;

import com.example.timeclock.model.PunchOutcome;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PunchResponse(
    String punchId,
    String outcome,
    String status,
    boolean offline,
    String message,
    String firstName,
    String lastName,
    String direction,
    BigDecimal weeklyHours,
    Integer exceptionCode) {

  public static PunchResponse from(PunchOutcome outcome) {
    return new PunchResponse(
        outcome.punchId() == null ? null : outcome.punchId().toString(),
        outcome.kind().name(),
        outcome.status() == null ? null : outcome.status().name(),
        outcome.offline(),
        outcome.message(),
        outcome.firstName(),
        outcome.lastName(),
        outcome.direction() == null ? null : outcome.direction().name(),
        outcome.weeklyHours(),
        outcome.exceptionCode());
  }
}
