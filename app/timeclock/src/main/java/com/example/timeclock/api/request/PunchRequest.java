/*
 * どこで: Timeclock API リクエスト DTO
 * 何を: 打刻送信エンドポイントの入力を表す
 * なぜ: キオスクの JSON を型付きで扱うため
 */
package com.example.timeclock.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PunchRequest(
    @NotBlank String rawEmployeeId, @PositiveOrZero Integer departmentOverride) {}
