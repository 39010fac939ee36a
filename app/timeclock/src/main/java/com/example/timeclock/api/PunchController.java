/*
 * どこで: Timeclock API
 * 何を: キオスク UI から打刻を受け付ける
 * なぜ: リクエストスレッドを塞がずに打刻をコーディネータへ渡す入口とするため
 */
package com.example.timeclock.api;

import com.example.timeclock.api.request.PunchRequest;
import com.example.timeclock.api.response.PunchResponse;
import com.example.timeclock.model.PunchOutcome;
import com.example.timeclock.service.PunchCoordinator;
import jakarta.validation.Valid;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/punches")
@RequiredArgsConstructor
public class PunchController {

  private final PunchCoordinator punchCoordinator;

  @PostMapping
  public CompletableFuture<ResponseEntity<PunchResponse>> punch(
      @Valid @RequestBody PunchRequest request) {
    return punchCoordinator
        .punch(request.rawEmployeeId(), request.departmentOverride())
        .thenApply(PunchController::toResponse);
  }

  private static ResponseEntity<PunchResponse> toResponse(PunchOutcome outcome) {
    final HttpStatus status =
        outcome.kind() == PunchOutcome.Kind.INVALID ? HttpStatus.BAD_REQUEST : HttpStatus.OK;
    return ResponseEntity.status(status).body(PunchResponse.from(outcome));
  }
}
