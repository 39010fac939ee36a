/*
 * どこで: Timeclock API
 * 何を: ネットワーク側から「接続回復」の通知を受け取る
 * なぜ: 次のポーリングを待たずにキューを排出するため
 */
package com.example.timeclock.api;

import com.example.timeclock.service.ConnectivityRestoredEvent;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/connectivity")
@RequiredArgsConstructor
public class ConnectivityController {

  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  @PostMapping("/restored")
  public ResponseEntity<Void> restored() {
    eventPublisher.publishEvent(new ConnectivityRestoredEvent("api", Instant.now(clock)));
    return ResponseEntity.accepted().build();
  }
}
