/*
 * どこで: Timeclock サービス層
 * 何を: 未登録打刻の繰り返しに短時間ローカルで応答する
 * なぜ: 拒否されたバッジの再試行で勤怠サービスへ負荷をかけないため
 */
package com.example.timeclock.service;

import com.example.timeclock.config.PunchSubmissionProperties;
import com.example.timeclock.model.PunchExceptionCode;
import com.example.timeclock.model.PunchOutcome;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.util.Optional;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class RejectionThrottle {

  static final String THROTTLED_SUFFIX = " (Throttled)";

  private record Rejection(String message, Integer exceptionCode) {}

  private final Cache<String, Rejection> recentRejections;

  @Autowired
  public RejectionThrottle(PunchSubmissionProperties properties) {
    this(properties, Ticker.systemTicker());
  }

  @VisibleForTesting
  RejectionThrottle(PunchSubmissionProperties properties, Ticker ticker) {
    this.recentRejections =
        CacheBuilder.newBuilder()
            .expireAfterWrite(properties.throttleWindow())
            .ticker(ticker)
            .maximumSize(1_000)
            .build();
  }

  /** 「未認可」の拒否だけを記憶する。その他のコードは通常どおり再試行する。 */
  public void recordRejection(String rawEmployeeId, Integer exceptionCode, String message) {
    if (exceptionCode == null || exceptionCode != PunchExceptionCode.NOT_AUTHORIZED.code()) {
      return;
    }
    recentRejections.put(rawEmployeeId, new Rejection(message, exceptionCode));
  }

  public Optional<PunchOutcome> check(UUID punchId, String rawEmployeeId) {
    final Rejection rejection = recentRejections.getIfPresent(rawEmployeeId);
    if (rejection == null) {
      return Optional.empty();
    }
    return Optional.of(
        PunchOutcome.rejected(
            punchId, rejection.message() + THROTTLED_SUFFIX, rejection.exceptionCode()));
  }
}
