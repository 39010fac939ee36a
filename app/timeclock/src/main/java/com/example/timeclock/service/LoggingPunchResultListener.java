/*
 * どこで: Timeclock サービス層
 * 何を: 打刻結果をログへ書き出す既定のリスナー
 * なぜ: 画面のないキオスクでも従業員に示した内容を追跡できるようにするため
 */
package com.example.timeclock.service;

import com.example.timeclock.model.PunchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingPunchResultListener implements PunchResultListener {

  private static final Logger logger = LoggerFactory.getLogger(LoggingPunchResultListener.class);

  @Override
  public void onPunchResult(PunchOutcome outcome) {
    logger.info(
        "punch result punchId={} outcome={} status={} message={}",
        outcome.punchId(),
        outcome.kind(),
        outcome.status(),
        outcome.message());
  }
}
