/*
 * どこで: Timeclock 設定バインド
 * 何を: 打刻ワーカープールの大きさと拒否抑止の時間窓を保持する
 * なぜ: バッジの連続読み取りでスレッドが際限なく増えないようにするため
 */
package com.example.timeclock.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "timeclock.punch")
public record PunchSubmissionProperties(
    int workerThreads, int workerQueueCapacity, Duration throttleWindow) {

  public PunchSubmissionProperties {
    workerThreads = workerThreads <= 0 ? 2 : workerThreads;
    workerQueueCapacity = workerQueueCapacity <= 0 ? 32 : workerQueueCapacity;
    throttleWindow = throttleWindow == null ? Duration.ofSeconds(5) : throttleWindow;
  }
}
