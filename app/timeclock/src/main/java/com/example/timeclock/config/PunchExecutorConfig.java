/*
 * どこで: Timeclock 設定
 * 何を: 打刻ワーカーと接続回復時の同期に使う有界 Executor を提供する
 * なぜ: カメラ/ネットワーク/ディスクの処理をリクエストスレッドで動かさないため
 */
package com.example.timeclock.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class PunchExecutorConfig {

  @Bean
  ThreadPoolTaskExecutor punchTaskExecutor(PunchSubmissionProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("punch-");
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.workerQueueCapacity());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }

  @Bean
  ThreadPoolTaskExecutor syncTaskExecutor() {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("punch-sync-");
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(4);
    executor.initialize();
    return executor;
  }
}
