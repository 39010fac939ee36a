/*
 * どこで: Timeclock 設定バインド
 * 何を: オフラインキュー排出のポーリング・再送・容量の設定を保持する
 * なぜ: バックオフと試行上限を運用パラメータとして扱うため
 */
package com.example.timeclock.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "timeclock.sync")
public record PunchSyncProperties(
    boolean enabled,
    Duration pollInterval,
    int batchSize,
    int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    int errorMessageMaxLength,
    int maxRecords) {}
