/*
 * どこで: Timeclock 設定バインド
 * 何を: オフラインキューの保持期間と掃除スケジュールを保持する
 * なぜ: 長期オフライン時にもローカルストアを有限に保つため
 */
package com.example.timeclock.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "timeclock.retention")
public record PunchRetentionProperties(
    boolean enabled, int retentionDays, Duration cleanupInterval) {}
