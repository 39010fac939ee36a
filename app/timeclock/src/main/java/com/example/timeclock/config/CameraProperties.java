/*
 * どこで: Timeclock 設定バインド
 * 何を: スナップショットカメラの設定を保持する
 * なぜ: カメラのないキオスクはカメラ無効で動かすため
 */
package com.example.timeclock.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "timeclock.camera")
public record CameraProperties(boolean enabled, String snapshotUrl, Duration timeout) {

  public CameraProperties {
    timeout = timeout == null ? Duration.ofSeconds(2) : timeout;
  }
}
