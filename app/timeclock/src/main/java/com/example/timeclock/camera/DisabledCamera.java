/*
 * どこで: Timeclock カメラ連携
 * 何を: カメラのないキオスク向けの実装
 * なぜ: 写真なしで打刻を記録するため
 */
package com.example.timeclock.camera;

import java.time.Instant;
import java.util.Optional;

public class DisabledCamera implements Camera {

  @Override
  public Optional<byte[]> capturePhoto(String imageEmployeeId, Instant punchTimestamp) {
    return Optional.empty();
  }
}
