/*
 * どこで: Timeclock カメラ連携
 * 何を: 打刻用の写真を提供する
 * なぜ: 写真は従業員 ID と打刻時刻で打刻に対応付けるため
 */
package com.example.timeclock.camera;

import java.time.Instant;
import java.util.Optional;

public interface Camera {

  /** JPEG のバイト列を返す。撮影できなかった場合は空。 */
  Optional<byte[]> capturePhoto(String imageEmployeeId, Instant punchTimestamp);
}
