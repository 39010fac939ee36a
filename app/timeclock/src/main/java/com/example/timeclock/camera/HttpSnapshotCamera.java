/*
 * どこで: Timeclock カメラ連携
 * 何を: ネットワークカメラのスナップショット URL から JPEG を取得する
 * なぜ: キオスクのカメラは現在のフレームを HTTP で公開しているため
 */
package com.example.timeclock.camera;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

public class HttpSnapshotCamera implements Camera {

  private static final Logger logger = LoggerFactory.getLogger(HttpSnapshotCamera.class);

  private final RestClient restClient;
  private final String snapshotUrl;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is an immutable shared Spring managed client")
  public HttpSnapshotCamera(RestClient restClient, String snapshotUrl) {
    this.restClient = restClient;
    this.snapshotUrl = snapshotUrl;
  }

  @Override
  public Optional<byte[]> capturePhoto(String imageEmployeeId, Instant punchTimestamp) {
    try {
      final byte[] frame =
          restClient
              .get()
              .uri(snapshotUrl)
              .accept(MediaType.IMAGE_JPEG)
              .retrieve()
              .body(byte[].class);
      if (frame == null || frame.length == 0) {
        logger.warn(
            "camera returned an empty frame imageEmployeeId={} timestamp={}",
            imageEmployeeId,
            punchTimestamp);
        return Optional.empty();
      }
      return Optional.of(frame);
    } catch (RestClientException ex) {
      logger.warn(
          "camera snapshot failed imageEmployeeId={} timestamp={} url={}",
          imageEmployeeId,
          punchTimestamp,
          snapshotUrl,
          ex);
      return Optional.empty();
    }
  }
}
