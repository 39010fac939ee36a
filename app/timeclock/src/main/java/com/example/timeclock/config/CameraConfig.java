/*
 * どこで: Timeclock 設定
 * 何を: timeclock.camera.enabled からカメラ実装を選択する
 * なぜ: カメラの有無に関わらず同じビルドをキオスクで動かすため
 */
package com.example.timeclock.config;

import com.example.timeclock.camera.Camera;
import com.example.timeclock.camera.DisabledCamera;
import com.example.timeclock.camera.HttpSnapshotCamera;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class CameraConfig {

  @Bean
  @ConditionalOnProperty(name = "timeclock.camera.enabled", havingValue = "true")
  Camera httpSnapshotCamera(RestClient.Builder builder, CameraProperties properties) {
    if (properties.snapshotUrl() == null || properties.snapshotUrl().isBlank()) {
      throw new IllegalStateException("timeclock.camera.snapshot-url is required");
    }
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.timeout());
    requestFactory.setReadTimeout(properties.timeout());
    return new HttpSnapshotCamera(
        builder.requestFactory(requestFactory).build(), properties.snapshotUrl());
  }

  @Bean
  @ConditionalOnProperty(
      name = "timeclock.camera.enabled",
      havingValue = "false",
      matchIfMissing = true)
  Camera disabledCamera() {
    return new DisabledCamera();
  }
}
