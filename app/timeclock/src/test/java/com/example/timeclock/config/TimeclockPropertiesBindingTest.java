/*
 * どこで: Timeclock 設定バインドのテスト
 * 何を: timeclock.* の Duration とデフォルト値のバインドを検証する
 * なぜ: 間隔の誤読で再送や保持の挙動が黙って変わらないようにするため
 */
package com.example.timeclock.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class TimeclockPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "timeclock.attendance.endpoint=https://attendance.example/",
              "timeclock.attendance.client-id=client-9",
              "timeclock.attendance.timeout=7s",
              "timeclock.sync.enabled=true",
              "timeclock.sync.poll-interval=PT30S",
              "timeclock.sync.batch-size=50",
              "timeclock.sync.max-attempts=20",
              "timeclock.sync.backoff-base=5s",
              "timeclock.sync.backoff-max=5m",
              "timeclock.sync.backoff-exponent-base=2.0",
              "timeclock.sync.error-message-max-length=500",
              "timeclock.sync.max-records=10000",
              "timeclock.retention.enabled=true",
              "timeclock.retention.retention-days=10",
              "timeclock.retention.cleanup-interval=PT1H",
              "timeclock.punch.throttle-window=3s");

  @Test
  void contextStartsAndBindsDurationFields() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final AttendanceServiceProperties attendance =
              context.getBean(AttendanceServiceProperties.class);
          final PunchSyncProperties sync = context.getBean(PunchSyncProperties.class);
          final PunchRetentionProperties retention =
              context.getBean(PunchRetentionProperties.class);
          final PunchSubmissionProperties punch = context.getBean(PunchSubmissionProperties.class);

          assertThat(attendance.endpoint()).isEqualTo("https://attendance.example/");
          assertThat(attendance.clientId()).isEqualTo("client-9");
          assertThat(attendance.timeout()).isEqualTo(Duration.ofSeconds(7));
          assertThat(sync.pollInterval()).isEqualTo(Duration.ofSeconds(30));
          assertThat(sync.backoffBase()).isEqualTo(Duration.ofSeconds(5));
          assertThat(sync.backoffMax()).isEqualTo(Duration.ofMinutes(5));
          assertThat(sync.maxAttempts()).isEqualTo(20);
          assertThat(retention.retentionDays()).isEqualTo(10);
          assertThat(retention.cleanupInterval()).isEqualTo(Duration.ofHours(1));
          assertThat(punch.throttleWindow()).isEqualTo(Duration.ofSeconds(3));
        });
  }

  @Test
  void missingValuesFallBackToDefaults() {
    new ApplicationContextRunner()
        .withUserConfiguration(TestConfiguration.class)
        .run(
            context -> {
              final AttendanceServiceProperties attendance =
                  context.getBean(AttendanceServiceProperties.class);
              final PunchSubmissionProperties punch =
                  context.getBean(PunchSubmissionProperties.class);
              final CameraProperties camera = context.getBean(CameraProperties.class);

              assertThat(attendance.summaryPath())
                  .isEqualTo("/Services/MSIWebTraxCheckInSummary.asmx");
              assertThat(attendance.namespace()).isEqualTo("http://msiwebtrax.com/");
              assertThat(attendance.timeout()).isEqualTo(Duration.ofSeconds(10));
              assertThat(punch.workerThreads()).isEqualTo(2);
              assertThat(punch.throttleWindow()).isEqualTo(Duration.ofSeconds(5));
              assertThat(camera.enabled()).isFalse();
              assertThat(camera.timeout()).isEqualTo(Duration.ofSeconds(2));
            });
  }

  @Configuration
  @EnableConfigurationProperties({
    AttendanceServiceProperties.class,
    PunchSyncProperties.class,
    PunchRetentionProperties.class,
    PunchSubmissionProperties.class,
    CameraProperties.class
  })
  static class TestConfiguration {}
}
