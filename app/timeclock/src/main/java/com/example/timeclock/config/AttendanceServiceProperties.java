/*
 * どこで: Timeclock 設定バインド
 * 何を: リモート勤怠サービスの接続先・認証情報・タイムアウトを保持する
 * なぜ: キオスクごとに client id とアカウントを切り替えるため
 */
package com.example.timeclock.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "timeclock.attendance")
public record AttendanceServiceProperties(
    String endpoint,
    String summaryPath,
    String checkinPath,
    String namespace,
    String username,
    String password,
    String clientId,
    Duration timeout) {

  public AttendanceServiceProperties {
    endpoint = endpoint == null || endpoint.isBlank() ? "http://msiwebtrax.com/" : endpoint;
    summaryPath =
        summaryPath == null || summaryPath.isBlank()
            ? "/Services/MSIWebTraxCheckInSummary.asmx"
            : summaryPath;
    checkinPath =
        checkinPath == null || checkinPath.isBlank()
            ? "/Services/MSIWebTraxCheckIn.asmx"
            : checkinPath;
    namespace = namespace == null || namespace.isBlank() ? "http://msiwebtrax.com/" : namespace;
    username = username == null ? "" : username;
    password = password == null ? "" : password;
    clientId = clientId == null ? "" : clientId;
    timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
  }
}
