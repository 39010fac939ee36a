/*
 * どこで: Timeclock 設定
 * 何を: SOAP 勤怠エンドポイント用の RestClient を提供する
 * なぜ: 設定したタイムアウトのクライアントをゲートウェイが 1 つだけ持つため
 */
package com.example.timeclock.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class AttendanceClientConfig {

  @Bean
  RestClient attendanceRestClient(
      RestClient.Builder builder, AttendanceServiceProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    // ライブ打刻とバックグラウンド同期で同じタイムアウトを使う
    requestFactory.setConnectTimeout(properties.timeout());
    requestFactory.setReadTimeout(properties.timeout());
    return builder.baseUrl(stripTrailingSlash(properties.endpoint()))
        .requestFactory(requestFactory)
        .build();
  }

  private static String stripTrailingSlash(String endpoint) {
    return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
  }
}
