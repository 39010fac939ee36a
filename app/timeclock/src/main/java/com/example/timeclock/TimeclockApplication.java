/*
 * どこで: Timeclock アプリ起動エントリ
 * 何を: 設定スキャンとスケジューリングを有効にして Spring を起動する
 * なぜ: 同期ワーカーと保持ワーカーを Spring のスケジューラで動かすため
 */
package com.example.timeclock;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class TimeclockApplication {

  public static void main(String[] args) {
    SpringApplication.run(TimeclockApplication.class, args);
  }
}
