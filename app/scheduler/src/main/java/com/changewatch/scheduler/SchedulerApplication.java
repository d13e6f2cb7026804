/*
 * どこで: Scheduler アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: 設定クラスとスケジュールをまとめて有効化するため
 */
package com.changewatch.scheduler;

import com.changewatch.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

// 組み込み DB は通知キュー保存先が embedded のときだけ NotificationQueueStorageConfig が作る
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class SchedulerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SchedulerApplication.class, args);
  }
}
