/*
 * どこで: Notification インフラ設定
 * 何を: 設定値から通知キューの保存バックエンドを 1 つだけ生成する
 * なぜ: バックエンド選択を起動時に閉じ込め、配信処理からは種別を見えなくするため
 */
package com.changewatch.scheduler.config;

import com.changewatch.scheduler.repository.FileNotificationQueueStorage;
import com.changewatch.scheduler.repository.NotificationQueueStorage;
import com.changewatch.scheduler.repository.NotificationQueueStorageException;
import com.changewatch.scheduler.repository.QueueStorageKind;
import com.changewatch.scheduler.repository.RedisNotificationQueueStorage;
import com.changewatch.scheduler.repository.SqliteNotificationQueueStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

@Configuration
public class NotificationQueueStorageConfig {

  private static final Logger logger =
      LoggerFactory.getLogger(NotificationQueueStorageConfig.class);
  private static final String SQLITE_FILE = "notification-queue.db";
  private static final int SQLITE_BUSY_TIMEOUT_MILLIS = 5000;

  @Bean
  NotificationQueueStorage notificationQueueStorage(
      NotificationQueueProperties properties,
      ObjectMapper objectMapper,
      ObjectProvider<StringRedisTemplate> redisTemplate) {
    final QueueStorageKind kind = QueueStorageKind.fromValue(properties.storage());
    logger.info(
        "notification queue storage selected kind={} path={}", kind, properties.path());
    return switch (kind) {
      case FILE -> new FileNotificationQueueStorage(objectMapper, Path.of(properties.path()));
      case EMBEDDED -> embeddedStorage(properties, objectMapper);
      case REMOTE ->
          new RedisNotificationQueueStorage(
              redisTemplate.getObject(), objectMapper, properties.redisKeyPrefix());
    };
  }

  static SqliteNotificationQueueStorage embeddedStorage(
      NotificationQueueProperties properties, ObjectMapper objectMapper) {
    final Path dbFile = Path.of(properties.path()).resolve(SQLITE_FILE);
    try {
      Files.createDirectories(dbFile.toAbsolutePath().getParent());
    } catch (IOException ex) {
      throw new NotificationQueueStorageException("failed to create sqlite directory " + dbFile, ex);
    }
    final SQLiteConfig sqliteConfig = new SQLiteConfig();
    sqliteConfig.setBusyTimeout(SQLITE_BUSY_TIMEOUT_MILLIS);
    final SQLiteDataSource dataSource = new SQLiteDataSource(sqliteConfig);
    dataSource.setUrl("jdbc:sqlite:" + dbFile.toAbsolutePath());
    return new SqliteNotificationQueueStorage(
        objectMapper,
        new NamedParameterJdbcTemplate(dataSource),
        new DataSourceTransactionManager(dataSource));
  }
}
