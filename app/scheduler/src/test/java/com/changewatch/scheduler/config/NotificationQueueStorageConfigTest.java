package com.changewatch.scheduler.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import com.changewatch.scheduler.repository.NotificationQueueStorage;
import com.changewatch.scheduler.repository.QueueStorageKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.core.StringRedisTemplate;

class NotificationQueueStorageConfigTest {

  private final NotificationQueueStorageConfig config = new NotificationQueueStorageConfig();
  private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

  @SuppressWarnings("unchecked")
  private final ObjectProvider<StringRedisTemplate> redisTemplate = mock(ObjectProvider.class);

  @TempDir Path tempDir;

  @Test
  void fileStorageIsDefault() {
    final NotificationQueueStorage storage =
        config.notificationQueueStorage(
            new NotificationQueueProperties(null, tempDir.toString(), null),
            objectMapper,
            redisTemplate);

    assertThat(storage.kind()).isEqualTo(QueueStorageKind.FILE);
    verifyNoInteractions(redisTemplate);
  }

  @Test
  void embeddedStorageCreatesDatabaseFile() {
    final NotificationQueueStorage storage =
        config.notificationQueueStorage(
            new NotificationQueueProperties("embedded", tempDir.resolve("q").toString(), null),
            objectMapper,
            redisTemplate);

    assertThat(storage.kind()).isEqualTo(QueueStorageKind.EMBEDDED);
    assertThat(Files.exists(tempDir.resolve("q").resolve("notification-queue.db"))).isTrue();
  }

  @Test
  void unknownStorageFailsFast() {
    assertThatThrownBy(
            () ->
                config.notificationQueueStorage(
                    new NotificationQueueProperties("mongo", tempDir.toString(), null),
                    objectMapper,
                    redisTemplate))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("mongo");
  }
}
