/*
 * どこで: Notification インフラ設定
 * 何を: remote キューで利用する StringRedisTemplate を提供する
 * なぜ: Redis バックエンド選択時に Repository が Redis へアクセスできるようにするため
 */
package com.changewatch.scheduler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class RedisConfig {

  // file/embedded 選択時は生成しない
  @Bean
  @Lazy
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }
}
