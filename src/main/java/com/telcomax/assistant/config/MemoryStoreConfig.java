package com.telcomax.assistant.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.telcomax.assistant.memory.InMemorySessionRepository;
import com.telcomax.assistant.memory.JdbcSessionRepository;
import com.telcomax.assistant.memory.RedisSessionRepository;
import com.telcomax.assistant.memory.SessionRepository;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Selects the session store from {@code app.memory.store}: jdbc (default), redis or in-memory.
 */
@Configuration
public class MemoryStoreConfig {

  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnProperty(name = "app.memory.store", havingValue = "jdbc", matchIfMissing = true)
  public SessionRepository jdbcSessionRepository(JdbcTemplate jdbcTemplate, Clock clock) {
    return new JdbcSessionRepository(jdbcTemplate, clock);
  }

  @Bean
  @ConditionalOnProperty(name = "app.memory.store", havingValue = "redis")
  public SessionRepository redisSessionRepository(
      StringRedisTemplate redisTemplate,
      ObjectMapper mapper,
      Clock clock,
      @Value("${app.memory.redis-key-prefix:session:}") String keyPrefix) {
    return new RedisSessionRepository(redisTemplate, mapper, keyPrefix, clock);
  }

  @Bean
  @ConditionalOnProperty(name = "app.memory.store", havingValue = "in-memory")
  public SessionRepository inMemorySessionRepository(Clock clock) {
    return new InMemorySessionRepository(clock);
  }
}
