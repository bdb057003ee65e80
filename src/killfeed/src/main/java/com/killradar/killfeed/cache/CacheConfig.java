package com.killradar.killfeed.cache;

import com.killradar.killfeed.config.KillfeedProperties;
import java.time.Clock;
import java.util.Locale;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class CacheConfig {
  private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

  @Bean
  public FreshnessPolicy freshnessPolicy(KillfeedProperties properties, RandomGenerator jitterRandom) {
    return new FreshnessPolicy(properties.cache(), jitterRandom);
  }

  @Bean
  public KillCache killCache(
      KillfeedProperties properties,
      ObjectProvider<StringRedisTemplate> redisTemplate,
      FreshnessPolicy freshnessPolicy,
      Clock clock) {
    String backend = properties.cache().backend() == null
        ? "redis"
        : properties.cache().backend().trim().toLowerCase(Locale.ROOT);
    log.info("Kill cache backend: {}", backend);
    return switch (backend) {
      case "memory" -> new InMemoryKillCache(freshnessPolicy, clock);
      case "redis" -> new RedisKillCache(redisTemplate.getObject(), freshnessPolicy, clock);
      default -> throw new IllegalStateException("Unsupported killfeed.cache.backend: " + backend);
    };
  }
}
