package com.killradar.killfeed.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/** Redis backend. Multi-step operations run as Lua scripts so each one stays atomic on the server. */
public class RedisKillCache extends AbstractKillCache {

  // KEYS[1] counter, ARGV[1] amount, ARGV[2] default, ARGV[3] ttl ms
  private static final RedisScript<Long> INCREMENT_SCRIPT = new DefaultRedisScript<>(
      """
      redis.call('SET', KEYS[1], ARGV[2], 'NX')
      local value = redis.call('INCRBY', KEYS[1], ARGV[1])
      redis.call('PEXPIRE', KEYS[1], ARGV[3])
      return value
      """,
      Long.class);

  // KEYS[1] list, ARGV[1] member, ARGV[2] ttl ms
  private static final RedisScript<Long> PREPEND_UNIQUE_SCRIPT = new DefaultRedisScript<>(
      """
      if redis.call('LPOS', KEYS[1], ARGV[1]) then
        return 0
      end
      redis.call('LPUSH', KEYS[1], ARGV[1])
      redis.call('PEXPIRE', KEYS[1], ARGV[2])
      return 1
      """,
      Long.class);

  private final StringRedisTemplate redisTemplate;

  public RedisKillCache(StringRedisTemplate redisTemplate, FreshnessPolicy freshnessPolicy, Clock clock) {
    super(freshnessPolicy, clock);
    this.redisTemplate = redisTemplate;
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    redisTemplate.opsForValue().set(key, value, ttl);
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(redisTemplate.opsForValue().get(key));
  }

  @Override
  public long increment(String key, long amount, long defaultValue, Duration ttl) {
    Long value = redisTemplate.execute(
        INCREMENT_SCRIPT,
        List.of(key),
        Long.toString(amount),
        Long.toString(defaultValue),
        Long.toString(ttl.toMillis()));
    return value == null ? defaultValue + amount : value;
  }

  @Override
  public boolean prependUnique(String key, String member, Duration ttl) {
    Long added = redisTemplate.execute(
        PREPEND_UNIQUE_SCRIPT, List.of(key), member, Long.toString(ttl.toMillis()));
    return added != null && added == 1L;
  }

  @Override
  public List<String> range(String key, int limit) {
    long end = limit <= 0 ? -1 : limit - 1L;
    List<String> members = redisTemplate.opsForList().range(key, 0, end);
    return members == null ? List.of() : members;
  }

  @Override
  public void delete(String key) {
    redisTemplate.delete(key);
  }
}
