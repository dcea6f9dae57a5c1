package com.example.prism.cache;

import com.example.prism.config.PrismProperties;
import com.example.prism.model.Price;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Mirrors last known prices into Redis under {@code price:{source}:{key}}.
 * Redis errors are logged and never fail a price request.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "prism.cache.redis.enabled", havingValue = "true")
public class RedisPriceSnapshotStore implements PriceSnapshotStore {

  private static final String KEY_PREFIX = "price:";

  private final RedisTemplate<String, Price> priceRedisTemplate;
  private final PrismProperties properties;

  public RedisPriceSnapshotStore(RedisTemplate<String, Price> priceRedisTemplate,
                                 PrismProperties properties) {
    this.priceRedisTemplate = priceRedisTemplate;
    this.properties = properties;
  }

  @Override
  public void save(String source, String key, Price price) {
    try {
      priceRedisTemplate.opsForValue().set(redisKey(source, key), price, properties.getCache().getRedis().getTtl());
    } catch (Exception e) {
      log.warn("Failed to cache {} price for {} in Redis: {}", source, key, e.getMessage());
    }
  }

  @Override
  public Optional<Price> load(String source, String key) {
    try {
      return Optional.ofNullable(priceRedisTemplate.opsForValue().get(redisKey(source, key)));
    } catch (Exception e) {
      log.warn("Failed to read {} price for {} from Redis: {}", source, key, e.getMessage());
      return Optional.empty();
    }
  }

  private static String redisKey(String source, String key) {
    return KEY_PREFIX + source + ":" + key;
  }
}
