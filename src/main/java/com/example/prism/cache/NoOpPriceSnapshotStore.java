package com.example.prism.cache;

import com.example.prism.model.Price;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Snapshot store used when Redis is disabled. Keeps nothing.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "prism.cache.redis.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpPriceSnapshotStore implements PriceSnapshotStore {

  public NoOpPriceSnapshotStore() {
    log.info("Redis price mirror disabled, last known prices are kept in memory only");
  }

  @Override
  public void save(String source, String key, Price price) {
    // nothing to persist
  }

  @Override
  public Optional<Price> load(String source, String key) {
    return Optional.empty();
  }
}
