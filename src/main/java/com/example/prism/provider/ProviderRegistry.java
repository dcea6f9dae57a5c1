package com.example.prism.provider;

import com.example.prism.model.AssetType;
import lombok.extern.slf4j.Slf4j;

import jakarta.annotation.PreDestroy;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Price provider per asset class. A class without a provider is simply
 * absent and always reported as degraded.
 */
@Slf4j
public class ProviderRegistry {

  private final Map<AssetType, PriceProvider> providers;

  public ProviderRegistry(Map<AssetType, PriceProvider> providers) {
    this.providers = providers.isEmpty()
        ? new EnumMap<>(AssetType.class)
        : new EnumMap<>(providers);
  }

  public Optional<PriceProvider> get(AssetType type) {
    return Optional.ofNullable(providers.get(type));
  }

  public Map<AssetType, PriceProvider> all() {
    return Collections.unmodifiableMap(providers);
  }

  @PreDestroy
  public void closeAll() {
    providers.forEach((type, provider) -> {
      try {
        provider.close();
        log.info("Closed {} provider {}", type.getValue(), provider.name());
      } catch (ProviderException e) {
        log.error("Failed to close {} provider {}", type.getValue(), provider.name(), e);
      }
    });
  }
}
