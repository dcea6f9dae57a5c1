package com.example.prism.service;

import com.example.prism.config.PrismProperties;
import com.example.prism.model.AssetClassSummary;
import com.example.prism.model.AssetType;
import com.example.prism.model.ExchangeRate;
import com.example.prism.model.Holding;
import com.example.prism.model.PortfolioSummary;
import com.example.prism.model.Price;
import com.example.prism.model.ValuedAsset;
import com.example.prism.provider.Deadline;
import com.example.prism.provider.DisplayNames;
import com.example.prism.provider.ExchangeRateCapable;
import com.example.prism.provider.PriceProvider;
import com.example.prism.provider.ProviderException;
import com.example.prism.provider.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Values holdings against current prices.
 *
 * Stateless: every call reads holdings, asks the class provider for prices
 * and joins the two. Provider failures never reach the caller on the
 * valuation path; affected holdings come back as stale zero-priced entries.
 */
@Slf4j
@Service
public class PortfolioService {

  private final ProviderRegistry providerRegistry;
  private final HoldingService holdingService;
  private final PrismProperties properties;
  private final Clock clock;

  public PortfolioService(ProviderRegistry providerRegistry,
                          HoldingService holdingService,
                          PrismProperties properties,
                          Clock clock) {
    this.providerRegistry = providerRegistry;
    this.holdingService = holdingService;
    this.properties = properties;
    this.clock = clock;
  }

  // =========================================================================
  // Valuation
  // =========================================================================

  public List<ValuedAsset> getFunds() {
    return valueHoldings(AssetType.FUND, holdingService.getHoldingsByType(AssetType.FUND));
  }

  public List<ValuedAsset> getCryptos() {
    return valueHoldings(AssetType.CRYPTO, holdingService.getHoldingsByType(AssetType.CRYPTO));
  }

  public PortfolioSummary getPortfolioSummary() {
    AssetClassSummary funds = AssetClassSummary.of(getFunds());
    AssetClassSummary cryptos = AssetClassSummary.of(getCryptos());
    return PortfolioSummary.of(funds, cryptos, LocalDateTime.now(clock));
  }

  public Optional<ValuedAsset> getFund(String code) {
    return getSingle(AssetType.FUND, code);
  }

  public Optional<ValuedAsset> getCrypto(String symbol) {
    return getSingle(AssetType.CRYPTO, symbol);
  }

  /**
   * Price one symbol and value it against its holding, if any. A missing
   * provider, a provider failure or an empty result reads as not found.
   */
  Optional<ValuedAsset> getSingle(AssetType type, String rawSymbol) {
    String symbol = rawSymbol.trim().toUpperCase();
    Optional<PriceProvider> provider = providerRegistry.get(type);
    if (provider.isEmpty()) {
      log.warn("No {} provider configured, cannot look up {}", type.getValue(), symbol);
      return Optional.empty();
    }

    List<Price> prices;
    try {
      prices = provider.get().fetchPrices(List.of(symbol), Deadline.after(properties.getFetchTimeout()));
    } catch (ProviderException e) {
      log.warn("Lookup of {} {} failed: {}", type.getValue(), symbol, e.getMessage());
      return Optional.empty();
    }

    Holding holding = holdingService.findHolding(type, symbol).orElse(null);
    return prices.stream()
        .filter(price -> symbol.equals(price.getSymbol()))
        .findFirst()
        .map(price -> ValuedAsset.of(type, price, holding));
  }

  List<ValuedAsset> valueHoldings(AssetType type, List<Holding> holdings) {
    LocalDateTime now = LocalDateTime.now(clock);
    Map<String, Holding> bySymbol = new LinkedHashMap<>();
    for (Holding holding : holdings) {
      bySymbol.put(holding.getSymbol(), holding);
    }

    Optional<PriceProvider> provider = providerRegistry.get(type);
    if (provider.isEmpty() || bySymbol.isEmpty()) {
      return placeholders(type, bySymbol.values(), now);
    }

    List<Price> prices;
    try {
      prices = provider.get().fetchPrices(bySymbol.keySet(), Deadline.after(properties.getFetchTimeout()));
    } catch (ProviderException e) {
      log.warn("Failed to price {} holdings with {}, returning placeholders: {}",
          type.getValue(), provider.get().name(), e.getMessage());
      return placeholders(type, bySymbol.values(), now);
    }

    List<ValuedAsset> assets = new ArrayList<>(bySymbol.size());
    Set<String> priced = new LinkedHashSet<>();
    for (Price price : prices) {
      if (!priced.add(price.getSymbol())) {
        continue;
      }
      assets.add(ValuedAsset.of(type, price, bySymbol.get(price.getSymbol())));
    }

    // Holdings the provider left out are still reported
    for (Holding holding : bySymbol.values()) {
      if (!priced.contains(holding.getSymbol())) {
        assets.add(placeholder(type, holding, now));
      }
    }
    return assets;
  }

  // =========================================================================
  // Exchange rate and health
  // =========================================================================

  /**
   * USD/TRY from the crypto provider.
   *
   * @throws ProviderException if no provider supports exchange rates or the fetch fails
   */
  public ExchangeRate getExchangeRate() throws ProviderException {
    PriceProvider provider = providerRegistry.get(AssetType.CRYPTO)
        .orElseThrow(() -> new ProviderException("crypto", "no crypto provider configured"));
    ExchangeRateCapable rates = provider.exchangeRates()
        .orElseThrow(() -> new ProviderException(provider.name(), "exchange rates not supported"));
    return rates.fetchExchangeRate(Deadline.after(properties.getExchangeRateTimeout()));
  }

  /**
   * Health per asset class. A class without a provider reports false.
   */
  public Map<AssetType, Boolean> getProviderHealth() {
    Map<AssetType, Boolean> health = new LinkedHashMap<>();
    for (AssetType type : AssetType.values()) {
      health.put(type, providerRegistry.get(type)
          .map(provider -> provider.isHealthy(Deadline.after(properties.getHealthTimeout())))
          .orElse(false));
    }
    return health;
  }

  private List<ValuedAsset> placeholders(AssetType type, Iterable<Holding> holdings, LocalDateTime now) {
    List<ValuedAsset> assets = new ArrayList<>();
    for (Holding holding : holdings) {
      assets.add(placeholder(type, holding, now));
    }
    return assets;
  }

  private static ValuedAsset placeholder(AssetType type, Holding holding, LocalDateTime now) {
    String name = type == AssetType.FUND
        ? DisplayNames.fund(holding.getSymbol())
        : DisplayNames.crypto(holding.getSymbol());
    return ValuedAsset.placeholder(type, holding, name, now);
  }
}
