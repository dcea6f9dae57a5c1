package com.example.prism.provider;

import com.example.prism.model.ExchangeRate;
import com.example.prism.model.Price;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Wraps a primary and a secondary provider. The secondary is only consulted
 * when the primary throws; a primary result is returned as is, even when
 * some of its prices are stale.
 */
@Slf4j
public class FallbackPriceProvider implements PriceProvider {

  private final PriceProvider primary;
  private final PriceProvider secondary;

  public FallbackPriceProvider(PriceProvider primary, PriceProvider secondary) {
    this.primary = primary;
    this.secondary = secondary;
  }

  @Override
  public String name() {
    return primary.name() + "+" + secondary.name();
  }

  @Override
  public List<Price> fetchPrices(Collection<String> symbols, Deadline deadline) throws ProviderException {
    try {
      return primary.fetchPrices(symbols, deadline);
    } catch (ProviderException e) {
      log.warn("{} failed, falling back to {}: {}", primary.name(), secondary.name(), e.getMessage());
      return secondary.fetchPrices(symbols, deadline);
    }
  }

  @Override
  public boolean isHealthy(Deadline deadline) {
    return primary.isHealthy(deadline) || secondary.isHealthy(deadline);
  }

  @Override
  public void close() throws ProviderException {
    ProviderException first = null;
    try {
      primary.close();
    } catch (ProviderException e) {
      first = e;
    }
    try {
      secondary.close();
    } catch (ProviderException e) {
      if (first == null) {
        first = e;
      } else {
        first.addSuppressed(e);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  @Override
  public Optional<ExchangeRateCapable> exchangeRates() {
    Optional<ExchangeRateCapable> fromPrimary = primary.exchangeRates();
    Optional<ExchangeRateCapable> fromSecondary = secondary.exchangeRates();
    if (fromPrimary.isEmpty() && fromSecondary.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(deadline -> fetchExchangeRate(fromPrimary, fromSecondary, deadline));
  }

  private ExchangeRate fetchExchangeRate(Optional<ExchangeRateCapable> fromPrimary,
                                         Optional<ExchangeRateCapable> fromSecondary,
                                         Deadline deadline) throws ProviderException {
    ProviderException primaryError = null;
    if (fromPrimary.isPresent()) {
      try {
        return fromPrimary.get().fetchExchangeRate(deadline);
      } catch (ProviderException e) {
        log.warn("{} exchange rate failed: {}", primary.name(), e.getMessage());
        primaryError = e;
      }
    }
    if (fromSecondary.isPresent()) {
      try {
        return fromSecondary.get().fetchExchangeRate(deadline);
      } catch (ProviderException e) {
        if (primaryError != null) {
          e.addSuppressed(primaryError);
        }
        throw e;
      }
    }
    throw primaryError;
  }
}
