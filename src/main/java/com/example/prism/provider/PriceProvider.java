package com.example.prism.provider;

import com.example.prism.model.Price;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Source of current prices for one asset class.
 *
 * Implementations:
 * - FundPriceProvider: TEFAS fund prices scraped through a browser session
 * - BinancePriceProvider: crypto tickers from the Binance REST API
 * - CoinGeckoPriceProvider: crypto prices from CoinGecko, also exposes USD/TRY
 * - FallbackPriceProvider: primary with a secondary on hard failure
 *
 * Results are unordered; callers index them by symbol.
 */
public interface PriceProvider extends AutoCloseable {

    /**
     * Provider name for logging, e.g. "binance".
     */
    String name();

    /**
     * Fetch current quotes for the requested symbols. Unknown symbols are
     * omitted or returned as stale zero-price placeholders, depending on the source.
     */
    List<Price> fetchPrices(Collection<String> symbols, Deadline deadline) throws ProviderException;

    /**
     * Liveness probe. Never throws.
     */
    boolean isHealthy(Deadline deadline);

    /**
     * Release resources. Safe to call more than once.
     */
    @Override
    void close() throws ProviderException;

    default Optional<ExchangeRateCapable> exchangeRates() {
        return Optional.empty();
    }
}
