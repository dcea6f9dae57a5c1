package com.example.prism.config;

import com.example.prism.cache.PriceCache;
import com.example.prism.cache.PriceSnapshotStore;
import com.example.prism.model.AssetType;
import com.example.prism.provider.BinancePriceProvider;
import com.example.prism.provider.CoinGeckoPriceProvider;
import com.example.prism.provider.FallbackPriceProvider;
import com.example.prism.provider.FundPriceProvider;
import com.example.prism.provider.PlaywrightFundRowSource;
import com.example.prism.provider.PriceProvider;
import com.example.prism.provider.ProviderRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Wires the price providers from {@code prism.*} settings.
 *
 * Crypto uses Binance with CoinGecko as fallback when both are enabled, or
 * whichever one is. A provider that fails to construct is logged and left out.
 */
@Slf4j
@Configuration
public class ProviderConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ProviderRegistry providerRegistry(PrismProperties properties,
                                             PriceSnapshotStore snapshotStore,
                                             ObjectMapper objectMapper,
                                             Clock clock) {
        Map<AssetType, PriceProvider> providers = new EnumMap<>(AssetType.class);

        if (properties.getTefas().isEnabled()) {
            PriceProvider tefas = createFundProvider(properties.getTefas(), snapshotStore, objectMapper, clock);
            if (tefas != null) {
                providers.put(AssetType.FUND, tefas);
            }
        } else {
            log.info("TEFAS provider disabled");
        }

        PriceProvider binance = properties.getBinance().isEnabled()
            ? createBinanceProvider(properties.getBinance(), snapshotStore, objectMapper, clock)
            : null;
        PriceProvider coinGecko = properties.getCoingecko().isEnabled()
            ? createCoinGeckoProvider(properties.getCoingecko(), snapshotStore, objectMapper, clock)
            : null;

        if (binance != null && coinGecko != null) {
            providers.put(AssetType.CRYPTO, new FallbackPriceProvider(binance, coinGecko));
        } else if (binance != null) {
            providers.put(AssetType.CRYPTO, binance);
        } else if (coinGecko != null) {
            providers.put(AssetType.CRYPTO, coinGecko);
        } else {
            log.warn("No crypto provider available");
        }

        providers.forEach((type, provider) ->
            log.info("Using {} provider for {}", provider.name(), type.getValue()));

        return new ProviderRegistry(providers);
    }

    private PriceProvider createFundProvider(PrismProperties.Tefas settings,
                                             PriceSnapshotStore snapshotStore,
                                             ObjectMapper objectMapper,
                                             Clock clock) {
        try {
            PriceCache cache = new PriceCache(FundPriceProvider.NAME, settings.getCacheTtl(), clock, snapshotStore);
            PlaywrightFundRowSource rowSource =
                new PlaywrightFundRowSource(settings.getBaseUrl(), settings.isHeadless(), objectMapper);
            return new FundPriceProvider(rowSource, cache, clock, settings.getMaxConsecutiveFailures());
        } catch (RuntimeException e) {
            log.error("Failed to create TEFAS provider", e);
            return null;
        }
    }

    private PriceProvider createBinanceProvider(PrismProperties.Binance settings,
                                                PriceSnapshotStore snapshotStore,
                                                ObjectMapper objectMapper,
                                                Clock clock) {
        try {
            PriceCache cache = new PriceCache(BinancePriceProvider.NAME, settings.getCacheTtl(), clock, snapshotStore);
            return new BinancePriceProvider(settings.getBaseUrl(), cache, objectMapper, clock);
        } catch (RuntimeException e) {
            log.error("Failed to create Binance provider", e);
            return null;
        }
    }

    private PriceProvider createCoinGeckoProvider(PrismProperties.CoinGecko settings,
                                                  PriceSnapshotStore snapshotStore,
                                                  ObjectMapper objectMapper,
                                                  Clock clock) {
        try {
            PriceCache cache = new PriceCache(CoinGeckoPriceProvider.NAME, settings.getCacheTtl(), clock, snapshotStore);
            return new CoinGeckoPriceProvider(settings.getBaseUrl(), settings.getApiKey(), cache,
                settings.getExchangeRateTtl(), objectMapper, clock);
        } catch (RuntimeException e) {
            log.error("Failed to create CoinGecko provider", e);
            return null;
        }
    }
}
