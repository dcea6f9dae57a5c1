package com.example.prism.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "prism")
@Data
public class PrismProperties {

    private String version = "dev";
    private String buildTime = "unknown";

    private Duration fetchTimeout = Duration.ofSeconds(30);
    private Duration exchangeRateTimeout = Duration.ofSeconds(10);
    private Duration healthTimeout = Duration.ofSeconds(5);

    // Empty means all origins
    private List<String> corsOrigins = new ArrayList<>();

    private Tefas tefas = new Tefas();
    private Binance binance = new Binance();
    private CoinGecko coingecko = new CoinGecko();
    private Cache cache = new Cache();
    private Seed seed = new Seed();

    @Data
    public static class Tefas {
        private boolean enabled = true;
        private boolean headless = true;
        private String baseUrl = "https://www.tefas.gov.tr";
        private Duration cacheTtl = Duration.ofMinutes(5);
        private int maxConsecutiveFailures = 3;
    }

    @Data
    public static class Binance {
        private boolean enabled = true;
        private String baseUrl = "https://api.binance.com";
        private Duration cacheTtl = Duration.ofSeconds(30);
    }

    @Data
    public static class CoinGecko {
        private boolean enabled = true;
        private String apiKey = "";
        private String baseUrl = "https://api.coingecko.com/api/v3";
        private Duration cacheTtl = Duration.ofSeconds(60);
        private Duration exchangeRateTtl = Duration.ofMinutes(5);
    }

    @Data
    public static class Cache {
        private Redis redis = new Redis();
    }

    @Data
    public static class Redis {
        private boolean enabled = false;
        private Duration ttl = Duration.ofHours(24);
    }

    @Data
    public static class Seed {
        private List<SeedHolding> holdings = new ArrayList<>();
    }

    @Data
    public static class SeedHolding {
        private String type;
        private String symbol;
        private BigDecimal quantity;
        private BigDecimal costBasis;
    }
}
