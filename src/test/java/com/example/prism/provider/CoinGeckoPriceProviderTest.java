package com.example.prism.provider;

import com.example.prism.cache.NoOpPriceSnapshotStore;
import com.example.prism.cache.PriceCache;
import com.example.prism.model.ExchangeRate;
import com.example.prism.model.Price;
import com.example.prism.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoinGeckoPriceProviderTest {

    private WireMockServer wireMock;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        wireMock = new WireMockServer(options().dynamicPort());
        wireMock.start();
        clock = MutableClock.at(LocalDateTime.of(2025, 1, 15, 10, 0));
    }

    @AfterEach
    void tearDown() {
        wireMock.stop();
    }

    @Test
    void mapsSymbolsToCoinIds() {
        assertThat(CoinGeckoPriceProvider.toCoinId("BTCUSDT")).isEqualTo("bitcoin");
        assertThat(CoinGeckoPriceProvider.toCoinId("MATICUSDT")).isEqualTo("matic-network");
        assertThat(CoinGeckoPriceProvider.toCoinId("AVAXUSDT")).isEqualTo("avalanche-2");
        assertThat(CoinGeckoPriceProvider.toCoinId("FOOUSDT")).isEqualTo("foo");
    }

    @Test
    void fetchesAllCoinsInOneRequestAndOmitsMissingOnes() throws Exception {
        wireMock.stubFor(get(urlPathEqualTo("/simple/price"))
            .withQueryParam("ids", equalTo("bitcoin,ethereum,foo"))
            .withQueryParam("vs_currencies", equalTo("usd"))
            .withQueryParam("include_24hr_change", equalTo("true"))
            .willReturn(okJson("{\"bitcoin\":{\"usd\":65000.5,\"usd_24h_change\":1.25},"
                + "\"ethereum\":{\"usd\":3400,\"usd_24h_change\":-0.5}}")));

        List<Price> prices = provider("").fetchPrices(List.of("BTCUSDT", "ETHUSDT", "FOOUSDT"), deadline());

        assertThat(prices).extracting(Price::getSymbol).containsExactlyInAnyOrder("BTCUSDT", "ETHUSDT");
        assertThat(prices).filteredOn(p -> p.getSymbol().equals("BTCUSDT"))
            .singleElement()
            .satisfies(p -> {
                assertThat(p.getName()).isEqualTo("Bitcoin");
                assertThat(p.getPrice()).isEqualByComparingTo("65000.5");
                assertThat(p.getDailyPct()).isEqualByComparingTo("1.25");
                assertThat(p.getDailyChange()).isEqualByComparingTo("0");
            });
        wireMock.verify(1, getRequestedFor(urlPathEqualTo("/simple/price")));
    }

    @Test
    void sendsApiKeyHeaderWhenConfigured() throws Exception {
        wireMock.stubFor(get(urlPathEqualTo("/simple/price"))
            .willReturn(okJson("{\"bitcoin\":{\"usd\":65000}}")));

        provider("demo-key").fetchPrices(List.of("BTCUSDT"), deadline());

        wireMock.verify(getRequestedFor(urlPathEqualTo("/simple/price"))
            .withHeader("x-cg-demo-api-key", equalTo("demo-key")));
    }

    @Test
    void cachedWithinTtl() throws Exception {
        wireMock.stubFor(get(urlPathEqualTo("/simple/price"))
            .willReturn(okJson("{\"bitcoin\":{\"usd\":65000}}")));
        CoinGeckoPriceProvider provider = provider("");

        provider.fetchPrices(List.of("BTCUSDT"), deadline());
        clock.advance(Duration.ofSeconds(59));
        provider.fetchPrices(List.of("BTCUSDT"), deadline());
        wireMock.verify(1, getRequestedFor(urlPathEqualTo("/simple/price")));

        clock.advance(Duration.ofSeconds(2));
        provider.fetchPrices(List.of("BTCUSDT"), deadline());
        wireMock.verify(2, getRequestedFor(urlPathEqualTo("/simple/price")));
    }

    @Test
    void coinMissingFromResponseIsNotRequestedAgainWithinTtl() throws Exception {
        wireMock.stubFor(get(urlPathEqualTo("/simple/price"))
            .willReturn(okJson("{\"bitcoin\":{\"usd\":65000}}")));
        CoinGeckoPriceProvider provider = provider("");

        provider.fetchPrices(List.of("BTCUSDT", "FOOUSDT"), deadline());
        clock.advance(Duration.ofSeconds(5));
        List<Price> second = provider.fetchPrices(List.of("BTCUSDT", "FOOUSDT"), deadline());

        assertThat(second).extracting(Price::getSymbol).containsExactly("BTCUSDT");
        wireMock.verify(1, getRequestedFor(urlPathEqualTo("/simple/price")));

        clock.advance(Duration.ofSeconds(60));
        provider.fetchPrices(List.of("BTCUSDT", "FOOUSDT"), deadline());
        wireMock.verify(2, getRequestedFor(urlPathEqualTo("/simple/price")));
    }

    @Test
    void onlyExpiredOrNewCoinsAreRequested() throws Exception {
        wireMock.stubFor(get(urlPathEqualTo("/simple/price"))
            .withQueryParam("ids", equalTo("bitcoin"))
            .willReturn(okJson("{\"bitcoin\":{\"usd\":65000}}")));
        wireMock.stubFor(get(urlPathEqualTo("/simple/price"))
            .withQueryParam("ids", equalTo("ethereum"))
            .willReturn(okJson("{\"ethereum\":{\"usd\":3400}}")));
        CoinGeckoPriceProvider provider = provider("");

        provider.fetchPrices(List.of("BTCUSDT"), deadline());
        List<Price> prices = provider.fetchPrices(List.of("BTCUSDT", "ETHUSDT"), deadline());

        assertThat(prices).extracting(Price::getSymbol).containsExactly("BTCUSDT", "ETHUSDT");
        wireMock.verify(1, getRequestedFor(urlPathEqualTo("/simple/price")).withQueryParam("ids", equalTo("bitcoin")));
        wireMock.verify(1, getRequestedFor(urlPathEqualTo("/simple/price")).withQueryParam("ids", equalTo("ethereum")));
    }

    @Test
    void slowResponseFailsAtTheDeadline() {
        wireMock.stubFor(get(urlPathEqualTo("/simple/price"))
            .willReturn(okJson("{\"bitcoin\":{\"usd\":65000}}").withFixedDelay(3000)));

        long started = System.nanoTime();
        assertThatThrownBy(() -> provider("").fetchPrices(List.of("BTCUSDT"), Deadline.after(Duration.ofMillis(300))))
            .isInstanceOf(ProviderException.class)
            .hasMessageContaining("request failed");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofMillis(1500));
    }

    @Test
    void expiredDeadlineMakesNoRequest() {
        wireMock.stubFor(get(urlPathEqualTo("/simple/price"))
            .willReturn(okJson("{\"tether\":{\"try\":34.25}}")));

        assertThatThrownBy(() -> provider("").fetchExchangeRate(Deadline.after(Duration.ZERO)))
            .isInstanceOf(ProviderException.class)
            .hasMessage("coingecko: deadline exceeded");
        wireMock.verify(0, getRequestedFor(urlPathEqualTo("/simple/price")));
    }

    @Test
    void requestFailureFailsTheCall() {
        wireMock.stubFor(get(urlPathEqualTo("/simple/price"))
            .willReturn(aResponse().withStatus(429)));

        assertThatThrownBy(() -> provider("").fetchPrices(List.of("BTCUSDT"), deadline()))
            .isInstanceOf(ProviderException.class)
            .hasMessageContaining("rate limited");
    }

    @Test
    void exchangeRateFromTetherIsCached() throws Exception {
        wireMock.stubFor(get(urlPathEqualTo("/simple/price"))
            .withQueryParam("ids", equalTo("tether"))
            .withQueryParam("vs_currencies", equalTo("try"))
            .willReturn(okJson("{\"tether\":{\"try\":34.25}}")));
        CoinGeckoPriceProvider provider = provider("");

        assertThat(provider.exchangeRates()).isPresent();
        ExchangeRate rate = provider.exchangeRates().get().fetchExchangeRate(deadline());
        clock.advance(Duration.ofMinutes(4));
        provider.fetchExchangeRate(deadline());

        assertThat(rate.getFrom()).isEqualTo("USD");
        assertThat(rate.getTo()).isEqualTo("TRY");
        assertThat(rate.getRate()).isEqualByComparingTo("34.25");
        wireMock.verify(1, getRequestedFor(urlPathEqualTo("/simple/price")));
    }

    @Test
    void invalidExchangeRateIsRejected() {
        wireMock.stubFor(get(urlPathEqualTo("/simple/price"))
            .willReturn(okJson("{\"tether\":{\"try\":0}}")));

        assertThatThrownBy(() -> provider("").fetchExchangeRate(deadline()))
            .isInstanceOf(ProviderException.class)
            .hasMessageContaining("invalid exchange rate");
    }

    @Test
    void healthUsesPing() {
        wireMock.stubFor(get(urlEqualTo("/ping")).willReturn(okJson("{\"gecko_says\":\"(V3) To the Moon!\"}")));

        assertThat(provider("").isHealthy(deadline())).isTrue();
    }

    private CoinGeckoPriceProvider provider(String apiKey) {
        PriceCache cache = new PriceCache(CoinGeckoPriceProvider.NAME, Duration.ofSeconds(60), clock, new NoOpPriceSnapshotStore());
        return new CoinGeckoPriceProvider("http://localhost:" + wireMock.port(), apiKey, cache,
            Duration.ofMinutes(5), new ObjectMapper(), clock);
    }

    private static Deadline deadline() {
        return Deadline.after(Duration.ofSeconds(5));
    }
}
