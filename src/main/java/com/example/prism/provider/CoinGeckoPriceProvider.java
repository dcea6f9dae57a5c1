package com.example.prism.provider;

import com.example.prism.cache.PriceCache;
import com.example.prism.model.ExchangeRate;
import com.example.prism.model.Price;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * CoinGecko simple-price API.
 *
 * Used as the secondary crypto source. Binance-style symbols are mapped to
 * CoinGecko coin ids and all of them are fetched in a single request.
 * Coins missing from the response are left out of the result and are not
 * asked for again until the cache TTL passes.
 *
 * Also provides USD/TRY, derived from Tether's TRY price. Tether tracks the
 * dollar closely but not exactly, so this is an approximation.
 *
 * Free tier is rate limited; set prism.coingecko.api-key for the demo key header.
 */
@Slf4j
public class CoinGeckoPriceProvider implements PriceProvider, ExchangeRateCapable {

  public static final String NAME = "coingecko";

  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
  private static final String API_KEY_HEADER = "x-cg-demo-api-key";

  private static final Map<String, String> COIN_IDS = Map.of(
      "BTCUSDT", "bitcoin",
      "ETHUSDT", "ethereum",
      "SOLUSDT", "solana",
      "BNBUSDT", "binancecoin",
      "XRPUSDT", "ripple",
      "ADAUSDT", "cardano",
      "DOGEUSDT", "dogecoin",
      "DOTUSDT", "polkadot",
      "MATICUSDT", "matic-network",
      "AVAXUSDT", "avalanche-2"
  );

  private static final Map<String, String> COIN_NAMES = Map.of(
      "bitcoin", "Bitcoin",
      "ethereum", "Ethereum",
      "solana", "Solana",
      "binancecoin", "BNB",
      "ripple", "XRP",
      "cardano", "Cardano",
      "dogecoin", "Dogecoin",
      "polkadot", "Polkadot",
      "matic-network", "Polygon",
      "avalanche-2", "Avalanche"
  );

  private final String baseUrl;
  private final String apiKey;
  private final PriceCache cache;
  private final Duration exchangeRateTtl;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final HttpClient httpClient;

  private final ReentrantReadWriteLock rateLock = new ReentrantReadWriteLock();
  private ExchangeRate cachedRate;
  private Instant rateFetchedAt;

  public CoinGeckoPriceProvider(String baseUrl,
                                String apiKey,
                                PriceCache cache,
                                Duration exchangeRateTtl,
                                ObjectMapper objectMapper,
                                Clock clock) {
    this.baseUrl = baseUrl;
    this.apiKey = apiKey;
    this.cache = cache;
    this.exchangeRateTtl = exchangeRateTtl;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.httpClient = HttpClient.newBuilder()
        .connectTimeout(REQUEST_TIMEOUT)
        .build();
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<Price> fetchPrices(Collection<String> symbols, Deadline deadline) throws ProviderException {
    if (symbols.isEmpty()) {
      return List.of();
    }

    Map<String, String> coinIdBySymbol = new LinkedHashMap<>();
    for (String symbol : symbols) {
      coinIdBySymbol.put(symbol, toCoinId(symbol));
    }

    PriceCache.Lookup lookup = cache.lookup(new LinkedHashSet<>(coinIdBySymbol.values()));
    Map<String, Price> byCoinId = new LinkedHashMap<>(lookup.fresh());

    if (lookup.isComplete()) {
      log.debug("Returning {} cached CoinGecko prices", byCoinId.size());
    } else {
      byCoinId.putAll(fetchCoins(lookup.missing(), deadline));
    }

    List<Price> prices = new ArrayList<>();
    coinIdBySymbol.forEach((symbol, coinId) -> {
      Price price = byCoinId.get(coinId);
      if (price != null) {
        prices.add(symbol.equals(price.getSymbol()) ? price : price.toBuilder().symbol(symbol).build());
      }
    });
    return prices;
  }

  private Map<String, Price> fetchCoins(List<String> coinIds, Deadline deadline) throws ProviderException {
    log.info("Fetching CoinGecko prices for {}", coinIds);

    String url = baseUrl + "/simple/price?ids="
        + URLEncoder.encode(String.join(",", coinIds), StandardCharsets.UTF_8)
        + "&vs_currencies=usd&include_24hr_change=true";
    JsonNode root = getJson(url, deadline);

    LocalDateTime now = LocalDateTime.now(clock);
    Map<String, Price> byCoinId = new LinkedHashMap<>();
    List<String> absent = new ArrayList<>();

    for (String coinId : coinIds) {
      JsonNode data = root.path(coinId);
      if (!data.path("usd").isNumber()) {
        log.debug("CoinGecko has no price for {}", coinId);
        absent.add(coinId);
        continue;
      }
      BigDecimal usd = data.path("usd").decimalValue();
      byCoinId.put(coinId, Price.builder()
          .symbol(symbolFor(coinId))
          .name(COIN_NAMES.getOrDefault(coinId, coinId))
          .price(usd.signum() < 0 ? BigDecimal.ZERO : usd)
          .dailyChange(BigDecimal.ZERO)   // simple-price has no absolute change
          .dailyPct(data.path("usd_24h_change").isNumber()
              ? data.path("usd_24h_change").decimalValue()
              : BigDecimal.ZERO)
          .lastUpdated(now)
          .stale(false)
          .build());
    }

    cache.putAll(byCoinId);
    if (!absent.isEmpty()) {
      cache.markAbsent(absent);
    }
    return byCoinId;
  }

  @Override
  public boolean isHealthy(Deadline deadline) {
    try {
      HttpResponse<Void> response = httpClient.send(
          newRequest(baseUrl + "/ping", deadline),
          HttpResponse.BodyHandlers.discarding());
      return response.statusCode() == 200;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (Exception e) {
      log.debug("CoinGecko ping failed: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public void close() {
    // HttpClient holds no resources that need releasing
  }

  @Override
  public Optional<ExchangeRateCapable> exchangeRates() {
    return Optional.of(this);
  }

  @Override
  public ExchangeRate fetchExchangeRate(Deadline deadline) throws ProviderException {
    rateLock.readLock().lock();
    try {
      if (cachedRate != null && clock.instant().isBefore(rateFetchedAt.plus(exchangeRateTtl))) {
        return cachedRate;
      }
    } finally {
      rateLock.readLock().unlock();
    }

    log.info("Fetching USD/TRY exchange rate from CoinGecko");

    JsonNode root = getJson(baseUrl + "/simple/price?ids=tether&vs_currencies=try", deadline);
    JsonNode rateNode = root.path("tether").path("try");
    if (!rateNode.isNumber() || rateNode.decimalValue().signum() <= 0) {
      throw new ProviderException(NAME, "invalid exchange rate response");
    }

    ExchangeRate rate = ExchangeRate.builder()
        .from("USD")
        .to("TRY")
        .rate(rateNode.decimalValue())
        .lastUpdated(LocalDateTime.now(clock))
        .build();

    rateLock.writeLock().lock();
    try {
      cachedRate = rate;
      rateFetchedAt = clock.instant();
    } finally {
      rateLock.writeLock().unlock();
    }

    log.info("Fetched USD/TRY exchange rate: {}", rate.getRate());
    return rate;
  }

  /**
   * Known symbols map through a fixed table, others drop the USDT suffix and lowercase.
   */
  public static String toCoinId(String symbol) {
    String known = COIN_IDS.get(symbol);
    if (known != null) {
      return known;
    }
    String base = symbol.endsWith("USDT") ? symbol.substring(0, symbol.length() - 4) : symbol;
    return base.toLowerCase();
  }

  private static String symbolFor(String coinId) {
    return COIN_IDS.entrySet().stream()
        .filter(entry -> entry.getValue().equals(coinId))
        .map(Map.Entry::getKey)
        .findFirst()
        .orElse(coinId.toUpperCase() + "USDT");
  }

  private JsonNode getJson(String url, Deadline deadline) throws ProviderException {
    deadline.check(NAME);

    HttpResponse<String> response;
    try {
      response = httpClient.send(newRequest(url, deadline), HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderException(NAME, "interrupted", e);
    } catch (IOException e) {
      throw new ProviderException(NAME, "request failed: " + e.getMessage(), e);
    }

    if (response.statusCode() == 429) {
      log.warn("CoinGecko rate limit hit");
      throw new ProviderException(NAME, "rate limited");
    }
    if (response.statusCode() != 200) {
      throw new ProviderException(NAME, "unexpected status " + response.statusCode());
    }

    try {
      return objectMapper.readTree(response.body());
    } catch (JsonProcessingException e) {
      throw new ProviderException(NAME, "invalid response", e);
    }
  }

  private HttpRequest newRequest(String url, Deadline deadline) {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .header("Accept", "application/json")
        .GET()
        .timeout(deadline.cap(REQUEST_TIMEOUT));
    if (apiKey != null && !apiKey.isBlank()) {
      builder.header(API_KEY_HEADER, apiKey);
    }
    return builder.build();
  }
}
