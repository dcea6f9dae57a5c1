package com.example.prism.provider;

import com.example.prism.cache.PriceCache;
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
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Binance 24h ticker prices.
 *
 * One REST call per symbol, no API key needed. Symbols still fresh in the
 * cache are not requested again. A symbol whose call fails is
 * answered from its last known price, flagged stale. The call as a whole
 * fails only when no symbol could be answered at all.
 */
@Slf4j
public class BinancePriceProvider implements PriceProvider {

  public static final String NAME = "binance";

  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

  private final String baseUrl;
  private final PriceCache cache;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final HttpClient httpClient;

  public BinancePriceProvider(String baseUrl, PriceCache cache, ObjectMapper objectMapper, Clock clock) {
    this.baseUrl = baseUrl;
    this.cache = cache;
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

    PriceCache.Lookup lookup = cache.lookup(symbols);
    if (lookup.isComplete()) {
      log.debug("Returning {} cached Binance prices", lookup.fresh().size());
      return new ArrayList<>(lookup.fresh().values());
    }

    log.info("Fetching Binance tickers for {}", lookup.missing());

    Map<String, Price> fetched = new HashMap<>();
    ProviderException lastError = null;

    for (String symbol : lookup.missing()) {
      try {
        deadline.check(NAME);
        Price price = fetchTicker(symbol, deadline);
        cache.put(symbol, price);
        fetched.put(symbol, price);
      } catch (ProviderException e) {
        if (Thread.currentThread().isInterrupted()) {
          throw e;
        }
        lastError = e;
        log.warn("Failed to fetch Binance ticker for {}: {}", symbol, e.getMessage());
        cache.getLastKnown(symbol).map(Price::asStale).ifPresent(stale -> fetched.put(symbol, stale));
      }
    }

    // Keep the caller's symbol order
    List<Price> prices = new ArrayList<>(symbols.size());
    for (String symbol : symbols) {
      Price price = lookup.fresh().containsKey(symbol) ? lookup.fresh().get(symbol) : fetched.get(symbol);
      if (price != null) {
        prices.add(price);
      }
    }

    if (prices.isEmpty() && lastError != null) {
      throw new ProviderException(NAME, "no prices available for " + symbols, lastError);
    }
    return prices;
  }

  @Override
  public boolean isHealthy(Deadline deadline) {
    try {
      HttpRequest request = HttpRequest.newBuilder()
          .uri(URI.create(baseUrl + "/api/v3/ping"))
          .GET()
          .timeout(deadline.cap(REQUEST_TIMEOUT))
          .build();
      HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
      return response.statusCode() == 200;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (Exception e) {
      log.debug("Binance ping failed: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public void close() {
    // HttpClient holds no resources that need releasing
  }

  private Price fetchTicker(String symbol, Deadline deadline) throws ProviderException {
    String url = baseUrl + "/api/v3/ticker/24hr?symbol=" + URLEncoder.encode(symbol, StandardCharsets.UTF_8);

    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .header("Accept", "application/json")
        .GET()
        .timeout(deadline.cap(REQUEST_TIMEOUT))
        .build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderException(NAME, "interrupted fetching " + symbol, e);
    } catch (IOException e) {
      throw new ProviderException(NAME, "request failed for " + symbol + ": " + e.getMessage(), e);
    }

    if (response.statusCode() == 429) {
      log.warn("Binance rate limit hit while fetching {}", symbol);
      throw new ProviderException(NAME, "rate limited");
    }
    if (response.statusCode() != 200) {
      throw new ProviderException(NAME, "unexpected status " + response.statusCode() + " for " + symbol);
    }

    return parseTicker(symbol, response.body());
  }

  /**
   * Numeric fields arrive as strings. Anything unparseable reads as zero.
   */
  Price parseTicker(String symbol, String body) throws ProviderException {
    JsonNode ticker;
    try {
      ticker = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new ProviderException(NAME, "invalid ticker response for " + symbol, e);
    }

    BigDecimal lastPrice = getBigDecimal(ticker, "lastPrice");

    return Price.builder()
        .symbol(symbol)
        .name(DisplayNames.crypto(symbol))
        .price(lastPrice.signum() < 0 ? BigDecimal.ZERO : lastPrice)
        .dailyChange(getBigDecimal(ticker, "priceChange"))
        .dailyPct(getBigDecimal(ticker, "priceChangePercent"))
        .lastUpdated(LocalDateTime.now(clock))
        .stale(false)
        .build();
  }

  private static BigDecimal getBigDecimal(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull()) {
      return BigDecimal.ZERO;
    }
    try {
      return new BigDecimal(value.asText().trim());
    } catch (NumberFormatException e) {
      log.debug("Unparseable Binance field {}: {}", field, value.asText());
      return BigDecimal.ZERO;
    }
  }
}
