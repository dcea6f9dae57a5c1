package com.example.prism.provider;

import com.example.prism.cache.PriceCache;
import com.example.prism.model.Price;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * TEFAS fund prices.
 *
 * TEFAS publishes one price per fund per business day. A fetch pulls the
 * whole table for the last business day and picks out the requested codes.
 * Prices fetched on a weekend are flagged stale since they are Friday's.
 *
 * Access to the underlying browser session is serialized. After
 * {@code maxConsecutiveFailures} failed fetches in a row the session is
 * closed so that the next fetch starts a fresh one.
 */
@Slf4j
public class FundPriceProvider implements PriceProvider {

  public static final String NAME = "tefas";
  public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy");

  private final FundRowSource rowSource;
  private final PriceCache cache;
  private final Clock clock;
  private final int maxConsecutiveFailures;

  private final ReentrantLock sessionLock = new ReentrantLock();
  private int consecutiveFailures;   // guarded by sessionLock

  public FundPriceProvider(FundRowSource rowSource, PriceCache cache, Clock clock, int maxConsecutiveFailures) {
    this.rowSource = rowSource;
    this.cache = cache;
    this.clock = clock;
    this.maxConsecutiveFailures = Math.max(1, maxConsecutiveFailures);
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

    Optional<List<Price>> cached = cache.getFresh(symbols);
    if (cached.isPresent()) {
      log.debug("Returning {} cached TEFAS prices", cached.get().size());
      return cached.get();
    }

    LocalDate today = LocalDate.now(clock);
    LocalDate targetDate = lastBusinessDay(today);

    log.info("Fetching TEFAS prices for {} on {}", symbols, DATE_FORMAT.format(targetDate));

    List<FundRow> rows;
    try {
      rows = fetchRows(targetDate, deadline);
    } catch (ProviderException e) {
      List<Price> stale = lastKnown(symbols);
      if (!stale.isEmpty()) {
        log.warn("Returning {} stale TEFAS prices after fetch failure: {}", stale.size(), e.getMessage());
        return stale;
      }
      throw e;
    }

    Map<String, FundRow> byCode = new HashMap<>();
    for (FundRow row : rows) {
      if (row.getCode() != null) {
        byCode.put(row.getCode().trim().toUpperCase(), row);
      }
    }

    LocalDateTime now = LocalDateTime.now(clock);
    boolean weekend = isWeekend(today);
    Map<String, Price> prices = new LinkedHashMap<>();

    for (String symbol : symbols) {
      FundRow row = byCode.get(symbol);
      if (row != null) {
        prices.put(symbol, Price.builder()
            .symbol(symbol)
            .name(row.getName() != null && !row.getName().isBlank() ? row.getName().trim() : DisplayNames.fund(symbol))
            .price(nonNegative(row.getPrice()))
            .dailyChange(BigDecimal.ZERO)
            .dailyPct(BigDecimal.ZERO)
            .lastUpdated(now)
            .stale(weekend)
            .build());
      } else {
        log.warn("Fund {} not found in TEFAS response", symbol);
        prices.put(symbol, Price.placeholder(symbol, DisplayNames.fund(symbol), now));
      }
    }

    cache.putAll(prices);
    return new ArrayList<>(prices.values());
  }

  @Override
  public boolean isHealthy(Deadline deadline) {
    return rowSource.isReady();
  }

  @Override
  public void close() {
    log.info("Closing TEFAS provider");
    rowSource.close();
  }

  /**
   * Saturday and Sunday map back to the preceding Friday.
   */
  public static LocalDate lastBusinessDay(LocalDate date) {
    return switch (date.getDayOfWeek()) {
      case SATURDAY -> date.minusDays(1);
      case SUNDAY -> date.minusDays(2);
      default -> date;
    };
  }

  private static boolean isWeekend(LocalDate date) {
    DayOfWeek day = date.getDayOfWeek();
    return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
  }

  private List<FundRow> fetchRows(LocalDate date, Deadline deadline) throws ProviderException {
    deadline.check(NAME);
    acquireSession(deadline);
    try {
      List<FundRow> rows = rowSource.fetchRows(date, deadline);
      consecutiveFailures = 0;
      log.info("Fetched {} TEFAS rows", rows.size());
      return rows;
    } catch (ProviderException e) {
      consecutiveFailures++;
      log.error("TEFAS fetch failed ({} in a row): {}", consecutiveFailures, e.getMessage());
      if (consecutiveFailures >= maxConsecutiveFailures) {
        log.warn("Resetting TEFAS browser session after {} consecutive failures", consecutiveFailures);
        rowSource.close();
        consecutiveFailures = 0;
      }
      throw e;
    } finally {
      sessionLock.unlock();
    }
  }

  private void acquireSession(Deadline deadline) throws ProviderException {
    try {
      if (!sessionLock.tryLock(deadline.remaining().toNanos(), TimeUnit.NANOSECONDS)) {
        throw new ProviderException(NAME, "timed out waiting for browser session");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderException(NAME, "interrupted waiting for browser session", e);
    }
  }

  private List<Price> lastKnown(Collection<String> symbols) {
    List<Price> prices = new ArrayList<>();
    for (String symbol : symbols) {
      cache.getLastKnown(symbol).map(Price::asStale).ifPresent(prices::add);
    }
    return prices;
  }

  private static BigDecimal nonNegative(BigDecimal value) {
    if (value == null || value.signum() < 0) {
      return BigDecimal.ZERO;
    }
    return value;
  }
}
