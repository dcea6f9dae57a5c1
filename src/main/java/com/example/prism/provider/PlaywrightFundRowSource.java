package com.example.prism.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the TEFAS price table through a headless Chromium session.
 *
 * TEFAS sits behind a WAF that rejects plain HTTP clients, so the request is
 * issued with {@code fetch} from inside a page that has already loaded the
 * historical data screen and holds its cookies.
 */
@Slf4j
public class PlaywrightFundRowSource implements FundRowSource {

  private static final String USER_AGENT =
      "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/136.0.0.0 Safari/537.36";

  private static final List<String> LAUNCH_ARGS = List.of(
      "--no-sandbox",
      "--disable-dev-shm-usage",
      "--disable-blink-features=AutomationControlled",
      "--disable-infobars",
      "--window-size=1920,1080"
  );

  private static final String HIDE_WEBDRIVER_SCRIPT =
      "Object.defineProperty(navigator, 'webdriver', { get: () => undefined });";

  private static final String WAF_MARKER = "WAF_BLOCKED";

  private static final String FETCH_SCRIPT = """
      async ({ date, timeoutMs }) => {
        const params = new URLSearchParams({
          fontip: 'YAT',
          sfontur: '',
          fonkod: '',
          fongrup: '',
          bastarih: date,
          bittarih: date,
          fonturkod: '',
          fonunvantip: '',
          kurucukod: ''
        });
        const controller = new AbortController();
        const timer = setTimeout(() => controller.abort(), timeoutMs);
        try {
          const response = await fetch('/api/DB/BindHistoryInfo', {
            method: 'POST',
            headers: {
              'Content-Type': 'application/x-www-form-urlencoded',
              'X-Requested-With': 'XMLHttpRequest'
            },
            body: params.toString(),
            signal: controller.signal
          });
          const text = await response.text();
          if (text.includes('Erişim Engellendi') || text.includes('Web Application Firewall')) {
            throw new Error('WAF_BLOCKED');
          }
          return text;
        } finally {
          clearTimeout(timer);
        }
      }
      """;

  private static final Duration SETTLE_TIME = Duration.ofSeconds(2);
  private static final Duration MAX_WAIT = Duration.ofSeconds(60);

  private final String baseUrl;
  private final boolean headless;
  private final ObjectMapper objectMapper;

  private Playwright playwright;
  private Browser browser;
  private BrowserContext context;
  private Page page;
  private volatile boolean started = false;

  public PlaywrightFundRowSource(String baseUrl, boolean headless, ObjectMapper objectMapper) {
    this.baseUrl = baseUrl;
    this.headless = headless;
    this.objectMapper = objectMapper;
  }

  @Override
  public synchronized List<FundRow> fetchRows(LocalDate date, Deadline deadline) throws ProviderException {
    deadline.check(FundPriceProvider.NAME);
    ensureStarted(deadline);
    deadline.check(FundPriceProvider.NAME);

    String body;
    try {
      page.setDefaultTimeout(timeoutMillis(deadline));
      Object result = page.evaluate(FETCH_SCRIPT, Map.of(
          "date", FundPriceProvider.DATE_FORMAT.format(date),
          "timeoutMs", timeoutMillis(deadline)));
      body = result != null ? result.toString() : "";
    } catch (PlaywrightException e) {
      if (e.getMessage() != null && e.getMessage().contains(WAF_MARKER)) {
        throw new ProviderException(FundPriceProvider.NAME, "request blocked by TEFAS web application firewall", e);
      }
      throw new ProviderException(FundPriceProvider.NAME, "browser fetch failed: " + e.getMessage(), e);
    }

    try {
      HistoryResponse response = objectMapper.readValue(body, HistoryResponse.class);
      List<FundRow> rows = response.getData() != null ? response.getData() : new ArrayList<>();
      log.debug("TEFAS returned {} of {} funds", rows.size(), response.getRecordsTotal());
      return rows;
    } catch (JsonProcessingException e) {
      throw new ProviderException(FundPriceProvider.NAME, "unparseable TEFAS response", e);
    }
  }

  @Override
  public boolean isReady() {
    return started;
  }

  @Override
  public synchronized void close() {
    if (playwright == null) {
      return;
    }
    log.info("Closing TEFAS browser session");
    started = false;
    try {
      if (context != null) {
        context.close();
      }
      if (browser != null) {
        browser.close();
      }
    } catch (PlaywrightException e) {
      log.warn("Error closing TEFAS browser: {}", e.getMessage());
    } finally {
      try {
        playwright.close();
      } catch (PlaywrightException e) {
        log.warn("Error stopping Playwright: {}", e.getMessage());
      }
      page = null;
      context = null;
      browser = null;
      playwright = null;
    }
  }

  private void ensureStarted(Deadline deadline) throws ProviderException {
    if (started) {
      return;
    }

    log.info("Starting TEFAS browser session (headless={})", headless);
    try {
      playwright = Playwright.create();
      browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
          .setHeadless(headless)
          .setArgs(LAUNCH_ARGS));

      context = browser.newContext(new Browser.NewContextOptions()
          .setUserAgent(USER_AGENT)
          .setLocale("tr-TR")
          .setViewportSize(1920, 1080)
          .setExtraHTTPHeaders(Map.of("Accept-Language", "tr-TR,tr;q=0.9,en;q=0.8")));
      context.addInitScript(HIDE_WEBDRIVER_SCRIPT);

      page = context.newPage();
      page.navigate(baseUrl + "/TarihselVeriler.aspx", new Page.NavigateOptions()
          .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
          .setTimeout(timeoutMillis(deadline)));

      // Let the WAF challenge scripts finish before the first request
      page.waitForTimeout(deadline.cap(SETTLE_TIME).toMillis());

      started = true;
      log.info("TEFAS browser session started");
    } catch (PlaywrightException e) {
      close();
      throw new ProviderException(FundPriceProvider.NAME, "could not start browser session: " + e.getMessage(), e);
    }
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  static class HistoryResponse {
    @JsonProperty("draw")
    private int draw;
    @JsonProperty("recordsTotal")
    private long recordsTotal;
    @JsonProperty("recordsFiltered")
    private long recordsFiltered;
    @JsonProperty("data")
    private List<FundRow> data;
  }

  /**
   * Playwright reads a timeout of 0 as "wait forever", so this never goes below 1 ms.
   */
  static long timeoutMillis(Deadline deadline) {
    return deadline.cap(MAX_WAIT).toMillis();
  }
}
