package com.example.prism.controller;

import com.example.prism.model.ExchangeRate;
import com.example.prism.model.PortfolioSummary;
import com.example.prism.model.ValuedAsset;
import com.example.prism.provider.ProviderException;
import com.example.prism.service.PortfolioService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PortfolioController {

  private final PortfolioService portfolioService;

  // =========================================================================
  // Portfolio
  // =========================================================================

  @GetMapping("/portfolio/summary")
  public ResponseEntity<PortfolioSummary> getPortfolioSummary() {
    return ResponseEntity.ok(portfolioService.getPortfolioSummary());
  }

  // =========================================================================
  // Funds
  // =========================================================================

  @GetMapping("/funds")
  public ResponseEntity<?> getFunds() {
    return ResponseEntity.ok(Map.of("funds", portfolioService.getFunds()));
  }

  @GetMapping("/funds/{code}")
  public ResponseEntity<?> getFund(@PathVariable String code) {
    Optional<ValuedAsset> fund = portfolioService.getFund(code);
    if (fund.isEmpty()) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
          "error", "Fund not found",
          "code", code.toUpperCase()
      ));
    }
    return ResponseEntity.ok(fund.get());
  }

  // =========================================================================
  // Crypto
  // =========================================================================

  @GetMapping("/crypto")
  public ResponseEntity<?> getCryptos() {
    return ResponseEntity.ok(Map.of("cryptos", portfolioService.getCryptos()));
  }

  @GetMapping("/crypto/{symbol}")
  public ResponseEntity<?> getCrypto(@PathVariable String symbol) {
    Optional<ValuedAsset> crypto = portfolioService.getCrypto(symbol);
    if (crypto.isEmpty()) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
          "error", "Crypto not found",
          "symbol", symbol.toUpperCase()
      ));
    }
    return ResponseEntity.ok(crypto.get());
  }

  // =========================================================================
  // Exchange Rate
  // =========================================================================

  @GetMapping("/exchange-rate")
  public ResponseEntity<?> getExchangeRate() {
    try {
      ExchangeRate rate = portfolioService.getExchangeRate();
      return ResponseEntity.ok(rate);
    } catch (ProviderException e) {
      log.warn("Exchange rate unavailable: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
          "error", "Exchange rate unavailable",
          "message", e.getMessage()
      ));
    }
  }
}
