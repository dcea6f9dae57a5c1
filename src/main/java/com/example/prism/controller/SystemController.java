package com.example.prism.controller;

import com.example.prism.config.PrismProperties;
import com.example.prism.model.AssetType;
import com.example.prism.service.PortfolioService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SystemController {

  private final PortfolioService portfolioService;
  private final PrismProperties properties;
  private final Clock clock;

  /**
   * 200 "ok" when every asset class has a healthy provider, otherwise 206 "degraded".
   */
  @GetMapping("/health")
  public ResponseEntity<Map<String, Object>> health() {
    Map<AssetType, Boolean> health = portfolioService.getProviderHealth();

    Map<String, String> providers = new LinkedHashMap<>();
    health.forEach((type, healthy) -> providers.put(type.getValue(), healthy ? "healthy" : "unhealthy"));
    boolean allHealthy = !health.containsValue(false);

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", allHealthy ? "ok" : "degraded");
    body.put("timestamp", LocalDateTime.now(clock));
    body.put("providers", providers);

    return ResponseEntity.status(allHealthy ? HttpStatus.OK : HttpStatus.PARTIAL_CONTENT).body(body);
  }

  @GetMapping("/version")
  public ResponseEntity<Map<String, String>> version() {
    return ResponseEntity.ok(Map.of(
        "version", properties.getVersion(),
        "build_time", properties.getBuildTime()
    ));
  }
}
