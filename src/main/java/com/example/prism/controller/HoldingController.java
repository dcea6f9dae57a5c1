package com.example.prism.controller;

import com.example.prism.model.AssetType;
import com.example.prism.model.CreateHoldingRequest;
import com.example.prism.model.Holding;
import com.example.prism.model.UpdateHoldingRequest;
import com.example.prism.service.HoldingAlreadyExistsException;
import com.example.prism.service.HoldingNotFoundException;
import com.example.prism.service.HoldingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/holdings")
@RequiredArgsConstructor
public class HoldingController {

  private final HoldingService holdingService;

  @GetMapping
  public ResponseEntity<?> getHoldings(@RequestParam(required = false) String type) {
    try {
      List<Holding> holdings = (type == null || type.isBlank())
          ? holdingService.getAllHoldings()
          : holdingService.getHoldingsByType(AssetType.fromValue(type));
      return ResponseEntity.ok(Map.of("holdings", holdings));
    } catch (IllegalArgumentException e) {
      return badRequest(e);
    } catch (Exception e) {
      log.error("Error fetching holdings", e);
      return serverError("Failed to fetch holdings", e);
    }
  }

  @GetMapping("/{id}")
  public ResponseEntity<?> getHolding(@PathVariable long id) {
    try {
      return ResponseEntity.ok(holdingService.getHolding(id));
    } catch (HoldingNotFoundException e) {
      return notFound(e);
    } catch (Exception e) {
      log.error("Error fetching holding {}", id, e);
      return serverError("Failed to fetch holding", e);
    }
  }

  @PostMapping
  public ResponseEntity<?> createHolding(@RequestBody CreateHoldingRequest request) {
    try {
      log.info("Received holding request: {}", request);
      Holding holding = holdingService.createHolding(request);
      return ResponseEntity.status(HttpStatus.CREATED).body(holding);
    } catch (HoldingAlreadyExistsException e) {
      log.warn("Duplicate holding: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
          "error", "Holding already exists for this symbol",
          "message", e.getMessage()
      ));
    } catch (IllegalArgumentException e) {
      return badRequest(e);
    } catch (Exception e) {
      log.error("Error creating holding", e);
      return serverError("Failed to create holding", e);
    }
  }

  @PutMapping("/{id}")
  public ResponseEntity<?> updateHolding(@PathVariable long id, @RequestBody UpdateHoldingRequest request) {
    try {
      return ResponseEntity.ok(holdingService.updateHolding(id, request));
    } catch (HoldingNotFoundException e) {
      return notFound(e);
    } catch (IllegalArgumentException e) {
      return badRequest(e);
    } catch (Exception e) {
      log.error("Error updating holding {}", id, e);
      return serverError("Failed to update holding", e);
    }
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<?> deleteHolding(@PathVariable long id) {
    try {
      holdingService.deleteHolding(id);
      return ResponseEntity.ok(Map.of("message", "Holding deleted successfully"));
    } catch (HoldingNotFoundException e) {
      return notFound(e);
    } catch (Exception e) {
      log.error("Error deleting holding {}", id, e);
      return serverError("Failed to delete holding", e);
    }
  }

  private static ResponseEntity<?> badRequest(IllegalArgumentException e) {
    log.warn("Invalid holding request: {}", e.getMessage());
    return ResponseEntity.badRequest().body(Map.of(
        "error", e.getMessage()
    ));
  }

  private static ResponseEntity<?> notFound(HoldingNotFoundException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
        "error", "Holding not found",
        "message", e.getMessage()
    ));
  }

  private static ResponseEntity<?> serverError(String error, Exception e) {
    return ResponseEntity.internalServerError().body(Map.of(
        "error", error,
        "message", String.valueOf(e.getMessage())
    ));
  }
}
