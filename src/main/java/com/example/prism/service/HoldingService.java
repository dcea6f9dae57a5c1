package com.example.prism.service;

import com.example.prism.entity.HoldingEntity;
import com.example.prism.model.AssetType;
import com.example.prism.model.CreateHoldingRequest;
import com.example.prism.model.Holding;
import com.example.prism.model.UpdateHoldingRequest;
import com.example.prism.repository.HoldingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Holdings CRUD. Symbols are stored upper case; there is at most one
 * holding per (type, symbol).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HoldingService {

  private final HoldingRepository holdingRepository;

  @Transactional(readOnly = true)
  public List<Holding> getAllHoldings() {
    return holdingRepository.findAllByOrderByTypeAscSymbolAsc().stream()
        .map(Holding::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public List<Holding> getHoldingsByType(AssetType type) {
    return holdingRepository.findByTypeOrderBySymbolAsc(type).stream()
        .map(Holding::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public Holding getHolding(long id) {
    return holdingRepository.findById(id)
        .map(Holding::from)
        .orElseThrow(() -> new HoldingNotFoundException(id));
  }

  @Transactional(readOnly = true)
  public Optional<Holding> findHolding(AssetType type, String symbol) {
    return holdingRepository.findByTypeAndSymbol(type, normalizeSymbol(symbol))
        .map(Holding::from);
  }

  @Transactional
  public Holding createHolding(CreateHoldingRequest request) {
    HoldingEntity entity = toEntity(request);

    if (holdingRepository.existsByTypeAndSymbol(entity.getType(), entity.getSymbol())) {
      throw new HoldingAlreadyExistsException(entity.getType(), entity.getSymbol());
    }

    try {
      HoldingEntity saved = holdingRepository.saveAndFlush(entity);
      log.info("Created {} holding {}: quantity={}, cost_basis={}",
          saved.getType().getValue(), saved.getSymbol(), saved.getQuantity(), saved.getCostBasis());
      return Holding.from(saved);
    } catch (DataIntegrityViolationException e) {
      // Concurrent insert of the same (type, symbol)
      throw new HoldingAlreadyExistsException(entity.getType(), entity.getSymbol());
    }
  }

  @Transactional
  public Holding updateHolding(long id, UpdateHoldingRequest request) {
    if (request == null || (request.getQuantity() == null && request.getCostBasis() == null)) {
      throw new IllegalArgumentException("At least one field (quantity or cost_basis) must be provided");
    }
    if (request.getQuantity() != null) {
      requireNonNegative(request.getQuantity(), "quantity");
    }
    if (request.getCostBasis() != null) {
      requireNonNegative(request.getCostBasis(), "cost_basis");
    }

    HoldingEntity entity = holdingRepository.findById(id)
        .orElseThrow(() -> new HoldingNotFoundException(id));

    if (request.getQuantity() != null) {
      entity.setQuantity(request.getQuantity());
    }
    if (request.getCostBasis() != null) {
      entity.setCostBasis(request.getCostBasis());
    }

    HoldingEntity saved = holdingRepository.saveAndFlush(entity);
    log.info("Updated holding {} ({} {})", id, saved.getType().getValue(), saved.getSymbol());
    return Holding.from(saved);
  }

  @Transactional
  public void deleteHolding(long id) {
    HoldingEntity entity = holdingRepository.findById(id)
        .orElseThrow(() -> new HoldingNotFoundException(id));
    holdingRepository.delete(entity);
    log.info("Deleted holding {} ({} {})", id, entity.getType().getValue(), entity.getSymbol());
  }

  /**
   * Insert the given holdings if the table is empty. Invalid and duplicate
   * entries are skipped. Returns the number of holdings inserted.
   */
  @Transactional
  public int seedIfEmpty(List<CreateHoldingRequest> requests) {
    if (holdingRepository.count() > 0) {
      log.debug("Holdings table not empty, skipping seed");
      return 0;
    }

    int inserted = 0;
    for (CreateHoldingRequest request : requests) {
      HoldingEntity entity;
      try {
        entity = toEntity(request);
      } catch (IllegalArgumentException e) {
        log.warn("Skipping invalid seed holding {}: {}", request, e.getMessage());
        continue;
      }
      if (holdingRepository.existsByTypeAndSymbol(entity.getType(), entity.getSymbol())) {
        log.warn("Skipping duplicate seed holding {} {}", entity.getType().getValue(), entity.getSymbol());
        continue;
      }
      holdingRepository.save(entity);
      inserted++;
    }
    return inserted;
  }

  private HoldingEntity toEntity(CreateHoldingRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Request body is required");
    }
    AssetType type = AssetType.fromValue(request.getType());

    String symbol = normalizeSymbol(request.getSymbol());
    if (symbol.isEmpty()) {
      throw new IllegalArgumentException("Symbol is required");
    }
    if (request.getQuantity() == null) {
      throw new IllegalArgumentException("Quantity is required");
    }
    requireNonNegative(request.getQuantity(), "quantity");

    BigDecimal costBasis = request.getCostBasis() != null ? request.getCostBasis() : BigDecimal.ZERO;
    requireNonNegative(costBasis, "cost_basis");

    return HoldingEntity.builder()
        .type(type)
        .symbol(symbol)
        .quantity(request.getQuantity())
        .costBasis(costBasis)
        .build();
  }

  private static String normalizeSymbol(String symbol) {
    return symbol == null ? "" : symbol.trim().toUpperCase();
  }

  private static void requireNonNegative(BigDecimal value, String field) {
    if (value.signum() < 0) {
      throw new IllegalArgumentException(field + " must be >= 0");
    }
  }
}
