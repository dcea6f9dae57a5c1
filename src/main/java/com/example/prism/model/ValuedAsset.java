package com.example.prism.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * A price joined with the holding it values. Built per request, never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValuedAsset implements Serializable {

    private static final long serialVersionUID = 1L;

    private AssetType type;
    private String symbol;
    private String name;
    private BigDecimal price;
    private BigDecimal dailyChange;
    private BigDecimal dailyPct;
    private BigDecimal quantity;
    private BigDecimal costBasis;
    private BigDecimal value;        // price * quantity
    private BigDecimal pnl;          // value - costBasis
    private BigDecimal pnlPct;       // Zero when costBasis is zero
    private LocalDateTime lastUpdated;
    private boolean stale;

    /**
     * Value a price against a holding. A missing holding counts as zero quantity and cost.
     */
    public static ValuedAsset of(AssetType type, Price price, Holding holding) {
        BigDecimal quantity = holding != null ? nonNull(holding.getQuantity()) : BigDecimal.ZERO;
        BigDecimal costBasis = holding != null ? nonNull(holding.getCostBasis()) : BigDecimal.ZERO;
        BigDecimal unitPrice = nonNull(price.getPrice());

        BigDecimal value = unitPrice.multiply(quantity);
        BigDecimal pnl = value.subtract(costBasis);

        return ValuedAsset.builder()
            .type(type)
            .symbol(price.getSymbol())
            .name(price.getName())
            .price(unitPrice)
            .dailyChange(nonNull(price.getDailyChange()))
            .dailyPct(nonNull(price.getDailyPct()))
            .quantity(quantity)
            .costBasis(costBasis)
            .value(value)
            .pnl(pnl)
            .pnlPct(percentOf(pnl, costBasis))
            .lastUpdated(price.getLastUpdated())
            .stale(price.isStale())
            .build();
    }

    /**
     * Zero-valued stale entry for a holding that could not be priced.
     */
    public static ValuedAsset placeholder(AssetType type, Holding holding, String name, LocalDateTime now) {
        return ValuedAsset.builder()
            .type(type)
            .symbol(holding.getSymbol())
            .name(name)
            .price(BigDecimal.ZERO)
            .dailyChange(BigDecimal.ZERO)
            .dailyPct(BigDecimal.ZERO)
            .quantity(nonNull(holding.getQuantity()))
            .costBasis(nonNull(holding.getCostBasis()))
            .value(BigDecimal.ZERO)
            .pnl(BigDecimal.ZERO)
            .pnlPct(BigDecimal.ZERO)
            .lastUpdated(now)
            .stale(true)
            .build();
    }

    /**
     * part / whole * 100, or zero when whole is not positive.
     */
    public static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return part.divide(whole, 10, RoundingMode.HALF_UP)
            .multiply(BigDecimal.valueOf(100))
            .setScale(4, RoundingMode.HALF_UP);
    }

    private static BigDecimal nonNull(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
