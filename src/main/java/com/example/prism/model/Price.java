package com.example.prism.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Point-in-time quote for one symbol, as returned by any price provider.
 * Prices are in the source's native currency and never negative.
 *
 * <p>Immutable. Use {@link #toBuilder()} for a modified copy.
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Price implements Serializable {

    private static final long serialVersionUID = 1L;

    private String symbol;
    private String name;
    private BigDecimal price;
    private BigDecimal dailyChange;   // Absolute, zero when the source has none
    private BigDecimal dailyPct;
    private LocalDateTime lastUpdated;
    private boolean stale;            // Known or suspected outdated

    /**
     * Zero-priced stale entry for a symbol the source could not price.
     */
    public static Price placeholder(String symbol, String name, LocalDateTime now) {
        return Price.builder()
            .symbol(symbol)
            .name(name)
            .price(BigDecimal.ZERO)
            .dailyChange(BigDecimal.ZERO)
            .dailyPct(BigDecimal.ZERO)
            .lastUpdated(now)
            .stale(true)
            .build();
    }

    public Price asStale() {
        return stale ? this : toBuilder().stale(true).build();
    }
}
