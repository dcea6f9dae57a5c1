package com.example.prism.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private AssetClassSummary funds;
    private AssetClassSummary cryptos;
    private BigDecimal totalValue;
    private BigDecimal totalCostBasis;
    private BigDecimal totalPnl;
    private BigDecimal totalPnlPct;
    private LocalDateTime lastUpdated;

    public static PortfolioSummary of(AssetClassSummary funds, AssetClassSummary cryptos, LocalDateTime now) {
        BigDecimal totalValue = funds.getValue().add(cryptos.getValue());
        BigDecimal totalCost = funds.getCostBasis().add(cryptos.getCostBasis());
        BigDecimal totalPnl = totalValue.subtract(totalCost);

        return PortfolioSummary.builder()
            .funds(funds)
            .cryptos(cryptos)
            .totalValue(totalValue)
            .totalCostBasis(totalCost)
            .totalPnl(totalPnl)
            .totalPnlPct(ValuedAsset.percentOf(totalPnl, totalCost))
            .lastUpdated(now)
            .build();
    }
}
