package com.example.prism.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetClassSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private BigDecimal value;
    private BigDecimal costBasis;
    private BigDecimal pnl;
    private BigDecimal pnlPct;
    private List<ValuedAsset> assets;

    public static AssetClassSummary of(List<ValuedAsset> assets) {
        BigDecimal value = BigDecimal.ZERO;
        BigDecimal costBasis = BigDecimal.ZERO;
        for (ValuedAsset asset : assets) {
            value = value.add(asset.getValue());
            costBasis = costBasis.add(asset.getCostBasis());
        }
        BigDecimal pnl = value.subtract(costBasis);

        return AssetClassSummary.builder()
            .value(value)
            .costBasis(costBasis)
            .pnl(pnl)
            .pnlPct(ValuedAsset.percentOf(pnl, costBasis))
            .assets(assets)
            .build();
    }
}
