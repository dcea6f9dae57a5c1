package com.example.prism.model;

import com.example.prism.entity.HoldingEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Holding {

    private Long id;
    private AssetType type;
    private String symbol;
    private BigDecimal quantity;
    private BigDecimal costBasis;     // Total amount paid, not per unit
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static Holding from(HoldingEntity entity) {
        return Holding.builder()
            .id(entity.getId())
            .type(entity.getType())
            .symbol(entity.getSymbol())
            .quantity(entity.getQuantity())
            .costBasis(entity.getCostBasis())
            .createdAt(entity.getCreatedAt())
            .updatedAt(entity.getUpdatedAt())
            .build();
    }
}
