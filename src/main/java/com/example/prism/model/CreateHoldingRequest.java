package com.example.prism.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateHoldingRequest {
    private String type;           // fund or crypto
    private String symbol;
    private BigDecimal quantity;
    private BigDecimal costBasis;
}
