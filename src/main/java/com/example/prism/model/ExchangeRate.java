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
public class ExchangeRate implements Serializable {

    private static final long serialVersionUID = 1L;

    private String from;
    private String to;
    private BigDecimal rate;
    private LocalDateTime lastUpdated;
}
