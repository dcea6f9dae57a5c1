package com.example.prism.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One row of the TEFAS historical price table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FundRow {

    @JsonProperty("FONKODU")
    private String code;

    @JsonProperty("FONUNVAN")
    private String name;

    @JsonProperty("FIYAT")
    private BigDecimal price;

    @JsonProperty("TARIH")
    private String date;
}
