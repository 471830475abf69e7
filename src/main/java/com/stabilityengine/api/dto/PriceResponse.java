package com.stabilityengine.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Current price as a wad and in whole units.
 */
@Data
@AllArgsConstructor
public class PriceResponse {

    private BigInteger priceWad;
    private BigDecimal price;
}
