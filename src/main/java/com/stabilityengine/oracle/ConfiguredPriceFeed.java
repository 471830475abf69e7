package com.stabilityengine.oracle;

import com.stabilityengine.common.FixedPointMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Price feed holding a single administrator-set price.
 *
 * Starts from {@code stability-engine.price-feed.initial-price} and changes
 * only through {@link #updatePrice(BigDecimal)}.
 */
@Component
@Slf4j
public class ConfiguredPriceFeed implements PriceFeed {

    private final AtomicReference<BigInteger> price = new AtomicReference<>();

    public ConfiguredPriceFeed(@Value("${stability-engine.price-feed.initial-price:4000}") BigDecimal initialPrice) {
        updatePrice(initialPrice);
    }

    @Override
    public BigInteger currentPrice() {
        return price.get();
    }

    /**
     * Set the price of one native unit, in whole stable units.
     */
    public void updatePrice(BigDecimal wholeUnits) {
        BigInteger wad = FixedPointMath.toBaseUnits(wholeUnits);
        if (wad.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive: " + wholeUnits);
        }
        BigInteger previous = price.getAndSet(wad);
        log.info("Price updated from {} to {}",
            previous == null ? "-" : FixedPointMath.toWholeUnits(previous), wholeUnits);
    }
}
