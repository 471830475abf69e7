package com.stabilityengine.api.controller;

import com.stabilityengine.api.dto.PriceResponse;
import com.stabilityengine.api.dto.UpdatePriceRequest;
import com.stabilityengine.common.FixedPointMath;
import com.stabilityengine.oracle.ConfiguredPriceFeed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * REST API for the price feed.
 */
@RestController
@RequestMapping("/api/v1/price-feed")
@RequiredArgsConstructor
@Tag(name = "Price feed", description = "Native asset price API")
public class PriceFeedController {

    private final ConfiguredPriceFeed priceFeed;

    @GetMapping
    @Operation(summary = "Get the current price")
    public ResponseEntity<PriceResponse> getPrice() {
        return ResponseEntity.ok(toResponse(priceFeed.currentPrice()));
    }

    @PutMapping
    @Operation(summary = "Set the current price")
    public ResponseEntity<PriceResponse> updatePrice(@Valid @RequestBody UpdatePriceRequest request) {
        priceFeed.updatePrice(request.getPrice());
        return ResponseEntity.ok(toResponse(priceFeed.currentPrice()));
    }

    private PriceResponse toResponse(BigInteger wad) {
        return new PriceResponse(wad, FixedPointMath.toWholeUnits(wad));
    }
}
