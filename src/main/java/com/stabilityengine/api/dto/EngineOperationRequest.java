package com.stabilityengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * DTO for a mint, burn, deposit or withdraw request.
 *
 * {@code amount} is in base units: attached native value for mint and deposit,
 * units to burn for burn and withdraw.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EngineOperationRequest {

    @NotBlank(message = "Caller is required")
    private String caller;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private BigInteger amount;
}
