package com.stabilityengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigInteger;

/**
 * DTO for opening a native account.
 */
@Data
public class OpenAccountRequest {

    @NotBlank(message = "Address is required")
    private String address;

    @NotNull(message = "Initial balance is required")
    @PositiveOrZero(message = "Initial balance cannot be negative")
    private BigInteger initialBalance;

    private boolean acceptsTransfers = true;
}
