package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class CreatePurchaseRequest {

    @NotNull(message = "Product ID is required")
    @JsonProperty("product_id")
    UUID productId;

    /** Phone number, meter number or game id, depending on the product. */
    @NotBlank(message = "Target number is required")
    @Size(max = 50, message = "Target number must be at most 50 characters")
    @JsonProperty("target_number")
    String targetNumber;
}
