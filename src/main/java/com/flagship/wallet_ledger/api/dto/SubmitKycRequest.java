package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class SubmitKycRequest {

    @NotBlank(message = "ID card URL is required")
    @JsonProperty("id_card_url")
    String idCardUrl;

    @NotBlank(message = "Selfie URL is required")
    @JsonProperty("selfie_url")
    String selfieUrl;
}
