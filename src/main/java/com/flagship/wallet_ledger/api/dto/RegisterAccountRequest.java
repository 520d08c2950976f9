package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class RegisterAccountRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must be at most 100 characters")
    @JsonProperty("name")
    String name;

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be a valid address")
    @JsonProperty("email")
    String email;

    @Size(max = 20, message = "Phone must be at most 20 characters")
    @JsonProperty("phone")
    String phone;

    @JsonProperty("referral_code")
    String referralCode;
}
