package com.innstay.booking.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record LookupRequest(
        @NotBlank(message = "Reference number is required") String shortRef,
        @NotBlank(message = "Email address is required") @Email String email
) {
}
