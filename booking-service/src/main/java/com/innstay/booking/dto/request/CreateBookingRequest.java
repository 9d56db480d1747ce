package com.innstay.booking.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.List;

public record CreateBookingRequest(
        @NotBlank @Size(max = 100) String guestName,
        @NotBlank @Email @Size(max = 255) String guestEmail,
        @Size(max = 30) String guestPhone,
        @NotEmpty @Size(max = 10) List<@Valid StayRequest> items
) {
    public record StayRequest(
            @NotNull Long roomId,
            @NotNull LocalDate checkIn,
            @NotNull LocalDate checkOut
    ) {
    }
}
