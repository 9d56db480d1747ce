package com.innstay.booking.dto.response;

import java.util.List;

public record SweepResponse(int expiredCount, List<Long> bookingIds) {
}
