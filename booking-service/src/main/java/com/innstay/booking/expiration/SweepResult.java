package com.innstay.booking.expiration;

import java.util.List;

public record SweepResult(List<Long> expiredIds, int failedCount) {

    public static SweepResult empty() {
        return new SweepResult(List.of(), 0);
    }

    public int expiredCount() {
        return expiredIds.size();
    }
}
