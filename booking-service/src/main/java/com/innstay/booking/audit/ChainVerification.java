package com.innstay.booking.audit;

public record ChainVerification(boolean intact, int entryCount, Long firstBrokenEntryId) {

    static ChainVerification intact(int entryCount) {
        return new ChainVerification(true, entryCount, null);
    }

    static ChainVerification brokenAt(int entryCount, Long entryId) {
        return new ChainVerification(false, entryCount, entryId);
    }
}
