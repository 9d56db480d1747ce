package com.innstay.common.event;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Topics {

    // Booking
    public static final String BOOKING_CREATED = "innstay.booking.created";
    public static final String BOOKING_STATUS_CHANGED = "innstay.booking.status-changed";
    public static final String BOOKING_ACCESS_REQUESTED = "innstay.booking.access-requested";

    // Payment
    public static final String PAYMENT_SETTLED = "innstay.payment.settled";
    public static final String PAYMENT_FAILED = "innstay.payment.failed";
    public static final String PAYMENT_REFUND_REQUIRED = "innstay.payment.refund-required";

    // Room
    public static final String ROOM_RATE_UPDATED = "innstay.room.rate-updated";

    // Dead Letter Topics (DLT) - suffix: .DLT
    public static final String DLT_SUFFIX = ".DLT";

    // Partition counts per topic category
    public static final int PARTITIONS_BOOKING = 6;
    public static final int PARTITIONS_PAYMENT = 6;
    public static final int PARTITIONS_ROOM = 3;

    public static String dlt(String topic) {
        return topic + DLT_SUFFIX;
    }
}
