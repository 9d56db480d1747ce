package com.innstay.booking.lifecycle;

import com.innstay.booking.audit.AuditSnapshot;
import com.innstay.booking.domain.Booking;
import com.innstay.booking.domain.BookingItem;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit views of a booking.
 */
public final class BookingSnapshots {

    private BookingSnapshots() {
    }

    public static AuditSnapshot stateOf(Booking booking) {
        return AuditSnapshot.builder()
                .put("status", booking.getStatus())
                .put("paymentStatus", booking.getPaymentStatus())
                .put("amountPaid", booking.getAmountPaid())
                .put("amountDue", booking.getAmountDue())
                .build();
    }

    public static AuditSnapshot creationOf(Booking booking) {
        List<Map<String, Object>> items = booking.getItems().stream()
                .map(BookingSnapshots::itemOf)
                .toList();
        return AuditSnapshot.builder()
                .put("shortRef", booking.getShortRef())
                .put("userId", booking.getUserId())
                .put("guestName", booking.getGuestName())
                .put("guestEmail", booking.getGuestEmail())
                .put("status", booking.getStatus())
                .put("paymentStatus", booking.getPaymentStatus())
                .put("subtotalAmount", booking.getSubtotalAmount())
                .put("taxAmount", booking.getTaxAmount())
                .put("serviceCharge", booking.getServiceCharge())
                .put("totalAmount", booking.getTotalAmount())
                .put("amountDue", booking.getAmountDue())
                .put("currency", booking.getCurrency())
                .put("items", items)
                .build();
    }

    private static Map<String, Object> itemOf(BookingItem item) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("roomId", item.getRoomId());
        values.put("checkIn", item.getCheckIn());
        values.put("checkOut", item.getCheckOut());
        values.put("nights", item.getNights());
        values.put("nightlyRate", item.getNightlyRate());
        return values;
    }
}
