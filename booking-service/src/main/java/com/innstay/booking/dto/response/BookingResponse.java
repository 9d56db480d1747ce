package com.innstay.booking.dto.response;

import com.innstay.booking.domain.Booking;
import com.innstay.booking.domain.BookingItem;
import com.innstay.booking.domain.BookingPaymentStatus;
import com.innstay.booking.domain.BookingStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public record BookingResponse(
        Long bookingId,
        String shortRef,
        String guestName,
        String guestEmail,
        BookingStatus status,
        BookingPaymentStatus paymentStatus,
        BigDecimal subtotalAmount,
        BigDecimal taxAmount,
        BigDecimal serviceCharge,
        BigDecimal totalAmount,
        BigDecimal amountPaid,
        BigDecimal amountDue,
        String currency,
        List<ItemInfo> items,
        LocalDateTime createdAt
) {
    public record ItemInfo(Long roomId, LocalDate checkIn, LocalDate checkOut, int nights,
                           BigDecimal nightlyRate, BigDecimal lineTotal) {

        static ItemInfo from(BookingItem item) {
            return new ItemInfo(item.getRoomId(), item.getCheckIn(), item.getCheckOut(),
                    item.getNights(), item.getNightlyRate(), item.getLineTotal());
        }
    }

    public static BookingResponse from(Booking booking) {
        List<ItemInfo> items = booking.getItems().stream()
                .map(ItemInfo::from)
                .toList();
        return new BookingResponse(
                booking.getId(),
                booking.getShortRef(),
                booking.getGuestName(),
                booking.getGuestEmail(),
                booking.getStatus(),
                booking.getPaymentStatus(),
                booking.getSubtotalAmount(),
                booking.getTaxAmount(),
                booking.getServiceCharge(),
                booking.getTotalAmount(),
                booking.getAmountPaid(),
                booking.getAmountDue(),
                booking.getCurrency(),
                items,
                booking.getCreatedAt()
        );
    }
}
