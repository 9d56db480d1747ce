package com.innstay.booking.pricing;

import com.innstay.booking.domain.Booking;
import com.innstay.booking.domain.BookingItem;
import com.innstay.booking.domain.LocalRoomRate;
import com.innstay.booking.repository.BookingRepository;
import com.innstay.booking.repository.LocalRoomRateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recomputes a booking's total from current room rates and compares it with
 * the stored total. Read-only; never changes the booking.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceVerificationService {

    private final BookingRepository bookingRepository;
    private final LocalRoomRateRepository localRoomRateRepository;
    private final BookingPriceCalculator priceCalculator;

    @Transactional(readOnly = true)
    public PriceVerificationResult verify(Long bookingId) {
        return bookingRepository.findWithItemsById(bookingId)
                .map(this::verify)
                .orElseGet(PriceVerificationResult::notFound);
    }

    @Transactional(readOnly = true)
    public PriceVerificationResult verify(Booking booking) {
        BigDecimal storedTotal = booking.getTotalAmount();

        List<PriceLine> lines = new ArrayList<>();
        for (BookingItem item : booking.getItems()) {
            Optional<LocalRoomRate> rate = localRoomRateRepository.findById(item.getRoomId());
            if (rate.isEmpty() || !rate.get().isActive()) {
                log.warn("Price verification without current rate: bookingId={}, roomId={}",
                        booking.getId(), item.getRoomId());
                return PriceVerificationResult.rateUnavailable(storedTotal);
            }
            lines.add(new PriceLine(item.getRoomId(), rate.get().getNightlyRate(),
                    item.getCheckIn(), item.getCheckOut()));
        }

        BigDecimal calculatedTotal = priceCalculator.calculate(lines).total();
        BigDecimal difference = calculatedTotal.subtract(storedTotal);
        BigDecimal percentageDiff = priceCalculator.percentageDiff(storedTotal, calculatedTotal);
        boolean valid = priceCalculator.isWithinTolerance(percentageDiff);

        if (!valid) {
            log.warn("Price mismatch: bookingId={}, stored={}, calculated={}, diff={}%",
                    booking.getId(), storedTotal, calculatedTotal, percentageDiff);
        }
        return new PriceVerificationResult(valid, storedTotal, calculatedTotal, difference, percentageDiff,
                valid ? null : PriceVerificationResult.REASON_PRICE_CHANGED);
    }
}
