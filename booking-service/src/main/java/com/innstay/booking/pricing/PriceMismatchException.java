package com.innstay.booking.pricing;

import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ErrorCode;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checkout refused because stored and recomputed totals drifted apart. The
 * client gets both totals so it can show the new price before retrying.
 */
@Getter
public class PriceMismatchException extends BusinessException {

    private final PriceVerificationResult result;

    public PriceMismatchException(PriceVerificationResult result) {
        super(ErrorCode.PRICE_MISMATCH, "Room prices have changed. Please refresh and review your booking.");
        this.result = result;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("storedTotal", result.storedTotal());
        details.put("calculatedTotal", result.calculatedTotal());
        details.put("percentageDiff", result.percentageDiff());
        if (result.reason() != null) {
            details.put("reason", result.reason());
        }
        return details;
    }
}
