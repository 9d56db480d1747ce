package com.innstay.booking.controller;

import com.innstay.booking.config.BookingProperties;
import com.innstay.booking.dto.response.SweepResponse;
import com.innstay.booking.expiration.BookingExpirationSweeper;
import com.innstay.booking.expiration.SweepResult;
import com.innstay.booking.token.TokenHasher;
import com.innstay.common.exception.BusinessException;
import com.innstay.common.response.ApiResponse;
import com.innstay.common.response.ErrorCode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Lets an external scheduler trigger the expiration sweep. Requires the
 * shared cron secret as {@code X-Cron-Secret} or a bearer token.
 */
@Slf4j
@Tag(name = "Internal", description = "Scheduled job triggers")
@RestController
@RequestMapping("/api/internal/cron")
@RequiredArgsConstructor
public class CronController {

    static final String SECRET_HEADER = "X-Cron-Secret";
    private static final String BEARER_PREFIX = "Bearer ";

    private final BookingExpirationSweeper expirationSweeper;
    private final BookingProperties properties;

    @Operation(summary = "Expire stale bookings")
    @RequestMapping(value = "/expire-bookings", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<ApiResponse<SweepResponse>> expireBookings(
            @Parameter(hidden = true) @RequestHeader(value = SECRET_HEADER, required = false) String secretHeader,
            @Parameter(hidden = true) @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        if (!TokenHasher.secretsMatch(resolveSecret(secretHeader, authorization), properties.getCron().getSecret())) {
            log.warn("Rejected cron trigger with missing or invalid secret");
            throw new BusinessException(ErrorCode.UNAUTHORIZED);
        }

        SweepResult result;
        try {
            result = expirationSweeper.sweep();
        } catch (Exception e) {
            log.error("Cron expiration sweep failed", e);
            throw new BusinessException(ErrorCode.INTERNAL_ERROR, "Failed to expire bookings", e);
        }
        return ResponseEntity.ok(ApiResponse.ok(new SweepResponse(result.expiredCount(), result.expiredIds())));
    }

    private static String resolveSecret(String secretHeader, String authorization) {
        if (secretHeader != null && !secretHeader.isBlank()) {
            return secretHeader;
        }
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }
}
