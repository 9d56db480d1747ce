package com.innstay.booking.controller;

import com.innstay.booking.dto.request.CreateBookingRequest;
import com.innstay.booking.dto.request.LookupRequest;
import com.innstay.booking.dto.response.AuditTrailResponse;
import com.innstay.booking.dto.response.BookingAccessResponse;
import com.innstay.booking.dto.response.BookingResponse;
import com.innstay.booking.dto.response.BookingStatusResponse;
import com.innstay.booking.security.ActorContext;
import com.innstay.booking.service.BookingCommandService;
import com.innstay.booking.service.BookingLookupService;
import com.innstay.booking.service.BookingQueryService;
import com.innstay.common.response.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Booking", description = "Booking lifecycle, guest lookup and audit trail")
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingCommandService bookingCommandService;
    private final BookingQueryService bookingQueryService;
    private final BookingLookupService bookingLookupService;

    @Operation(summary = "Create booking", description = "Price the stay from current room rates and issue a guest access token")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Booking created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Validation error or room unavailable")
    })
    @PostMapping
    public ResponseEntity<ApiResponse<BookingAccessResponse>> createBooking(
            @Parameter(hidden = true) ActorContext actor,
            @Valid @RequestBody CreateBookingRequest request) {
        BookingAccessResponse response = bookingCommandService.create(request, actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(response));
    }

    @Operation(summary = "Get booking", description = "Owner, staff or holder of a valid access token")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Access denied"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "410", description = "Access token expired")
    })
    @GetMapping("/{bookingId}")
    public ResponseEntity<ApiResponse<BookingResponse>> getBooking(
            @PathVariable Long bookingId,
            @RequestParam(required = false) String token,
            @Parameter(hidden = true) ActorContext actor) {
        return ResponseEntity.ok(ApiResponse.ok(bookingQueryService.getBooking(bookingId, actor, token)));
    }

    @Operation(summary = "Get booking status")
    @GetMapping("/{bookingId}/status")
    public ResponseEntity<ApiResponse<BookingStatusResponse>> getStatus(
            @PathVariable Long bookingId,
            @RequestParam(required = false) String token,
            @Parameter(hidden = true) ActorContext actor) {
        return ResponseEntity.ok(ApiResponse.ok(bookingQueryService.getStatus(bookingId, actor, token)));
    }

    @Operation(summary = "Cancel booking", description = "Cancel an unpaid booking")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking cancelled"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Access denied"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Booking cannot be cancelled in its current state")
    })
    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<ApiResponse<BookingResponse>> cancelBooking(
            @PathVariable Long bookingId,
            @RequestParam(required = false) String token,
            @Parameter(hidden = true) ActorContext actor) {
        return ResponseEntity.ok(ApiResponse.ok(bookingCommandService.cancel(bookingId, actor, token)));
    }

    @Operation(summary = "Confirm booking", description = "Staff confirmation of an unpaid or partially paid booking")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking confirmed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Staff only"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Invalid transition")
    })
    @PostMapping("/{bookingId}/confirm")
    public ResponseEntity<ApiResponse<BookingResponse>> confirmBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) ActorContext actor) {
        return ResponseEntity.ok(ApiResponse.ok(bookingCommandService.confirm(bookingId, actor)));
    }

    @Operation(summary = "Complete booking", description = "Mark a confirmed stay as completed")
    @PostMapping("/{bookingId}/complete")
    public ResponseEntity<ApiResponse<BookingResponse>> completeBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) ActorContext actor) {
        return ResponseEntity.ok(ApiResponse.ok(bookingCommandService.complete(bookingId, actor)));
    }

    @Operation(summary = "Refund booking", description = "Cancel a paid booking and refund settled payments")
    @PostMapping("/{bookingId}/refund")
    public ResponseEntity<ApiResponse<BookingResponse>> refundBooking(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) ActorContext actor) {
        return ResponseEntity.ok(ApiResponse.ok(bookingCommandService.refund(bookingId, actor)));
    }

    @Operation(summary = "Booking audit trail", description = "Staff only. Includes hash chain verification")
    @GetMapping("/{bookingId}/audit")
    public ResponseEntity<ApiResponse<AuditTrailResponse>> getAuditTrail(
            @PathVariable Long bookingId,
            @Parameter(hidden = true) ActorContext actor) {
        return ResponseEntity.ok(ApiResponse.ok(bookingQueryService.getAuditTrail(bookingId, actor)));
    }

    @Operation(summary = "Manual lookup", description = "Find a booking by reference and guest email")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "No match"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Too many attempts")
    })
    @PostMapping("/lookup")
    public ResponseEntity<ApiResponse<BookingAccessResponse>> lookup(
            @Valid @RequestBody LookupRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        return ResponseEntity.ok(ApiResponse.ok(bookingLookupService.lookup(request, actor)));
    }

    @Operation(summary = "Open verification link")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Booking found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "401", description = "Invalid link"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "410", description = "Link expired")
    })
    @GetMapping("/access/{token}")
    public ResponseEntity<ApiResponse<BookingResponse>> accessByToken(@PathVariable String token) {
        return ResponseEntity.ok(ApiResponse.ok(bookingLookupService.accessByToken(token)));
    }

    @Operation(summary = "Request verification link",
            description = "Always accepted; a link is sent only when reference and email match")
    @PostMapping("/access-link")
    public ResponseEntity<ApiResponse<Void>> requestAccessLink(
            @Valid @RequestBody LookupRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        bookingLookupService.requestAccessLink(request, actor);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.ok());
    }
}
