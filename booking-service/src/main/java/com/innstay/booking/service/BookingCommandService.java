package com.innstay.booking.service;

import com.innstay.booking.dto.request.CreateBookingRequest;
import com.innstay.booking.dto.response.BookingAccessResponse;
import com.innstay.booking.dto.response.BookingResponse;
import com.innstay.booking.lifecycle.LifecycleAction;
import com.innstay.booking.lifecycle.LifecycleEvent;
import com.innstay.booking.security.ActorContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Caller-facing booking commands. Each lifecycle command runs under the
 * booking lock with optimistic retry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingCommandService {

    private final BookingTransactionService transactionService;
    private final BookingMutationExecutor mutationExecutor;
    private final Clock clock;

    public BookingAccessResponse create(CreateBookingRequest request, ActorContext actor) {
        log.info("Create booking: userId={}, rooms={}", actor.userId(), request.items().size());
        return transactionService.create(request, actor);
    }

    public BookingResponse cancel(Long bookingId, ActorContext actor, String token) {
        return apply(bookingId, LifecycleAction.CANCEL, actor, token);
    }

    public BookingResponse confirm(Long bookingId, ActorContext actor) {
        return apply(bookingId, LifecycleAction.CONFIRM, actor, null);
    }

    public BookingResponse complete(Long bookingId, ActorContext actor) {
        return apply(bookingId, LifecycleAction.COMPLETE, actor, null);
    }

    public BookingResponse refund(Long bookingId, ActorContext actor) {
        return apply(bookingId, LifecycleAction.REFUND, actor, null);
    }

    private BookingResponse apply(Long bookingId, LifecycleAction action, ActorContext actor, String token) {
        log.info("{} booking: bookingId={}, userId={}, role={}", action, bookingId, actor.userId(), actor.role());
        LifecycleEvent event = LifecycleEvent.of(action, actor, LocalDateTime.now(clock));
        return mutationExecutor.execute(bookingId,
                () -> transactionService.transition(bookingId, event, token));
    }
}
