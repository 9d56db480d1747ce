package com.innstay.booking.jooq;

import com.innstay.booking.domain.BookingPaymentStatus;
import com.innstay.booking.domain.BookingStatus;
import lombok.RequiredArgsConstructor;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * jOOQ queries for the expiration sweep. Each candidate is re-checked under
 * its row lock before anything is changed.
 */
@Repository
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BookingJooqRepository {

    static final Table<Record> BOOKINGS = DSL.table(DSL.name("bookings"));
    static final Field<Long> ID = DSL.field(DSL.name("bookings", "id"), Long.class);
    static final Field<String> STATUS = DSL.field(DSL.name("bookings", "status"), String.class);
    static final Field<String> PAYMENT_STATUS = DSL.field(DSL.name("bookings", "payment_status"), String.class);
    static final Field<LocalDateTime> CREATED_AT = DSL.field(DSL.name("bookings", "created_at"), LocalDateTime.class);

    private final DSLContext dsl;

    /**
     * PENDING/UNPAID bookings created strictly before the cutoff, ordered by
     * {@code (created_at, id)} and starting after {@code after} when it is given.
     * Rows that stay PENDING because they failed are paged past, not re-read.
     */
    public List<ExpirationCandidate> findExpirationCandidates(LocalDateTime cutoff, ExpirationCandidate after,
                                                              int limit) {
        Condition page = after == null
                ? DSL.noCondition()
                : DSL.row(CREATED_AT, ID).gt(after.createdAt(), after.id());
        return dsl.select(ID, CREATED_AT)
                .from(BOOKINGS)
                .where(STATUS.eq(BookingStatus.PENDING.name()))
                .and(PAYMENT_STATUS.eq(BookingPaymentStatus.UNPAID.name()))
                .and(CREATED_AT.lt(cutoff))
                .and(page)
                .orderBy(CREATED_AT.asc(), ID.asc())
                .limit(limit)
                .fetch(r -> new ExpirationCandidate(r.value1(), r.value2()));
    }

    public long countExpirationCandidates(LocalDateTime cutoff) {
        return dsl.selectCount()
                .from(BOOKINGS)
                .where(STATUS.eq(BookingStatus.PENDING.name()))
                .and(PAYMENT_STATUS.eq(BookingPaymentStatus.UNPAID.name()))
                .and(CREATED_AT.lt(cutoff))
                .fetchOne(0, long.class);
    }
}
