package com.ai.hostdesk.dto;

import com.ai.hostdesk.entity.DiningTable;
import com.ai.hostdesk.entity.WaitlistEntry;

import java.time.Instant;
import java.util.Comparator;

/**
 * The best free table for one waiting entry, considered on its own.
 */
public record SeatingCandidate(int wastedSeats, Instant enqueuedAt, WaitlistEntry entry, DiningTable table) {

    /** Least waste first, then earliest arrival; entry id keeps equal timestamps in a fixed order. */
    public static final Comparator<SeatingCandidate> PRIORITY = Comparator
            .comparingInt(SeatingCandidate::wastedSeats)
            .thenComparing(SeatingCandidate::enqueuedAt)
            .thenComparing(c -> c.entry().getId(), Comparator.nullsLast(Comparator.naturalOrder()));

    public static SeatingCandidate of(WaitlistEntry entry, DiningTable table) {
        return new SeatingCandidate(table.getCapacity() - entry.getPartySize(), entry.getEnqueuedAt(), entry, table);
    }
}
