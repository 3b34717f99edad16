package com.ai.hostdesk.service;

import com.ai.hostdesk.component.ResponsePhrases;
import com.ai.hostdesk.dto.SeatingCandidate;
import com.ai.hostdesk.dto.SeatingNotice;
import com.ai.hostdesk.entity.DiningTable;
import com.ai.hostdesk.entity.WaitlistEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Best-fit seating. Each pass ranks one candidate table per waiting party by
 * (wasted seats, arrival time), commits only the top one, and the run repeats
 * passes until one commits nothing. Committing a single seat per pass keeps every
 * decision based on the current waitlist and free tables.
 */
@Service
public class AllocationEngine {

    private static final Logger log = LoggerFactory.getLogger(AllocationEngine.class);

    private final WaitlistTableStore store;
    private final MessageSender messageSender;
    private final ResponsePhrases phrases;

    public AllocationEngine(WaitlistTableStore store, MessageSender messageSender, ResponsePhrases phrases) {
        this.store = store;
        this.messageSender = messageSender;
        this.phrases = phrases;
    }

    /**
     * Seats as many parties as currently possible and notifies each one.
     * Notifications go out between passes, never while the store lock is held.
     */
    public List<SeatingNotice> allocate() {
        List<SeatingNotice> seated = new ArrayList<>();
        Optional<SeatingNotice> notice;
        while ((notice = runPass()).isPresent()) {
            SeatingNotice n = notice.get();
            seated.add(n);
            if (!messageSender.send(n.partyId(), phrases.tableReady(n.name(), n.tableNumber()))) {
                log.error("Seated {} at table {} but the notification to {} was not delivered",
                        n.name(), n.tableNumber(), n.partyId());
            }
        }
        log.info("Allocation finished: {} seated", seated.size());
        return seated;
    }

    /**
     * One pass over a consistent snapshot of the store.
     *
     * @return the seat committed in this pass, or empty when nothing can be seated
     */
    public Optional<SeatingNotice> runPass() {
        return store.locked(() -> {
            List<SeatingCandidate> ranked = rankCandidates(store.listWaiting(), store.listFree());
            Set<Long> claimedEntries = new HashSet<>();
            Set<Long> claimedTables = new HashSet<>();
            for (SeatingCandidate c : ranked) {
                Long entryId = c.entry().getId();
                Long tableId = c.table().getId();
                if (claimedEntries.contains(entryId) || claimedTables.contains(tableId)) continue;
                claimedEntries.add(entryId);
                claimedTables.add(tableId);
                Optional<SeatingNotice> seated = store.seat(entryId, tableId);
                if (seated.isPresent()) {
                    return seated;
                }
            }
            return Optional.empty();
        });
    }

    /**
     * Picks the least wasteful free table for each waiting entry on its own, then
     * orders all picks by (wasted seats, enqueuedAt). Entries that fit no free table
     * are left out.
     *
     * @param waiting entries in arrival order
     * @param free    free tables in ascending capacity order, so the first of equally
     *                wasteful tables is the one picked
     */
    public List<SeatingCandidate> rankCandidates(List<WaitlistEntry> waiting, List<DiningTable> free) {
        List<SeatingCandidate> pool = new ArrayList<>();
        if (waiting.isEmpty() || free.isEmpty()) {
            return pool;
        }
        for (WaitlistEntry entry : waiting) {
            SeatingCandidate best = null;
            for (DiningTable table : free) {
                if (table.getCapacity() < entry.getPartySize()) continue;
                int wasted = table.getCapacity() - entry.getPartySize();
                if (best == null || wasted < best.wastedSeats()) {
                    best = SeatingCandidate.of(entry, table);
                }
            }
            if (best != null) {
                pool.add(best);
            }
        }
        pool.sort(SeatingCandidate.PRIORITY);
        return pool;
    }
}
