package com.ai.hostdesk.service;

import com.ai.hostdesk.config.HostDeskProperties;
import com.ai.hostdesk.conversation.FloorPlan;
import com.ai.hostdesk.dto.SeatingNotice;
import com.ai.hostdesk.entity.DiningTable;
import com.ai.hostdesk.entity.WaitlistEntry;
import com.ai.hostdesk.repository.DiningTableRepository;
import com.ai.hostdesk.repository.WaitlistEntryRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owner of the waitlist and the table set. Every mutation, and every allocation pass,
 * runs under one lock and inside its own transaction, which commits before the lock
 * is released. The database is the source of truth; nothing is cached here.
 */
@Service
public class WaitlistTableStore implements FloorPlan {

    private static final Logger log = LoggerFactory.getLogger(WaitlistTableStore.class);

    private final WaitlistEntryRepository entryRepository;
    private final DiningTableRepository tableRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    /** Last issued enqueue timestamp; guarded by {@link #lock}. */
    private Instant lastEnqueuedAt = Instant.EPOCH;

    public WaitlistTableStore(WaitlistEntryRepository entryRepository,
                              DiningTableRepository tableRepository,
                              PlatformTransactionManager transactionManager,
                              Clock clock) {
        this.entryRepository = entryRepository;
        this.tableRepository = tableRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Runs {@code work} under the store lock in a single transaction. Calls made from
     * inside {@code work} join the same lock and transaction.
     */
    public <T> T locked(Supplier<T> work) {
        lock.lock();
        try {
            return transactionTemplate.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds the party to the waitlist, or refreshes name, size and timestamp when it is
     * already waiting (which also moves it to the back of the queue).
     *
     * @return id of the waitlist entry
     */
    public Long enqueue(String partyId, String displayName, int partySize) {
        if (StringUtils.isBlank(partyId)) {
            throw new IllegalArgumentException("partyId must not be blank");
        }
        if (partySize <= 0) {
            throw new IllegalArgumentException("partySize must be positive: " + partySize);
        }
        return locked(() -> {
            Instant at = nextEnqueueTimestamp();
            Optional<WaitlistEntry> existing = entryRepository.findByPartyId(partyId);
            WaitlistEntry entry = existing.orElseGet(() -> WaitlistEntry.builder().partyId(partyId).build());
            entry.setDisplayName(displayName);
            entry.setPartySize(partySize);
            entry.setEnqueuedAt(at);
            WaitlistEntry saved = entryRepository.save(entry);
            if (existing.isPresent()) {
                log.info("Updated waitlist entry {} for party {}: {} x{}", saved.getId(), partyId, displayName, partySize);
            } else {
                log.info("Queued party {} as entry {}: {} x{}", partyId, saved.getId(), displayName, partySize);
            }
            return saved.getId();
        });
    }

    /**
     * Marks the table free and clears its occupant. Freeing a table that is already
     * free succeeds without changing it.
     *
     * @return false when no table has that number
     */
    public boolean releaseTable(String tableNumber) {
        return locked(() -> {
            Optional<DiningTable> found = tableRepository.findByNumberForUpdate(tableNumber);
            if (found.isEmpty()) {
                log.warn("Table {} not found", tableNumber);
                return false;
            }
            DiningTable table = found.get();
            if (table.isFree()) {
                log.info("Table {} already free", tableNumber);
                return true;
            }
            Long previousOccupant = table.getOccupantEntryId();
            table.release(clock.instant());
            tableRepository.save(table);
            log.info("Table {} released (was entry {})", tableNumber, previousOccupant);
            return true;
        });
    }

    /** Waiting entries, oldest first. */
    public List<WaitlistEntry> listWaiting() {
        return locked(() -> entryRepository.findAllByOrderByEnqueuedAtAscIdAsc());
    }

    /** Free tables, smallest capacity first. */
    public List<DiningTable> listFree() {
        return locked(() -> tableRepository.findByStatusOrderByCapacityAscIdAsc(DiningTable.Status.FREE));
    }

    public List<DiningTable> listTables() {
        return locked(() -> tableRepository.findAll());
    }

    public Optional<WaitlistEntry> findWaiting(String partyId) {
        return locked(() -> entryRepository.findByPartyId(partyId));
    }

    /**
     * Occupies the table with the entry and removes the entry from the waitlist, atomically.
     *
     * @return empty when the entry is no longer waiting or the table is not free
     */
    public Optional<SeatingNotice> seat(Long entryId, Long tableId) {
        return locked(() -> {
            Optional<WaitlistEntry> entry = entryRepository.findById(entryId);
            Optional<DiningTable> table = tableRepository.findByIdForUpdate(tableId);
            if (entry.isEmpty() || table.isEmpty()) {
                log.warn("Cannot seat entry {} at table {}: not found", entryId, tableId);
                return Optional.empty();
            }
            DiningTable t = table.get();
            if (!t.isFree()) {
                log.warn("Cannot seat entry {} at table {}: occupied by entry {}", entryId, t.getNumber(), t.getOccupantEntryId());
                return Optional.empty();
            }
            WaitlistEntry e = entry.get();
            t.occupy(e.getId(), clock.instant());
            tableRepository.save(t);
            entryRepository.delete(e);
            int wasted = t.getCapacity() - e.getPartySize();
            log.info("Seated {} (entry {}, party {}, size {}) at table {} (capacity {}, wasted {})",
                    e.getDisplayName(), e.getId(), e.getPartyId(), e.getPartySize(), t.getNumber(), t.getCapacity(), wasted);
            return Optional.of(new SeatingNotice(e.getPartyId(), e.getDisplayName(), t.getNumber(), wasted));
        });
    }

    /**
     * Inserts every configured table whose number is not present yet. Safe to re-run.
     *
     * @return number of tables inserted
     */
    public int seedTables(List<HostDeskProperties.TableSpec> specs) {
        return locked(() -> {
            int inserted = 0;
            Instant now = clock.instant();
            for (HostDeskProperties.TableSpec spec : specs) {
                if (tableRepository.existsByNumber(spec.number())) continue;
                tableRepository.save(DiningTable.builder()
                        .number(spec.number())
                        .capacity(spec.capacity())
                        .status(DiningTable.Status.FREE)
                        .statusChangedAt(now)
                        .build());
                inserted++;
            }
            return inserted;
        });
    }

    @Override
    public boolean hasTable(String tableNumber) {
        return tableNumber != null && tableRepository.existsByNumber(tableNumber);
    }

    @Override
    public int maxCapacity() {
        return tableRepository.findMaxCapacity();
    }

    /**
     * Strictly increasing at the column's microsecond precision, so arrival order
     * survives a clock stepping backwards or two joins within the same tick.
     */
    private Instant nextEnqueueTimestamp() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        if (!now.isAfter(lastEnqueuedAt)) {
            now = lastEnqueuedAt.plus(1, ChronoUnit.MICROS);
        }
        lastEnqueuedAt = now;
        return now;
    }
}
