package com.ai.hostdesk.component;

import com.ai.hostdesk.conversation.Session;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory conversation sessions, one per party id. Each party has its own lock
 * so two rapid messages from the same sender are handled strictly one after the other.
 */
@Component
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final Map<String, SessionSlot> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public SessionStore(Clock clock) {
        this.clock = clock;
    }

    private static final class SessionSlot {
        final ReentrantLock lock = new ReentrantLock();
        volatile Session session;

        SessionSlot(Session session) {
            this.session = session;
        }
    }

    /**
     * Returns the party's session, creating the default customer/INITIAL one on first contact.
     */
    public Session get(String partyId) {
        return slot(partyId).session;
    }

    public void put(String partyId, Session session) {
        if (session == null) {
            throw new IllegalArgumentException("session must not be null");
        }
        slot(partyId).session = session;
    }

    public boolean contains(String partyId) {
        return sessions.containsKey(partyId);
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Runs {@code work} while holding the party's lock. Re-checks the slot after locking
     * because an eviction may have replaced it in the meantime.
     */
    public <T> T withPartyLock(String partyId, Supplier<T> work) {
        while (true) {
            SessionSlot slot = slot(partyId);
            slot.lock.lock();
            try {
                if (sessions.get(partyId) != slot) {
                    continue;
                }
                return work.get();
            } finally {
                slot.lock.unlock();
            }
        }
    }

    /**
     * Drops sessions idle for longer than {@code idleTtl}. A session whose party is
     * being served right now is skipped.
     */
    public int evictIdle(Duration idleTtl) {
        Instant cutoff = clock.instant().minus(idleTtl);
        int evicted = 0;
        for (Map.Entry<String, SessionSlot> e : sessions.entrySet()) {
            SessionSlot slot = e.getValue();
            if (!slot.lock.tryLock()) continue;
            try {
                Session session = slot.session;
                if (session.getLastActivity().isBefore(cutoff) && sessions.remove(e.getKey(), slot)) {
                    evicted++;
                    if (session.isInFlow()) {
                        log.debug("[{}] abandoned mid-flow in state {}", e.getKey(), session.getState());
                    }
                }
            } finally {
                slot.lock.unlock();
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} idle sessions (ttl={}), {} remaining", evicted, idleTtl, sessions.size());
        }
        return evicted;
    }

    private SessionSlot slot(String partyId) {
        if (StringUtils.isBlank(partyId)) {
            throw new IllegalArgumentException("partyId must not be blank");
        }
        return sessions.computeIfAbsent(partyId, key -> new SessionSlot(Session.initial(clock.instant())));
    }
}
