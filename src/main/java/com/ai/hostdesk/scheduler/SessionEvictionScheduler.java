package com.ai.hostdesk.scheduler;

import com.ai.hostdesk.component.SessionStore;
import com.ai.hostdesk.config.HostDeskProperties;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops conversation sessions nobody has touched within the idle TTL.
 */
@Component
public class SessionEvictionScheduler {

    private final SessionStore sessionStore;
    private final HostDeskProperties properties;

    public SessionEvictionScheduler(SessionStore sessionStore, HostDeskProperties properties) {
        this.sessionStore = sessionStore;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${hostdesk.session.sweep-interval:PT5M}",
            initialDelayString = "${hostdesk.session.sweep-interval:PT5M}")
    public void evictIdleSessions() {
        sessionStore.evictIdle(properties.session().idleTtl());
    }
}
