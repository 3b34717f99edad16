package com.ai.hostdesk.config;

import com.ai.hostdesk.service.WaitlistTableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Idempotent seeder: inserts the configured tables that are not present yet. Safe to re-run.
 */
@Component
public class TableSeeder {

    private static final Logger log = LoggerFactory.getLogger(TableSeeder.class);

    private final WaitlistTableStore store;
    private final HostDeskProperties properties;

    public TableSeeder(WaitlistTableStore store, HostDeskProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seed() {
        int inserted = store.seedTables(properties.tables());
        if (inserted == 0) {
            log.info("Tables already seeded, skipping");
        } else {
            log.info("Seeded {} of {} configured tables", inserted, properties.tables().size());
        }
    }
}
