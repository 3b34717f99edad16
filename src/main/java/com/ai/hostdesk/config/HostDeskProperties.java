package com.ai.hostdesk.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Binds the hostdesk.* settings from application.yml.
 */
@Validated
@ConfigurationProperties(prefix = "hostdesk")
public record HostDeskProperties(
        @NotBlank @DefaultValue("waiter123") String waiterPassword,
        @NotBlank @DefaultValue("T") String tablePrefix,
        @Valid List<TableSpec> tables,
        @Valid @DefaultValue Session session,
        @Valid @DefaultValue Messaging messaging
) {

    // 4 x 2-seaters, 4 x 4-seaters, 2 x 6-seaters
    private static final List<TableSpec> DEFAULT_TABLES = List.of(
            new TableSpec("T1", 2), new TableSpec("T2", 2), new TableSpec("T3", 2), new TableSpec("T4", 2),
            new TableSpec("T5", 4), new TableSpec("T6", 4), new TableSpec("T7", 4), new TableSpec("T8", 4),
            new TableSpec("T9", 6), new TableSpec("T10", 6)
    );

    public HostDeskProperties {
        tables = tables == null || tables.isEmpty() ? DEFAULT_TABLES : List.copyOf(tables);
    }

    public record TableSpec(
            @NotBlank String number,
            @Positive int capacity
    ) {}

    public record Session(
            @NotNull @DefaultValue("PT2H") Duration idleTtl,
            @NotNull @DefaultValue("PT5M") Duration sweepInterval
    ) {}

    public record Messaging(
            @NotBlank @DefaultValue("twilio") String provider
    ) {}
}
