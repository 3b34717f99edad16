package com.ai.hostdesk.entity;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiningTableTest {

    private static final Instant T0 = Instant.parse("2025-06-01T18:00:00Z");

    @Test
    void occupyAndReleaseMoveStatusAndOccupantTogether() {
        DiningTable table = DiningTable.builder().number("T5").capacity(4).statusChangedAt(T0).build();

        table.occupy(42L, T0.plusSeconds(1));
        assertThat(table.getStatus()).isEqualTo(DiningTable.Status.OCCUPIED);
        assertThat(table.getOccupantEntryId()).isEqualTo(42L);

        table.release(T0.plusSeconds(2));
        assertThat(table.isFree()).isTrue();
        assertThat(table.getOccupantEntryId()).isNull();
        assertThat(table.getStatusChangedAt()).isEqualTo(T0.plusSeconds(2));
    }

    @Test
    void occupiedTableCannotBeOccupiedAgain() {
        DiningTable table = DiningTable.builder().number("T1").capacity(2).statusChangedAt(T0).build();
        table.occupy(1L, T0);

        assertThatThrownBy(() -> table.occupy(2L, T0)).isInstanceOf(IllegalStateException.class);
        assertThat(table.getOccupantEntryId()).isEqualTo(1L);
    }

    @Test
    void releasingAFreeTableChangesNothing() {
        DiningTable table = DiningTable.builder().number("T1").capacity(2).statusChangedAt(T0).build();

        table.release(T0.plusSeconds(60));

        assertThat(table.getStatusChangedAt()).isEqualTo(T0);
    }

    @Test
    void occupyRequiresAnEntry() {
        DiningTable table = DiningTable.builder().number("T1").capacity(2).statusChangedAt(T0).build();

        assertThatThrownBy(() -> table.occupy(null, T0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(table.isFree()).isTrue();
    }
}
