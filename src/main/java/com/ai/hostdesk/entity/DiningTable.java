package com.ai.hostdesk.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "dining_table", uniqueConstraints = {
    @UniqueConstraint(name = "uk_dining_table_number", columnNames = {"table_number"})
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DiningTable {

    public enum Status { FREE, OCCUPIED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "table_number", nullable = false, length = 16)
    private String number;

    @Column(nullable = false)
    private int capacity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private Status status = Status.FREE;

    @Column(name = "occupant_entry_id")
    private Long occupantEntryId;

    @Column(name = "status_changed_at", nullable = false)
    private Instant statusChangedAt;

    @Version
    private Long version;

    public boolean isFree() {
        return status == Status.FREE;
    }

    /**
     * Occupant and status only change together, so occupantEntryId is set iff OCCUPIED.
     */
    public void occupy(Long entryId, Instant at) {
        if (entryId == null) {
            throw new IllegalArgumentException("entryId is required to occupy table " + number);
        }
        if (!isFree()) {
            throw new IllegalStateException("Table " + number + " is already occupied by entry " + occupantEntryId);
        }
        this.status = Status.OCCUPIED;
        this.occupantEntryId = entryId;
        this.statusChangedAt = at;
    }

    public void release(Instant at) {
        if (isFree()) return;
        this.status = Status.FREE;
        this.occupantEntryId = null;
        this.statusChangedAt = at;
    }

    @PrePersist
    protected void onCreate() {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Table " + number + " must have a positive capacity");
        }
        if (statusChangedAt == null) statusChangedAt = Instant.now();
    }
}
