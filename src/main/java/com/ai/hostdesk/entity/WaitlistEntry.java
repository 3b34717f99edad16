package com.ai.hostdesk.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A party currently waiting for a table. At most one row per party id;
 * the row is deleted the moment the party is seated.
 */
@Entity
@Table(name = "waitlist_entry", uniqueConstraints = {
    @UniqueConstraint(name = "uk_waitlist_party", columnNames = {"party_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WaitlistEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Messaging contact of the party (phone number or WhatsApp id). */
    @Column(name = "party_id", nullable = false, length = 64)
    private String partyId;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    @Column(name = "party_size", nullable = false)
    private int partySize;

    @Column(name = "enqueued_at", nullable = false)
    private Instant enqueuedAt;
}
