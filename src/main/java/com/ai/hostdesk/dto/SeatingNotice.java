package com.ai.hostdesk.dto;

/**
 * Result of seating a party: who to notify and where they sit.
 */
public record SeatingNotice(String partyId, String name, String tableNumber, int wastedSeats) {
}
