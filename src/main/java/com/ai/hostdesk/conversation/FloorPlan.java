package com.ai.hostdesk.conversation;

/**
 * Read-only view of the restaurant's tables, consulted while validating input.
 */
public interface FloorPlan {

    boolean hasTable(String tableNumber);

    /** Largest table capacity, or 0 when no tables exist. */
    int maxCapacity();
}
