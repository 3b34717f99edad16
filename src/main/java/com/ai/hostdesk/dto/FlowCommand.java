package com.ai.hostdesk.dto;

import java.util.Objects;

/**
 * Domain command emitted by the conversation flow and applied to the waitlist store
 * by the dispatcher. Carries no reply text.
 */
public final class FlowCommand {

    public enum Type {
        ENQUEUE,
        FREE_TABLE
    }

    private final Type type;
    private final String displayName;
    private final int partySize;
    private final String tableNumber;

    private FlowCommand(Type type, String displayName, int partySize, String tableNumber) {
        this.type = type;
        this.displayName = displayName;
        this.partySize = partySize;
        this.tableNumber = tableNumber;
    }

    public static FlowCommand enqueue(String displayName, int partySize) {
        if (partySize <= 0) {
            throw new IllegalArgumentException("partySize must be positive: " + partySize);
        }
        return new FlowCommand(Type.ENQUEUE, Objects.requireNonNull(displayName, "displayName"), partySize, null);
    }

    public static FlowCommand freeTable(String tableNumber) {
        return new FlowCommand(Type.FREE_TABLE, null, 0, Objects.requireNonNull(tableNumber, "tableNumber"));
    }

    public Type getType() {
        return type;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getPartySize() {
        return partySize;
    }

    public String getTableNumber() {
        return tableNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FlowCommand)) return false;
        FlowCommand that = (FlowCommand) o;
        return partySize == that.partySize
                && type == that.type
                && Objects.equals(displayName, that.displayName)
                && Objects.equals(tableNumber, that.tableNumber);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, displayName, partySize, tableNumber);
    }

    @Override
    public String toString() {
        return type == Type.ENQUEUE
                ? "ENQUEUE(" + displayName + ", " + partySize + ")"
                : "FREE_TABLE(" + tableNumber + ")";
    }
}
