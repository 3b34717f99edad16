package com.ai.hostdesk.conversation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-party conversation state. Immutable: every transition yields a new
 * instance, which the caller stores only once the step has fully succeeded.
 */
public final class Session {

    private final ConversationState state;
    private final Map<String, String> scratch;
    private final Instant lastActivity;

    private Session(ConversationState state, Map<String, String> scratch, Instant lastActivity) {
        this.state = Objects.requireNonNull(state, "state");
        this.scratch = scratch.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(scratch));
        this.lastActivity = Objects.requireNonNull(lastActivity, "lastActivity");
    }

    public static Session initial(Instant now) {
        return new Session(ConversationState.INITIAL, Collections.emptyMap(), now);
    }

    public ConversationState getState() {
        return state;
    }

    public Role getRole() {
        return state.getRole();
    }

    /** Data collected mid-conversation. Not used by the current flows. */
    public Map<String, String> getScratch() {
        return scratch;
    }

    public String getScratch(String key) {
        return scratch.get(key);
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public Session moveTo(ConversationState next, Instant now) {
        return new Session(next, scratch, now);
    }

    public Session withScratch(String key, String value, Instant now) {
        Map<String, String> copy = new LinkedHashMap<>(scratch);
        copy.put(key, value);
        return new Session(state, copy, now);
    }

    /** Back to INITIAL as a customer, scratch cleared. */
    public Session reset(Instant now) {
        return initial(now);
    }

    public Session touch(Instant now) {
        return new Session(state, scratch, now);
    }

    public boolean isInFlow() {
        return state != ConversationState.INITIAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Session)) return false;
        Session other = (Session) o;
        return state == other.state && scratch.equals(other.scratch) && lastActivity.equals(other.lastActivity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, scratch, lastActivity);
    }

    @Override
    public String toString() {
        return "Session{role=" + getRole() + ", state=" + state + ", lastActivity=" + lastActivity + "}";
    }
}
