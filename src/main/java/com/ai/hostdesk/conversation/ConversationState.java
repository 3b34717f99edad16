package com.ai.hostdesk.conversation;

/**
 * States of the messaging conversation. Each state is bound to the one role
 * allowed to be in it, so a session can never hold a mismatched (role, state) pair.
 * There is no terminal state: every completed or failed flow returns to INITIAL.
 */
public enum ConversationState {
    INITIAL(Role.CUSTOMER),
    AWAITING_WAITER_PASSWORD(Role.WAITER),
    AWAITING_FREE_TABLE_NUMBER(Role.WAITER),
    AWAITING_NAME_PEOPLE(Role.CUSTOMER);

    private final Role role;

    ConversationState(Role role) {
        this.role = role;
    }

    public Role getRole() {
        return role;
    }
}
