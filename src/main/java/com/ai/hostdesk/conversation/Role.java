package com.ai.hostdesk.conversation;

public enum Role {
    CUSTOMER,
    WAITER
}
