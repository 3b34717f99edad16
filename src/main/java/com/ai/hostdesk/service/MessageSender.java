package com.ai.hostdesk.service;

/**
 * Outbound text delivery to a party. Implementations log their own failures
 * and never throw for a delivery problem.
 */
public interface MessageSender {

    /**
     * @return true when the provider accepted the message
     */
    boolean send(String partyId, String text);
}
