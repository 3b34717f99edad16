package com.ai.hostdesk.dto;

import org.apache.commons.lang3.StringUtils;

/**
 * A received message, normalized from whichever webhook delivered it.
 */
public record InboundMessage(String partyId, Type type, String text) {

    public enum Type { TEXT, OTHER }

    public InboundMessage {
        if (StringUtils.isBlank(partyId)) {
            throw new IllegalArgumentException("partyId must not be blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
    }

    public static InboundMessage text(String partyId, String text) {
        return new InboundMessage(partyId, Type.TEXT, text == null ? "" : text);
    }

    public static InboundMessage other(String partyId) {
        return new InboundMessage(partyId, Type.OTHER, null);
    }

    public boolean isText() {
        return type == Type.TEXT;
    }
}
