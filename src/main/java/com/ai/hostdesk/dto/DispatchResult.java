package com.ai.hostdesk.dto;

import java.util.List;

/**
 * What handling one inbound message produced: replies to the sender and any parties seated as a result.
 */
public record DispatchResult(List<String> replies, List<SeatingNotice> seated) {

    public DispatchResult {
        replies = replies == null ? List.of() : List.copyOf(replies);
        seated = seated == null ? List.of() : List.copyOf(seated);
    }
}
