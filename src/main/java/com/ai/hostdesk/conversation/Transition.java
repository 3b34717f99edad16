package com.ai.hostdesk.conversation;

import com.ai.hostdesk.dto.FlowCommand;

import java.util.List;

/**
 * Outcome of feeding one inbound text to the conversation engine: the next
 * session, replies for the sender (in order) and commands for the waitlist store (in order).
 */
public record Transition(Session session, List<String> replies, List<FlowCommand> commands) {

    public Transition {
        replies = replies == null ? List.of() : List.copyOf(replies);
        commands = commands == null ? List.of() : List.copyOf(commands);
    }

    public static Transition reply(Session session, String text) {
        return new Transition(session, List.of(text), List.of());
    }

    public static Transition command(Session session, String text, FlowCommand command) {
        return new Transition(session, List.of(text), List.of(command));
    }
}
