package com.ai.hostdesk.service;

import com.ai.hostdesk.component.ResponsePhrases;
import com.ai.hostdesk.component.SessionStore;
import com.ai.hostdesk.conversation.Session;
import com.ai.hostdesk.conversation.Transition;
import com.ai.hostdesk.dto.DispatchResult;
import com.ai.hostdesk.dto.FlowCommand;
import com.ai.hostdesk.dto.InboundMessage;
import com.ai.hostdesk.dto.SeatingNotice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Single entry for inbound messages: runs the conversation step under the party's
 * session lock, applies its commands to the store, replies, and then runs seating
 * allocation when the waitlist or the free tables changed.
 */
@Service
public class MessageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    private final SessionStore sessionStore;
    private final ConversationEngine conversationEngine;
    private final WaitlistTableStore store;
    private final AllocationEngine allocationEngine;
    private final MessageSender messageSender;
    private final ResponsePhrases phrases;

    public MessageDispatcher(SessionStore sessionStore,
                             ConversationEngine conversationEngine,
                             WaitlistTableStore store,
                             AllocationEngine allocationEngine,
                             MessageSender messageSender,
                             ResponsePhrases phrases) {
        this.sessionStore = sessionStore;
        this.conversationEngine = conversationEngine;
        this.store = store;
        this.allocationEngine = allocationEngine;
        this.messageSender = messageSender;
        this.phrases = phrases;
    }

    public DispatchResult dispatch(InboundMessage message) {
        String partyId = message.partyId();
        StepOutcome outcome = sessionStore.withPartyLock(partyId, () -> {
            StepOutcome step = step(partyId, message);
            for (String reply : step.replies) {
                messageSender.send(partyId, reply);
            }
            return step;
        });
        List<SeatingNotice> seated = outcome.allocate ? runAllocation(partyId) : List.of();
        return new DispatchResult(outcome.replies, seated);
    }

    private StepOutcome step(String partyId, InboundMessage message) {
        Session session = sessionStore.get(partyId);
        if (!message.isText()) {
            log.debug("[{}] non-text message ignored", partyId);
            return new StepOutcome(conversationEngine.nonText(session).replies(), false);
        }

        Transition transition = conversationEngine.handle(session, message.text());
        log.debug("[{}] {} -> {} commands={}", partyId, session.getState(), transition.session().getState(), transition.commands());

        List<String> replies = new ArrayList<>(transition.replies());
        Session next = transition.session();
        boolean allocate = false;
        for (FlowCommand command : transition.commands()) {
            try {
                if (apply(partyId, command) == Applied.TABLE_MISSING) {
                    // The waiter stays at the table prompt, as for any unknown table.
                    replies.clear();
                    replies.add(phrases.unknownTable(command.getTableNumber()));
                    next = session.touch(next.getLastActivity());
                } else {
                    allocate = true;
                }
            } catch (RuntimeException e) {
                // Session is not committed, so the party can repeat the same step.
                log.error("[{}] failed to apply {}", partyId, command, e);
                String failure = command.getType() == FlowCommand.Type.ENQUEUE
                        ? phrases.enqueueFailed()
                        : phrases.somethingWentWrong();
                return new StepOutcome(List.of(failure), false);
            }
        }
        sessionStore.put(partyId, next);
        return new StepOutcome(replies, allocate);
    }

    private Applied apply(String partyId, FlowCommand command) {
        switch (command.getType()) {
            case ENQUEUE:
                store.enqueue(partyId, command.getDisplayName(), command.getPartySize());
                return Applied.STORE_CHANGED;
            case FREE_TABLE:
                return store.releaseTable(command.getTableNumber()) ? Applied.STORE_CHANGED : Applied.TABLE_MISSING;
            default:
                throw new IllegalStateException("Unhandled command " + command.getType());
        }
    }

    private List<SeatingNotice> runAllocation(String triggeredBy) {
        try {
            return allocationEngine.allocate();
        } catch (RuntimeException e) {
            // State changes already committed stay; the next trigger retries allocation.
            log.error("Allocation run triggered by {} failed", triggeredBy, e);
            return List.of();
        }
    }

    private enum Applied { STORE_CHANGED, TABLE_MISSING }

    private static final class StepOutcome {
        private final List<String> replies;
        private final boolean allocate;

        StepOutcome(List<String> replies, boolean allocate) {
            this.replies = replies;
            this.allocate = allocate;
        }
    }
}
