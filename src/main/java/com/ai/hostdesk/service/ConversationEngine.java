package com.ai.hostdesk.service;

import com.ai.hostdesk.component.ResponsePhrases;
import com.ai.hostdesk.config.HostDeskProperties;
import com.ai.hostdesk.conversation.ConversationState;
import com.ai.hostdesk.conversation.FloorPlan;
import com.ai.hostdesk.conversation.Session;
import com.ai.hostdesk.conversation.Transition;
import com.ai.hostdesk.dto.FlowCommand;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns one inbound text plus the sender's session into a {@link Transition}.
 * Performs no I/O: replies and store commands are returned for the caller to apply.
 */
@Service
public class ConversationEngine {

    private static final Logger log = LoggerFactory.getLogger(ConversationEngine.class);

    static final String WAITER_KEYWORD = "waiter";
    static final String CUSTOMER_KEYWORD = "hi";
    private static final int MAX_NAME_LENGTH = 100;
    private static final Pattern TABLE_WORD = Pattern.compile("table", Pattern.CASE_INSENSITIVE);

    private final ResponsePhrases phrases;
    private final FloorPlan floorPlan;
    private final Clock clock;
    private final String waiterPassword;
    private final String tablePrefix;

    public ConversationEngine(ResponsePhrases phrases, FloorPlan floorPlan, Clock clock, HostDeskProperties properties) {
        this.phrases = phrases;
        this.floorPlan = floorPlan;
        this.clock = clock;
        this.waiterPassword = properties.waiterPassword();
        this.tablePrefix = properties.tablePrefix();
    }

    public Transition handle(Session session, String text) {
        String raw = StringUtils.trimToEmpty(text);
        String keyword = raw.toLowerCase(Locale.ROOT);
        Instant now = clock.instant();

        switch (session.getState()) {
            case INITIAL:
                if (WAITER_KEYWORD.equals(keyword)) {
                    return Transition.reply(session.moveTo(ConversationState.AWAITING_WAITER_PASSWORD, now),
                            phrases.waiterPasswordPrompt());
                }
                if (CUSTOMER_KEYWORD.equals(keyword)) {
                    return Transition.reply(session.moveTo(ConversationState.AWAITING_NAME_PEOPLE, now),
                            phrases.namePeoplePrompt());
                }
                break;
            case AWAITING_WAITER_PASSWORD:
                return checkPassword(session, raw, now);
            case AWAITING_FREE_TABLE_NUMBER:
                return freeTable(session, raw, now);
            case AWAITING_NAME_PEOPLE:
                return joinWaitlist(session, raw, now);
            default:
                break;
        }
        return Transition.reply(session.touch(now), phrases.help());
    }

    /** Reply for media, location and other non-text messages. The session is left as it was. */
    public Transition nonText(Session session) {
        return Transition.reply(session, phrases.textOnly());
    }

    /**
     * "table 4" / "4" become "T4"; anything else non-empty is upper-cased as-is.
     * Returns null when nothing is left after stripping the word "table".
     */
    public String normalizeTableNumber(String input) {
        String stripped = TABLE_WORD.matcher(StringUtils.trimToEmpty(input)).replaceAll("").trim();
        if (stripped.isEmpty()) {
            return null;
        }
        if (StringUtils.isNumeric(stripped)) {
            return tablePrefix + stripped;
        }
        return stripped.toUpperCase(Locale.ROOT);
    }

    private Transition checkPassword(Session session, String raw, Instant now) {
        if (waiterPassword.equals(raw)) {
            return Transition.reply(session.moveTo(ConversationState.AWAITING_FREE_TABLE_NUMBER, now),
                    phrases.waiterAuthenticated());
        }
        log.warn("Waiter authentication failed");
        return Transition.reply(session.reset(now), phrases.incorrectPassword());
    }

    private Transition freeTable(Session session, String raw, Instant now) {
        String tableNumber = normalizeTableNumber(raw);
        if (tableNumber == null) {
            return Transition.reply(session.touch(now), phrases.invalidTableFormat());
        }
        if (!floorPlan.hasTable(tableNumber)) {
            log.warn("Release requested for unknown table {}", tableNumber);
            return Transition.reply(session.touch(now), phrases.unknownTable(tableNumber));
        }
        return Transition.command(session.reset(now), phrases.tableFreed(tableNumber), FlowCommand.freeTable(tableNumber));
    }

    private Transition joinWaitlist(Session session, String raw, Instant now) {
        String[] parts = raw.split(",", -1);
        if (parts.length != 2 || StringUtils.isBlank(parts[0])) {
            return Transition.reply(session.touch(now), phrases.namePeopleFormat());
        }
        String name = StringUtils.left(parts[0].trim(), MAX_NAME_LENGTH);
        int partySize;
        try {
            partySize = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            return Transition.reply(session.touch(now), phrases.namePeopleFormat());
        }
        if (partySize <= 0) {
            return Transition.reply(session.touch(now), phrases.partySizeNotPositive());
        }
        int maxCapacity = floorPlan.maxCapacity();
        if (partySize > maxCapacity) {
            return Transition.reply(session.touch(now), phrases.partyTooLarge(maxCapacity));
        }
        return Transition.command(session.reset(now), phrases.queued(name, partySize), FlowCommand.enqueue(name, partySize));
    }
}
