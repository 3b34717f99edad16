package com.ai.hostdesk.controller;

import com.ai.hostdesk.dto.InboundMessage;
import com.ai.hostdesk.service.MessageDispatcher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * WhatsApp Business Cloud API webhook: verification handshake and message delivery.
 */
@RestController
public class WhatsAppWebhookController {

    private static final Logger log = LoggerFactory.getLogger(WhatsAppWebhookController.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final MessageDispatcher dispatcher;

    @Value("${whatsapp.verify-token:}")
    private String verifyToken;

    public WhatsAppWebhookController(MessageDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @GetMapping("/webhook")
    public ResponseEntity<String> verify(@RequestParam(value = "hub.verify_token", required = false) String token,
                                         @RequestParam(value = "hub.challenge", required = false) String challenge) {
        if (StringUtils.isNotBlank(verifyToken) && verifyToken.equals(token)) {
            return ResponseEntity.ok(StringUtils.defaultString(challenge));
        }
        log.warn("WhatsApp webhook verification failed");
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body("Verification failed");
    }

    @PostMapping("/webhook")
    public ResponseEntity<String> receive(@RequestBody String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable WhatsApp webhook payload: {}", e.getOriginalMessage());
            return ResponseEntity.badRequest().body("Invalid payload");
        }
        for (InboundMessage message : extractMessages(root)) {
            dispatcher.dispatch(message);
        }
        return ResponseEntity.ok("EVENT_RECEIVED");
    }

    /**
     * Pulls the first message of every "messages" change out of a
     * whatsapp_business_account notification. Anything else yields nothing.
     */
    static List<InboundMessage> extractMessages(JsonNode root) {
        List<InboundMessage> messages = new ArrayList<>();
        if (root == null || !"whatsapp_business_account".equals(root.path("object").asText())) {
            return messages;
        }
        for (JsonNode entry : root.path("entry")) {
            for (JsonNode change : entry.path("changes")) {
                if (!"messages".equals(change.path("field").asText())) continue;
                JsonNode msgs = change.path("value").path("messages");
                if (!msgs.isArray() || msgs.isEmpty()) continue;
                JsonNode msg = msgs.get(0);
                String from = msg.path("from").asText("");
                if (from.isEmpty()) continue;
                if ("text".equals(msg.path("type").asText())) {
                    messages.add(InboundMessage.text(from, msg.path("text").path("body").asText("")));
                } else {
                    messages.add(InboundMessage.other(from));
                }
            }
        }
        return messages;
    }
}
