package com.ai.hostdesk.controller;

import com.ai.hostdesk.dto.InboundMessage;
import com.ai.hostdesk.service.MessageDispatcher;
import com.twilio.security.RequestValidator;
import com.twilio.twiml.MessagingResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Twilio Messaging webhook (SMS or WhatsApp via Twilio). Replies are sent through
 * the REST API, so the TwiML returned here is always empty.
 */
@RestController
public class TwilioMessagingController {

    private static final Logger log = LoggerFactory.getLogger(TwilioMessagingController.class);

    static final String INBOUND_PATH = "/twilio/messaging/inbound";

    private final MessageDispatcher dispatcher;

    @Value("${twilio.auth-token:}")
    private String authToken;

    @Value("${twilio.validate-signature:false}")
    private boolean validateSignature;

    @Value("${twilio.base-url:}")
    private String baseUrl;

    public TwilioMessagingController(MessageDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping(value = INBOUND_PATH, produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> inbound(@RequestParam Map<String, String> params,
                                          @RequestHeader(value = "X-Twilio-Signature", required = false) String signature,
                                          HttpServletRequest request) {
        if (validateSignature && !isSignatureValid(params, signature, request)) {
            log.warn("Rejected Twilio webhook with invalid signature from {}", params.get("From"));
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        String from = params.get("From");
        if (StringUtils.isBlank(from)) {
            return ResponseEntity.badRequest().build();
        }
        dispatcher.dispatch(toInbound(from, params));
        return ResponseEntity.ok(new MessagingResponse.Builder().build().toXml());
    }

    static InboundMessage toInbound(String from, Map<String, String> params) {
        int numMedia = parseIntOrZero(params.get("NumMedia"));
        String messageType = params.get("MessageType");
        boolean text = numMedia == 0 && (StringUtils.isBlank(messageType) || "text".equalsIgnoreCase(messageType));
        return text ? InboundMessage.text(from, params.get("Body")) : InboundMessage.other(from);
    }

    private boolean isSignatureValid(Map<String, String> params, String signature, HttpServletRequest request) {
        if (StringUtils.isAnyBlank(authToken, signature)) {
            return false;
        }
        String url = StringUtils.isNotBlank(baseUrl)
                ? StringUtils.removeEnd(baseUrl.trim(), "/") + INBOUND_PATH
                : request.getRequestURL().toString();
        return new RequestValidator(authToken).validate(url, params, signature);
    }

    private static int parseIntOrZero(String value) {
        try {
            return StringUtils.isBlank(value) ? 0 : Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
