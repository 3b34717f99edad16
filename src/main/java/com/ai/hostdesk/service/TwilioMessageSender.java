package com.ai.hostdesk.service;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Sends SMS / WhatsApp texts through the Twilio Messages REST API.
 */
@Service
@ConditionalOnProperty(name = "hostdesk.messaging.provider", havingValue = "twilio", matchIfMissing = true)
public class TwilioMessageSender implements MessageSender {

    private static final Logger log = LoggerFactory.getLogger(TwilioMessageSender.class);

    private static final String TWILIO_API_BASE = "https://api.twilio.com/2010-04-01";

    @Value("${twilio.account-sid:}")
    private String accountSid;

    @Value("${twilio.auth-token:}")
    private String authToken;

    /** Sender number, e.g. whatsapp:+14155238886 for the WhatsApp sandbox. */
    @Value("${twilio.from-number:}")
    private String fromNumber;

    private final RestTemplate restTemplate;

    public TwilioMessageSender(RestTemplateBuilder builder) {
        this.restTemplate = builder.build();
    }

    @Override
    public boolean send(String partyId, String text) {
        if (StringUtils.isAnyBlank(partyId, text)) {
            return false;
        }
        if (StringUtils.isAnyBlank(accountSid, authToken, fromNumber)) {
            log.warn("Twilio credentials not set; skipping message to {}", partyId);
            return false;
        }
        String apiUrl = TWILIO_API_BASE + "/Accounts/" + accountSid + "/Messages.json";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setBasicAuth(accountSid, authToken);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("From", fromNumber);
        body.add("To", partyId);
        body.add("Body", text);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(apiUrl, new HttpEntity<>(body, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                log.error("Twilio Messages returned {} for {}", response.getStatusCode(), partyId);
                return false;
            }
            log.debug("Sent message to {}", partyId);
            return true;
        } catch (RestClientException e) {
            log.error("Twilio send failed for {}", partyId, e);
            return false;
        }
    }
}
