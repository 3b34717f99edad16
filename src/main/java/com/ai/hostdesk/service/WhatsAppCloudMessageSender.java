package com.ai.hostdesk.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Sends texts through the WhatsApp Business Cloud API (Graph API /messages).
 */
@Service
@ConditionalOnProperty(name = "hostdesk.messaging.provider", havingValue = "whatsapp")
public class WhatsAppCloudMessageSender implements MessageSender {

    private static final Logger log = LoggerFactory.getLogger(WhatsAppCloudMessageSender.class);

    @Value("${whatsapp.access-token:}")
    private String accessToken;

    @Value("${whatsapp.phone-number-id:}")
    private String phoneNumberId;

    @Value("${whatsapp.api-base:https://graph.facebook.com/v18.0}")
    private String apiBase;

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    public WhatsAppCloudMessageSender(RestTemplateBuilder builder) {
        this.restTemplate = builder.build();
    }

    @Override
    public boolean send(String partyId, String text) {
        if (StringUtils.isAnyBlank(partyId, text)) {
            return false;
        }
        if (StringUtils.isAnyBlank(accessToken, phoneNumberId)) {
            log.warn("WhatsApp credentials not set; skipping message to {}", partyId);
            return false;
        }
        String url = StringUtils.removeEnd(apiBase.trim(), "/") + "/" + phoneNumberId + "/messages";

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setContentType(MediaType.APPLICATION_JSON);

        ObjectNode payload = mapper.createObjectNode();
        payload.put("messaging_product", "whatsapp");
        payload.put("to", partyId);
        payload.put("type", "text");
        payload.putObject("text").put("body", text);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(payload.toString(), headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                log.error("WhatsApp API returned {} for {}", response.getStatusCode(), partyId);
                return false;
            }
            log.debug("Sent message to {}", partyId);
            return true;
        } catch (RestClientException e) {
            log.error("WhatsApp send failed for {}: {}", partyId, e.getMessage());
            return false;
        }
    }
}
