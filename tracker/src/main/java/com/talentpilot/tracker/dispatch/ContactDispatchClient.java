package com.talentpilot.tracker.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentpilot.tracker.config.TrackerProperties;
import com.talentpilot.tracker.model.ContactChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * HTTP client for the contact dispatch service (email / WhatsApp delivery).
 *
 * One call sends one message to one candidate. Delivery mechanics live on
 * the other side of this contract; we only care whether the send was
 * accepted and, if not, the reason code.
 *
 * Called from the outreach worker pool, so blocking I/O here is fine.
 */
@Component
public class ContactDispatchClient {

    private static final Logger log = LoggerFactory.getLogger(ContactDispatchClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     requestTimeout;

    public ContactDispatchClient(TrackerProperties properties, ObjectMapper objectMapper) {
        TrackerProperties.Dispatch cfg = properties.getDispatch();
        this.baseUrl        = cfg.getBaseUrl();
        this.requestTimeout = cfg.getRequestTimeout();
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(cfg.getConnectTimeout())
                .build();
    }

    /**
     * Send one outreach message.
     *
     * @param template optional template name or free-text message; the service
     *                 falls back to its default outreach template when null
     * @throws ChannelException if the service rejects the message or is unreachable
     */
    public void send(UUID candidateId, ContactChannel channel, String template) {
        log.debug("Dispatching {} message to candidate {}", channel.wireName(), candidateId);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("candidate_id", candidateId.toString());
        payload.put("channel", channel.wireName());
        if (template != null && !template.isBlank()) {
            payload.put("template", template);
        }

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/messages/send"))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(toJson(payload)))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelException(ChannelException.PROVIDER_UNREACHABLE,
                    "Dispatch interrupted for candidate " + candidateId, e);
        } catch (ChannelException e) {
            throw e;
        } catch (Exception e) {
            throw new ChannelException(ChannelException.PROVIDER_UNREACHABLE,
                    "Dispatch service unreachable for candidate " + candidateId, e);
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            String reason = reasonFrom(resp);
            throw new ChannelException(reason,
                    "Dispatch rejected for candidate " + candidateId
                    + ": HTTP " + resp.statusCode() + ": " + reason);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /**
     * Error bodies look like {"reason": "invalid_address", "detail": "..."}.
     * Fall back to a status-derived code when the body has no reason.
     */
    private String reasonFrom(HttpResponse<String> resp) {
        if (resp.statusCode() == 429) {
            return ChannelException.RATE_LIMITED;
        }
        String body = resp.body();
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = json.readTree(body);
                JsonNode reason = node.get("reason");
                if (reason != null && reason.isTextual() && !reason.asText().isBlank()) {
                    return reason.asText();
                }
            } catch (JsonProcessingException e) {
                log.debug("Non-JSON error body from dispatch service: {}", body);
            }
        }
        return ChannelException.PROVIDER_ERROR;
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ChannelException(ChannelException.PROVIDER_ERROR, "JSON serialization failed", e);
        }
    }
}
