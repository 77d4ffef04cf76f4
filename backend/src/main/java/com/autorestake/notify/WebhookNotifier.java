package com.autorestake.notify;

import com.autorestake.config.RunConfig;
import com.autorestake.notify.dto.WebhookPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;

/**
 * Posts keeper status lines to a webhook (Discord/Slack-compatible embed).
 * Fire-and-forget: no webhook configured means no-op, delivery errors are logged only.
 */
@Component
@Slf4j
public class WebhookNotifier implements Notifier {

    static final String TITLE = "Restake Keeper";
    static final int COLOR_OK = 0x00ff00;
    static final int COLOR_ERROR = 0xff0000;

    private final RestTemplate restTemplate;
    private final String webhookUrl;
    private final Clock clock;

    @Autowired
    public WebhookNotifier(@Qualifier("notifierRestTemplate") RestTemplate restTemplate, RunConfig config, Clock clock) {
        this(restTemplate, config.webhookUrl(), clock);
    }

    /** For use outside the context, e.g. when the context itself failed to start. */
    public WebhookNotifier(RestTemplate restTemplate, String webhookUrl, Clock clock) {
        this.restTemplate = restTemplate;
        this.webhookUrl = webhookUrl == null || webhookUrl.isBlank() ? null : webhookUrl.trim();
        this.clock = clock;
    }

    @Override
    public void notify(String message, boolean isError) {
        if (webhookUrl == null) return;
        try {
            post(message, isError);
            log.debug("[notifier] delivered: {}", message);
        } catch (NotificationException e) {
            log.error("[notifier] Failed to send notification: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("[notifier] Unexpected notification failure: {}", e.toString());
        }
    }

    private void post(String message, boolean isError) {
        WebhookPayload payload = WebhookPayload.of(WebhookPayload.Embed.builder()
                .title(TITLE)
                .description(message)
                .color(isError ? COLOR_ERROR : COLOR_OK)
                .timestamp(Instant.now(clock).toString())
                .build());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<String> resp = restTemplate.postForEntity(
                    URI.create(webhookUrl), new HttpEntity<>(payload, headers), String.class);
            if (!resp.getStatusCode().is2xxSuccessful()) {
                throw new NotificationException("Webhook HTTP " + resp.getStatusCode());
            }
        } catch (RestClientException e) {
            throw new NotificationException("Webhook call failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new NotificationException("Invalid webhook url: " + webhookUrl, e);
        }
    }
}
