package com.autorestake.notify.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Discord-compatible webhook body: {"embeds":[{title, description, color, timestamp}]}.
 */
@Value
public class WebhookPayload {
    List<Embed> embeds;

    @Value
    @Builder
    public static class Embed {
        String title;
        String description;
        int color;
        /** ISO-8601 */
        String timestamp;
    }

    public static WebhookPayload of(Embed embed) {
        return new WebhookPayload(List.of(embed));
    }
}
