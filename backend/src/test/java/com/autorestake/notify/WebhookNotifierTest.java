package com.autorestake.notify;

import com.autorestake.TestConfigs;
import com.autorestake.config.RestTemplateConfig;
import com.autorestake.config.RunConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class WebhookNotifierTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2026-10-19T12:00:00Z"), ZoneOffset.UTC);

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
    }

    @Test
    void postsEmbedWithTitleDescriptionColorAndTimestamp() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(204));
        server.start();

        notifier(server.url("/webhook").toString()).notify("Auto-restake successful!", false);

        RecordedRequest req = server.takeRequest(2, TimeUnit.SECONDS);
        assertThat(req).isNotNull();
        assertThat(req.getMethod()).isEqualTo("POST");
        assertThat(req.getHeader("Content-Type")).startsWith("application/json");

        JsonNode embed = mapper.readTree(req.getBody().readUtf8()).get("embeds").get(0);
        assertThat(embed.get("title").asText()).isEqualTo("Restake Keeper");
        assertThat(embed.get("description").asText()).isEqualTo("Auto-restake successful!");
        assertThat(embed.get("color").asInt()).isEqualTo(0x00ff00);
        assertThat(embed.get("timestamp").asText()).isEqualTo("2026-10-19T12:00:00Z");
    }

    @Test
    void errorMessagesUseRedColor() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(200));
        server.start();

        notifier(server.url("/webhook").toString()).notify("Keeper run failed", true);

        JsonNode embed = mapper.readTree(server.takeRequest(2, TimeUnit.SECONDS).getBody().readUtf8())
                .get("embeds").get(0);
        assertThat(embed.get("color").asInt()).isEqualTo(0xff0000);
    }

    @Test
    void serverErrorIsSwallowed() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(500).setBody("oops"));
        server.start();

        WebhookNotifier notifier = notifier(server.url("/webhook").toString());

        assertThatCode(() -> notifier.notify("hello", false)).doesNotThrowAnyException();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void unreachableEndpointIsSwallowed() throws Exception {
        server = new MockWebServer();
        server.start();
        String url = server.url("/webhook").toString();
        server.shutdown();
        server = null;

        WebhookNotifier notifier = notifier(url);

        assertThatCode(() -> notifier.notify("hello", true)).doesNotThrowAnyException();
    }

    @Test
    void noWebhookConfiguredIsNoOp() {
        RunConfig config = TestConfigs.runConfig();
        WebhookNotifier notifier = new WebhookNotifier(
                RestTemplateConfig.buildRestTemplate(Duration.ofSeconds(1), "test"), config, FIXED);

        assertThat(config.hasWebhook()).isFalse();
        assertThatCode(() -> notifier.notify("hello", false)).doesNotThrowAnyException();
    }

    private WebhookNotifier notifier(String url) {
        return new WebhookNotifier(RestTemplateConfig.buildRestTemplate(Duration.ofSeconds(2), "test"),
                TestConfigs.runConfigWithWebhook(url), FIXED);
    }
}
