package com.autorestake.notify;

import com.autorestake.config.ConfigurationException;
import com.autorestake.config.RestTemplateConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationFailedEvent;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.ApplicationListener;
import org.springframework.context.ConfigurableApplicationContext;

import java.time.Clock;
import java.time.Duration;

/**
 * Reports a failed startup to the webhook, when one can still be resolved from the environment.
 * The context never refreshed, so nothing here comes from beans.
 */
@Slf4j
public class StartupFailureNotifier implements ApplicationListener<ApplicationFailedEvent> {

    static final String WEBHOOK_URL = "keeper.notification.webhook-url";
    static final String TIMEOUT = "keeper.notification.timeout";

    private final Clock clock;

    public StartupFailureNotifier() {
        this(Clock.systemUTC());
    }

    StartupFailureNotifier(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void onApplicationEvent(ApplicationFailedEvent event) {
        ConfigurableApplicationContext context = event.getApplicationContext();
        if (context == null) return;

        String url;
        Duration timeout;
        try {
            Binder binder = Binder.get(context.getEnvironment());
            url = binder.bind(WEBHOOK_URL, String.class).orElse(null);
            timeout = binder.bind(TIMEOUT, Duration.class).orElse(Duration.ofSeconds(10));
        } catch (RuntimeException e) {
            log.warn("[notifier] webhook settings unreadable, startup failure not reported: {}", e.getMessage());
            return;
        }
        if (url == null || url.isBlank()) return;

        String message = "Keeper failed to start: " + ConfigurationException.rootMessage(event.getException());
        new WebhookNotifier(RestTemplateConfig.buildRestTemplate(timeout, "auto-restake-keeper/notifier"), url, clock)
                .notify(message, true);
    }
}
