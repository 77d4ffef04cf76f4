package com.autorestake.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationEnvironmentPreparedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.Map;

/**
 * The keeper runs without a web server unless the health check is on
 * ({@code ENABLE_HEALTH_CHECK=true} or the "health" profile). Then a servlet server is started
 * on {@code server.port} just for {@link HealthController}.
 */
@Slf4j
public class HealthCheckWebEnabler implements ApplicationListener<ApplicationEnvironmentPreparedEvent> {

    static final String ENABLED = "keeper.health-check.enabled";

    @Override
    public void onApplicationEvent(ApplicationEnvironmentPreparedEvent event) {
        ConfigurableEnvironment env = event.getEnvironment();
        if (!env.getProperty(ENABLED, Boolean.class, false)) return;

        env.getPropertySources().addFirst(new MapPropertySource("keeperHealthCheck",
                Map.of("spring.main.web-application-type", "servlet")));
        log.info("[health] health check enabled on port {}", env.getProperty("server.port", "8080"));
    }
}
