package com.autorestake.config;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RestTemplateConfig {

    @Bean
    @Qualifier("notifierRestTemplate")
    public RestTemplate notifierRestTemplate(RunConfig config) {
        return buildRestTemplate(config.notificationTimeout(), "auto-restake-keeper/notifier");
    }

    public static RestTemplate buildRestTemplate(Duration timeout, String userAgent) {
        RequestConfig rc = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.of(timeout))
                .setConnectTimeout(Timeout.of(timeout))
                .setResponseTimeout(Timeout.of(timeout))
                .build();
        CloseableHttpClient httpClient = HttpClients.custom()
                .setDefaultRequestConfig(rc)
                .build();
        HttpComponentsClientHttpRequestFactory f = new HttpComponentsClientHttpRequestFactory(httpClient);

        RestTemplate rt = new RestTemplate(f);
        rt.getInterceptors().add((request, body, execution) -> {
            HttpHeaders h = request.getHeaders();
            h.set(HttpHeaders.USER_AGENT, userAgent);
            return execution.execute(request, body);
        });
        return rt;
    }
}
