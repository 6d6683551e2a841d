package org.influence.analytics.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class ClientConfig {

    @Value("${enrichment.image-catalog.connect-timeout-ms:1000}")
    private long connectTimeoutMs;

    @Value("${enrichment.image-catalog.read-timeout-ms:2500}")
    private long readTimeoutMs;

    /**
     * Source of "today" for window bounds and export names.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "imageCatalogRestTemplate")
    public RestTemplate imageCatalogRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
