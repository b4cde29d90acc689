package com.climbwatch.occupancy.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final OccupancyProperties properties;

    /**
     * RestTemplate for the Urban Climb API. Every call is bounded by the configured
     * connect and read timeouts.
     */
    @Bean
    @Primary
    public RestTemplate upstreamRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(properties.getUpstream().getConnectTimeout())
                .setReadTimeout(properties.getUpstream().getReadTimeout())
                .build();
    }

    /**
     * Short-timeout RestTemplate for the GCE metadata server, which is either local or absent.
     */
    @Bean
    public RestTemplate metadataRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(2))
                .setReadTimeout(Duration.ofSeconds(2))
                .build();
    }
}
