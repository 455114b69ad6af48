package com.example.videoenhance.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class AiProviderConfig {

    /**
     * Shared client for the image and mask-edit providers. Image generation
     * can take tens of seconds, hence the long read timeout.
     */
    @Bean
    public RestTemplate aiRestTemplate(RestTemplateBuilder builder, EnhancementProperties properties) {
        EnhancementProperties.Ai ai = properties.getAi();
        return builder
            .setConnectTimeout(Duration.ofMillis(ai.getConnectTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(ai.getReadTimeoutMs()))
            .build();
    }
}
