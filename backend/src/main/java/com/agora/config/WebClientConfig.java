package com.agora.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Value("${app.content.base-url:https://api.groq.com}")
    private String groqBaseUrl;

    @Value("${app.content.api-key:}")
    private String groqApiKey;

    @Bean
    public WebClient groqClient() {
        return WebClient.builder()
                .baseUrl(groqBaseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + groqApiKey)
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(1024 * 1024)) // 1MB
                .build();
    }
}
