package com.agora.config;

import com.agora.content.ContentSource;
import com.agora.content.FallbackContentSource;
import com.agora.content.GroqContentSource;
import com.agora.content.UtteranceSanitizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
public class ContentSourceConfig {

    @Value("${app.content.primary-model:llama-3.1-8b-instant}")
    private String primaryModel;

    @Value("${app.content.backup-model:meta-llama/llama-4-scout-17b-16e-instruct}")
    private String backupModel;

    @Value("${app.content.temperature:0.85}")
    private double temperature;

    @Value("${app.content.max-tokens:150}")
    private int maxTokens;

    @Value("${app.content.timeout-seconds:30}")
    private long timeoutSeconds;

    @Bean
    public ContentSource contentSource(WebClient groqClient, DebateSettings settings) {
        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        return new FallbackContentSource(
                new GroqContentSource(groqClient, primaryModel, temperature, maxTokens, timeout),
                new GroqContentSource(groqClient, backupModel, temperature, maxTokens, timeout),
                new UtteranceSanitizer(settings.getMaxWords()));
    }
}
