package com.marketpulse.config;

import com.marketpulse.service.assistant.HostedLlmClient;
import com.marketpulse.service.assistant.LlmClient;
import com.marketpulse.service.assistant.LocalEchoLlmClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
@Slf4j
public class LlmConfig {

    @Bean
    public LlmClient llmClient(
            WebClient.Builder webClientBuilder,
            @Value("${marketpulse.llm.api-url}") String apiUrl,
            @Value("${marketpulse.llm.api-key:}") String apiKey,
            @Value("${marketpulse.llm.model}") String model,
            @Value("${marketpulse.llm.temperature:0}") double temperature,
            @Value("${marketpulse.llm.timeout-seconds:60}") long timeoutSeconds) {

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No LLM API key configured, assistant runs in offline mode");
            return new LocalEchoLlmClient();
        }
        log.info("Assistant uses model {} at {}", model, apiUrl);
        return new HostedLlmClient(webClientBuilder, apiUrl, apiKey, model, temperature,
            Duration.ofSeconds(timeoutSeconds));
    }
}
