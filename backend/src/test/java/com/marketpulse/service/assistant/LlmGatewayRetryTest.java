package com.marketpulse.service.assistant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringJUnitConfig
@TestPropertySource(properties = "marketpulse.llm.retry-delay-ms=1")
class LlmGatewayRetryTest {

    @Configuration
    @EnableRetry
    static class Config {
        @Bean
        LlmClient llmClient() {
            return mock(LlmClient.class);
        }

        @Bean
        LlmGateway llmGateway(LlmClient llmClient) {
            return new LlmGateway(llmClient);
        }
    }

    @Autowired
    private LlmClient llmClient;

    @Autowired
    private LlmGateway gateway;

    @BeforeEach
    void resetClient() {
        reset(llmClient);
    }

    @Test
    void transientFailureIsRetried() {
        when(llmClient.complete(anyList()))
            .thenThrow(new LlmException("timeout"))
            .thenReturn("recovered answer");

        assertThat(gateway.chat(List.of(LlmMessage.user("hi")))).isEqualTo("recovered answer");
        verify(llmClient, times(2)).complete(anyList());
    }

    @Test
    void chatGivesUpAfterThreeAttempts() {
        when(llmClient.complete(anyList())).thenThrow(new LlmException("HTTP 500"));

        assertThat(gateway.chat(List.of(LlmMessage.user("hi")))).isEqualTo("AI Error: HTTP 500");
        verify(llmClient, times(3)).complete(anyList());
    }

    @Test
    void insightsHaveTheirOwnFallbackText() {
        when(llmClient.complete(anyList())).thenThrow(new LlmException("HTTP 500"));

        assertThat(gateway.insights(List.of(LlmMessage.user("go"))))
            .isEqualTo("Could not generate insights. Error: HTTP 500");
    }
}
