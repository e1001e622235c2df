package com.marketpulse.service.assistant;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Model calls with retry and exponential backoff.
 *
 * Retry Configuration:
 * - Max Attempts: 3
 * - Initial Delay: marketpulse.llm.retry-delay-ms (1000ms)
 * - Max Delay: 10000ms
 * - Multiplier: 2.0
 *
 * When every attempt fails the caller gets an error text instead of an exception.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmGateway {

    static final String CHAT_ERROR_PREFIX = "AI Error: ";
    static final String INSIGHTS_ERROR_PREFIX = "Could not generate insights. Error: ";

    private final LlmClient llmClient;

    @Retryable(
        retryFor = {LlmException.class},
        maxAttempts = 3,
        backoff = @Backoff(
            delayExpression = "${marketpulse.llm.retry-delay-ms:1000}",
            maxDelay = 10000,
            multiplier = 2.0
        ),
        recover = "recoverChat"
    )
    public String chat(List<LlmMessage> messages) {
        return call(messages);
    }

    @Retryable(
        retryFor = {LlmException.class},
        maxAttempts = 3,
        backoff = @Backoff(
            delayExpression = "${marketpulse.llm.retry-delay-ms:1000}",
            maxDelay = 10000,
            multiplier = 2.0
        ),
        recover = "recoverInsights"
    )
    public String insights(List<LlmMessage> messages) {
        return call(messages);
    }

    @Recover
    public String recoverChat(LlmException e, List<LlmMessage> messages) {
        log.error("Chat completion failed after retries: {}", e.getMessage());
        return CHAT_ERROR_PREFIX + e.getMessage();
    }

    @Recover
    public String recoverInsights(LlmException e, List<LlmMessage> messages) {
        log.error("Insight generation failed after retries: {}", e.getMessage());
        return INSIGHTS_ERROR_PREFIX + e.getMessage();
    }

    private String call(List<LlmMessage> messages) {
        try {
            return llmClient.complete(messages);
        } catch (LlmException e) {
            log.warn("Model call to {} failed, will retry: {}", llmClient.modelId(), e.getMessage());
            throw e;
        }
    }
}
