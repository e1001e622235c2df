package com.marketpulse.service.assistant;

import lombok.Value;

/** One chat turn sent to a language model. */
@Value
public class LlmMessage {
    String role;
    String content;

    public static LlmMessage system(String content) {
        return new LlmMessage("system", content);
    }

    public static LlmMessage user(String content) {
        return new LlmMessage("user", content);
    }
}
