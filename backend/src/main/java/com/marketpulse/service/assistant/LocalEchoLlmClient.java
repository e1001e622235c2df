package com.marketpulse.service.assistant;

import java.util.List;

/**
 * Offline stand-in used when no API key is configured. Answers with a fixed
 * notice that quotes the last user message, so the endpoints stay usable.
 */
public class LocalEchoLlmClient implements LlmClient {

    static final String NOTICE = "AI assistant is offline (no marketpulse.llm.api-key configured).";

    @Override
    public String complete(List<LlmMessage> messages) {
        String last = "";
        for (LlmMessage m : messages) {
            if ("user".equals(m.getRole())) {
                last = m.getContent();
            }
        }
        return last.isBlank() ? NOTICE : NOTICE + " You asked: " + last.strip();
    }

    @Override
    public String modelId() {
        return "local-echo";
    }
}
