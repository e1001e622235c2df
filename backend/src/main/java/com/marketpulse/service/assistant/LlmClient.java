package com.marketpulse.service.assistant;

import java.util.List;

/** Synchronous chat completion against some language model. */
public interface LlmClient {

    /**
     * Sends the conversation and returns the model's reply as plain text.
     *
     * @throws LlmException when the model cannot be reached or answers with an error
     */
    String complete(List<LlmMessage> messages);

    String modelId();
}
