package com.example.tagging.stage;

import com.example.tagging.model.RawModelOutput;

/**
 * Call to the hosted language model. Retry, if any, happens inside the implementation.
 */
@FunctionalInterface
public interface LlmClient {

    /**
     * @throws UpstreamException on timeout, transport error or empty response
     */
    RawModelOutput complete(String prompt, double temperature, int maxTokens);
}
