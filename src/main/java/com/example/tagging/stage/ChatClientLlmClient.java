package com.example.tagging.stage;

import com.example.tagging.config.TaggingProperties;
import com.example.tagging.model.RawModelOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * {@link LlmClient} backed by a Spring AI {@link ChatClient}, with retry and linear backoff.
 * <p>
 * Every failed attempt (transport error, empty content) is retried up to
 * {@code tagging.llm.max-retries} times; after that an {@link UpstreamException} is thrown.
 */
@Service
public class ChatClientLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(ChatClientLlmClient.class);

    private final ChatClient chatClient;
    private final String systemPrompt;
    private final int maxRetries;
    private final long backoffMs;

    public ChatClientLlmClient(@Qualifier("taggingChatClient") ChatClient chatClient,
                               TaggingProperties properties) {
        this.chatClient = chatClient;
        this.systemPrompt = properties.llm().systemPrompt();
        this.maxRetries = properties.llm().maxRetries();
        this.backoffMs = properties.llm().retryBackoffMs();
    }

    @Override
    public RawModelOutput complete(String prompt, double temperature, int maxTokens) {
        ChatOptions options = ChatOptions.builder()
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();

        Exception lastError = null;
        for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
            try {
                ChatResponse chatResponse = chatClient.prompt()
                        .system(systemPrompt)
                        .user(prompt)
                        .options(options)
                        .call()
                        .chatResponse();
                return toOutput(chatResponse);
            } catch (Exception e) {
                lastError = e;
                if (attempt <= maxRetries) {
                    long delay = attempt * backoffMs;
                    log.warn("LLM call: attempt {}/{} failed ({}), retrying in {}ms...",
                            attempt, maxRetries + 1, rootCauseMessage(e), delay);
                    try {
                        Thread.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new UpstreamException("Interrupted while waiting to retry the LLM call", ie);
                    }
                }
            }
        }
        throw new UpstreamException("LLM call failed after " + (maxRetries + 1)
                + " attempts: " + rootCauseMessage(lastError), lastError);
    }

    private RawModelOutput toOutput(ChatResponse chatResponse) {
        Generation result = chatResponse != null ? chatResponse.getResult() : null;
        String content = result != null && result.getOutput() != null ? result.getOutput().getText() : null;
        if (content == null || content.isBlank()) {
            throw new IllegalStateException("Empty or null content in LLM response");
        }

        long tokens = 0L;
        String model = null;
        ChatResponseMetadata metadata = chatResponse.getMetadata();
        if (metadata != null) {
            model = metadata.getModel();
            Usage usage = metadata.getUsage();
            if (usage != null && usage.getTotalTokens() != null) {
                tokens = usage.getTotalTokens().longValue();
            }
        }
        String finishReason = result.getMetadata() != null ? result.getMetadata().getFinishReason() : null;
        log.debug("LLM call: {} tokens (model={}, finish={})", tokens, model, finishReason);
        return new RawModelOutput(content, tokens, model, finishReason);
    }

    private static String rootCauseMessage(Throwable e) {
        if (e == null) return "unknown error";
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
