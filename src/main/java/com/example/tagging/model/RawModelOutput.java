package com.example.tagging.model;

/**
 * Unparsed answer of the language model.
 *
 * @param content      text content of the first generation
 * @param tokensUsed   total tokens (prompt + completion) reported by the provider
 * @param model        model that produced the answer
 * @param finishReason provider finish reason, if any
 */
public record RawModelOutput(String content, long tokensUsed, String model, String finishReason) {}
