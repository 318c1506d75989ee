package com.example.tagging.config;

import com.example.tagging.registry.TagRuleLoader;
import com.example.tagging.registry.TagRuleRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Beans shared by the pipeline: the chat client, the tag registry, the worker pool and JSON mapping.
 */
@Configuration
public class AiConfig {

    /**
     * ChatClient used by the LLM stage (OpenAI).
     */
    @Bean("taggingChatClient")
    public ChatClient taggingChatClient(OpenAiChatModel openAiChatModel) {
        return ChatClient.builder(openAiChatModel).build();
    }

    /**
     * Tag registry, loaded once from the rules file and never modified afterwards.
     */
    @Bean
    public TagRuleRegistry tagRuleRegistry(TaggingProperties properties) {
        TaggingProperties.Data data = properties.data();
        return TagRuleLoader.load(Path.of(data.dir()).resolve(data.tagRulesFile()));
    }

    /**
     * Worker pool for batch and dataset processing above the batch size threshold.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService agentExecutor(TaggingProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "tagging-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(properties.evaluation().parallelism(), factory);
    }

    /**
     * ObjectMapper shared for JSON serialization.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
