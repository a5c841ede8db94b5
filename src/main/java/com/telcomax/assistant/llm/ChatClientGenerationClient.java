package com.telcomax.assistant.llm;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.ollama.api.OllamaChatOptions;

/**
 * {@link GenerationClient} over a Spring AI {@link ChatClient} backed by Ollama. Temperature and
 * output budget are applied per call.
 */
public class ChatClientGenerationClient implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(ChatClientGenerationClient.class);

    private final ChatClient chatClient;
    private final String model;
    private final Timer timer;

    public ChatClientGenerationClient(
            ChatClient chatClient,
            String model,
            String purpose,
            MeterRegistry meterRegistry) {
        this.chatClient = chatClient;
        this.model = model;
        this.timer = Timer.builder("assistant.generation.duration")
                .description("Generation model call duration")
                .tag("purpose", purpose)
                .register(meterRegistry);
    }

    @Override
    public String complete(String prompt, double temperature, int maxOutputTokens) {
        return complete(null, prompt, temperature, maxOutputTokens);
    }

    @Override
    public String complete(String system, String prompt, double temperature, int maxOutputTokens) {
        OllamaChatOptions options = OllamaChatOptions.builder()
                .model(model)
                .temperature(temperature)
                .numPredict(maxOutputTokens)
                .build();

        long startNanos = System.nanoTime();
        String content;
        try {
            ChatClient.ChatClientRequestSpec request = chatClient.prompt().options(options);
            if (system != null && !system.isBlank()) {
                request = request.system(s -> s.text(system));
            }
            content = request.user(u -> u.text(prompt)).call().content();
        } catch (RuntimeException e) {
            throw new GenerationException("Generation call failed model=" + model, e);
        } finally {
            long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
            timer.record(durationMs, TimeUnit.MILLISECONDS);
            log.debug("LLM call completed model={} durationMs={}", model, durationMs);
        }

        if (content == null || content.isBlank()) {
            throw new GenerationException("Generation returned empty content model=" + model);
        }
        return content;
    }
}
