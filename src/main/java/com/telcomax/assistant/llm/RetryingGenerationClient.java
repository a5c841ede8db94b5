package com.telcomax.assistant.llm;

import io.github.resilience4j.retry.Retry;

/**
 * Retries {@link GenerationException}s with the backoff configured on the supplied {@link Retry};
 * the last failure propagates once attempts are exhausted.
 */
public class RetryingGenerationClient implements GenerationClient {

    private final GenerationClient delegate;
    private final Retry retry;

    public RetryingGenerationClient(GenerationClient delegate, Retry retry) {
        this.delegate = delegate;
        this.retry = retry;
    }

    @Override
    public String complete(String prompt, double temperature, int maxOutputTokens) {
        return retry.executeSupplier(() -> delegate.complete(prompt, temperature, maxOutputTokens));
    }

    @Override
    public String complete(String system, String prompt, double temperature, int maxOutputTokens) {
        return retry.executeSupplier(
                () -> delegate.complete(system, prompt, temperature, maxOutputTokens));
    }
}
