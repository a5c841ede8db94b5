package com.telcomax.assistant.llm;

/**
 * Narrow seam over a text-generation model.
 */
public interface GenerationClient {

    /**
     * @throws GenerationException when the model call fails or times out
     */
    String complete(String prompt, double temperature, int maxOutputTokens);

    default String complete(String system, String prompt, double temperature, int maxOutputTokens) {
        if (system == null || system.isBlank()) {
            return complete(prompt, temperature, maxOutputTokens);
        }
        return complete(system + "\n\n" + prompt, temperature, maxOutputTokens);
    }
}
