package com.telcomax.assistant.api;

/**
 * @param sessionId optional; a new session is started when absent
 * @param strategy optional retrieval strategy name (direct, hyde, multi-query)
 */
public record ChatRequest(String sessionId, String question, String strategy) {}
