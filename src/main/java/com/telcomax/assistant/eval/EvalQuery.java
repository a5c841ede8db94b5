package com.telcomax.assistant.eval;

public record EvalQuery(String id, String query, String groundTruth) {}
