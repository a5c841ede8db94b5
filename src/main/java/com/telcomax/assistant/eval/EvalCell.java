package com.telcomax.assistant.eval;

/**
 * Outcome of one (chunk, retrieval, query) run: either scores or a failure message.
 */
public record EvalCell(CellKey key, AxisScores scores, String answer, String failure) {

    public static EvalCell succeeded(CellKey key, AxisScores scores, String answer) {
        return new EvalCell(key, scores, answer, null);
    }

    public static EvalCell failed(CellKey key, String failure) {
        return new EvalCell(key, null, null, failure == null ? "unknown failure" : failure);
    }

    public boolean isFailed() {
        return failure != null;
    }
}
