package com.telcomax.assistant.eval;

/**
 * Aggregate of one (chunk, retrieval) pair over its successful cells. {@code variance} is the
 * population variance of the three axis means.
 */
public record PairSummary(
        PairKey pair,
        double faithfulness,
        double relevancy,
        double correctness,
        int cells
) {

    public double composite() {
        return (faithfulness + relevancy + correctness) / 3.0;
    }

    public double variance() {
        double mean = composite();
        double f = faithfulness - mean;
        double r = relevancy - mean;
        double c = correctness - mean;
        return (f * f + r * r + c * c) / 3.0;
    }
}
