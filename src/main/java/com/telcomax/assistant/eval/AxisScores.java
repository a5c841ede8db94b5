package com.telcomax.assistant.eval;

/**
 * Judge scores for one answer, each clamped to [0,1].
 */
public record AxisScores(double faithfulness, double relevancy, double correctness) {

    public AxisScores {
        faithfulness = clamp(faithfulness);
        relevancy = clamp(relevancy);
        correctness = clamp(correctness);
    }

    public double composite() {
        return (faithfulness + relevancy + correctness) / 3.0;
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }
}
