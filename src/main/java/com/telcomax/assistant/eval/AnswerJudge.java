package com.telcomax.assistant.eval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telcomax.assistant.llm.GenerationClient;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grades an answer against the retrieved context and the ground truth with a generation model.
 */
public class AnswerJudge {

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{.*}", Pattern.DOTALL);
    private static final int MAX_CONTEXTS = 4;

    private static final String JUDGE_PROMPT = """
            You are evaluating a RAG system response. Score the following on 3 metrics (0.0 to 1.0):

            QUESTION: %s

            RETRIEVED CONTEXT:
            %s

            ANSWER GIVEN:
            %s

            GROUND TRUTH:
            %s

            Evaluate and respond with ONLY a JSON object:
            {
              "faithfulness": <0.0-1.0, is the answer grounded in the retrieved context only?>,
              "relevancy": <0.0-1.0, does the answer directly address the question?>,
              "correctness": <0.0-1.0, how well does the answer match the ground truth?>
            }
            """;

    private final GenerationClient judgeClient;

    public AnswerJudge(GenerationClient judgeClient) {
        this.judgeClient = judgeClient;
    }

    public AxisScores score(String query, String answer, List<String> contexts, String groundTruth) {
        String context = contexts.isEmpty()
                ? "No context was retrieved."
                : String.join("\n\n", contexts.subList(0, Math.min(MAX_CONTEXTS, contexts.size())));
        String raw = judgeClient.complete(
                JUDGE_PROMPT.formatted(query, context, answer, groundTruth), 0.0, 100);
        return parse(raw);
    }

    static AxisScores parse(String raw) {
        Matcher m = JSON_OBJECT.matcher(raw == null ? "" : raw);
        if (!m.find()) {
            throw new EvaluationException("Judge returned no JSON object");
        }
        JsonNode node;
        try {
            node = mapper.readTree(m.group());
        } catch (Exception e) {
            throw new EvaluationException("Judge returned invalid JSON", e);
        }
        return new AxisScores(axis(node, "faithfulness"), axis(node, "relevancy"), axis(node, "correctness"));
    }

    private static double axis(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || !value.isNumber()) {
            throw new EvaluationException("Judge JSON missing numeric " + name);
        }
        return value.asDouble();
    }
}
