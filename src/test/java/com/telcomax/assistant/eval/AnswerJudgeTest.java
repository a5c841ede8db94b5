package com.telcomax.assistant.eval;

import static org.junit.jupiter.api.Assertions.*;

import com.telcomax.assistant.support.FakeGenerationClient;
import java.util.List;
import org.junit.jupiter.api.Test;

public class AnswerJudgeTest {

  @Test
  void scoresAreReadFromTheFirstJsonObject() {
    AxisScores scores = AnswerJudge.parse("""
        Sure, here you go:
        {"faithfulness": 1.0, "relevancy": 0.5, "correctness": 0.25}
        """);

    assertEquals(1.0, scores.faithfulness());
    assertEquals(0.5, scores.relevancy());
    assertEquals(0.25, scores.correctness());
  }

  @Test
  void outOfRangeScoresAreClamped() {
    AxisScores scores = AnswerJudge.parse("{\"faithfulness\": 7, \"relevancy\": 0.5, \"correctness\": -1}");

    assertEquals(1.0, scores.faithfulness());
    assertEquals(0.0, scores.correctness());
  }

  @Test
  void missingOrNonNumericAxisIsRejected() {
    assertThrows(EvaluationException.class,
        () -> AnswerJudge.parse("{\"faithfulness\": 1.0, \"relevancy\": 0.5}"));
    assertThrows(EvaluationException.class,
        () -> AnswerJudge.parse("{\"faithfulness\": \"high\", \"relevancy\": 0.5, \"correctness\": 0.5}"));
    assertThrows(EvaluationException.class, () -> AnswerJudge.parse("no json here"));
  }

  @Test
  void judgePromptCarriesQuestionContextAnswerAndTruth() {
    FakeGenerationClient client =
        FakeGenerationClient.replying("{\"faithfulness\": 1, \"relevancy\": 1, \"correctness\": 1}");

    new AnswerJudge(client).score("What is my total?", "It is $137.14.",
        List.of("ctx one", "ctx two", "ctx three", "ctx four", "ctx five"), "$137.14");

    FakeGenerationClient.Call call = client.calls().get(0);
    assertEquals(0.0, call.temperature());
    assertEquals(100, call.maxOutputTokens());
    assertTrue(call.prompt().contains("QUESTION: What is my total?"));
    assertTrue(call.prompt().contains("ctx four"));
    assertFalse(call.prompt().contains("ctx five"));
    assertTrue(call.prompt().contains("GROUND TRUTH:\n$137.14"));
  }

  @Test
  void emptyContextIsStatedExplicitly() {
    FakeGenerationClient client =
        FakeGenerationClient.replying("{\"faithfulness\": 0, \"relevancy\": 0, \"correctness\": 0}");

    new AnswerJudge(client).score("q", "a", List.of(), "t");

    assertTrue(client.calls().get(0).prompt().contains("No context was retrieved."));
  }
}
