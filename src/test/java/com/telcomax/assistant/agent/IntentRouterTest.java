package com.telcomax.assistant.agent;

import static org.junit.jupiter.api.Assertions.*;

import com.telcomax.assistant.llm.GenerationException;
import com.telcomax.assistant.memory.ConversationTurn;
import com.telcomax.assistant.model.IntentLabel;
import com.telcomax.assistant.model.ResponderType;
import com.telcomax.assistant.support.FakeGenerationClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

public class IntentRouterTest {

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

  @Test
  void generalQuestionIsLabelledGeneral() {
    FakeGenerationClient client = FakeGenerationClient.replying("general_knowledge");

    IntentLabel intent = new IntentRouter(client, meterRegistry).classify("When was AT&T founded?", List.of());

    assertEquals(IntentLabel.GENERAL_KNOWLEDGE, intent);
    FakeGenerationClient.Call call = client.calls().get(0);
    assertEquals(0.0, call.temperature());
    assertEquals(20, call.maxOutputTokens());
    assertTrue(call.prompt().contains("\"When was AT&T founded?\""));
    assertFalse(call.prompt().contains("Recent conversation"));
  }

  @Test
  void decoratedLabelIsAccepted() {
    FakeGenerationClient client = FakeGenerationClient.replying("  \"Account_Specific\".\n");

    assertEquals(IntentLabel.ACCOUNT_SPECIFIC,
        new IntentRouter(client, meterRegistry).classify("What's my bill?", List.of()));
  }

  @Test
  void unusableLabelIsRetriedOnce() {
    FakeGenerationClient client = FakeGenerationClient.replying("billing", "general_knowledge");

    assertEquals(IntentLabel.GENERAL_KNOWLEDGE,
        new IntentRouter(client, meterRegistry).classify("What plans do you offer?", List.of()));
    assertEquals(2, client.calls().size());
    assertEquals(0.0, meterRegistry.counter("assistant.router.fallback").count());
  }

  @Test
  void twoUnusableLabelsDefaultToAccountSpecific() {
    FakeGenerationClient client = FakeGenerationClient.replying("I think this is about billing");

    assertEquals(IntentLabel.ACCOUNT_SPECIFIC,
        new IntentRouter(client, meterRegistry).classify("hmm", List.of()));
    assertEquals(2, client.calls().size());
    assertEquals(1.0, meterRegistry.counter("assistant.router.fallback").count());
  }

  @Test
  void recentTurnsAreIncludedInThePrompt() {
    FakeGenerationClient client = FakeGenerationClient.replying("account_specific");
    Instant at = Instant.parse("2026-01-15T10:00:00Z");
    List<ConversationTurn> turns = List.of(
        ConversationTurn.user("What is my bill for January 2026?", at),
        ConversationTurn.system("Your January 2026 bill is $137.14.", at, ResponderType.ACCOUNT_SPECIFIC));

    new IntentRouter(client, meterRegistry).classify("Why is it so high?", turns);

    String prompt = client.calls().get(0).prompt();
    assertTrue(prompt.contains("Recent conversation:"));
    assertTrue(prompt.contains("user: What is my bill for January 2026?"));
    assertTrue(prompt.contains("system: Your January 2026 bill is $137.14."));
  }

  @Test
  void modelFailureIsNotMistakenForABadLabel() {
    FakeGenerationClient client = FakeGenerationClient.failing(new GenerationException("timeout"));

    assertThrows(GenerationException.class,
        () -> new IntentRouter(client, meterRegistry).classify("What's my bill?", List.of()));
    assertEquals(1, client.calls().size());
  }

  @Test
  void labelParsingIsStrict() {
    assertThrows(ClassificationException.class, () -> IntentLabel.parse("general"));
    assertThrows(ClassificationException.class, () -> IntentLabel.parse(null));
    assertEquals(ResponderType.ACCOUNT_SPECIFIC, ResponderType.forIntent(IntentLabel.ACCOUNT_SPECIFIC));
  }
}
