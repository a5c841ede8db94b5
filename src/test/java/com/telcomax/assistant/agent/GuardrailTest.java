package com.telcomax.assistant.agent;

import static org.junit.jupiter.api.Assertions.*;

import com.telcomax.assistant.memory.Entity;
import com.telcomax.assistant.memory.EntityType;
import com.telcomax.assistant.memory.Session;
import com.telcomax.assistant.model.ResponderType;
import com.telcomax.assistant.retrieval.ScoredChunk;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

public class GuardrailTest {

  private static final Session ANONYMOUS = Session.empty("s-1", Instant.EPOCH);
  private static final Session WITH_ACCOUNT = new Session("s-2", Instant.EPOCH, List.of(),
      List.of(new Entity(EntityType.ACCOUNT_ID, "ACC-DEMO-001", 0.95)));

  private static final List<ScoredChunk> CHUNKS = List.of(
      new ScoredChunk("plans", "chunk_0", "Unlimited Plus is $55.00 per line", 0.8));

  @Nested
  class General {

    private final GeneralGuardrail guardrail = new GeneralGuardrail();

    @Test
    void plainAnswerPassesWithoutCitations() {
      Draft draft = Draft.answer(ResponderType.GENERAL_KNOWLEDGE, "AT&T was founded in 1885.", CHUNKS);

      GuardrailVerdict verdict = guardrail.check(draft, WITH_ACCOUNT);

      assertEquals(GuardrailVerdict.Outcome.PASS, verdict.outcome());
      assertEquals("AT&T was founded in 1885.", verdict.response().answer());
      assertTrue(verdict.response().citations().isEmpty());
      assertEquals(0.8, verdict.response().confidence());
    }

    @Test
    void publishedPriceIsFineWithoutAnAccount() {
      Draft draft = Draft.answer(ResponderType.GENERAL_KNOWLEDGE, "Unlimited Plus is $55.00 per line.", CHUNKS);

      assertEquals(GuardrailVerdict.Outcome.PASS, guardrail.check(draft, ANONYMOUS).outcome());
    }

    @Test
    void amountWithAnAccountInSessionIsRerouted() {
      Draft draft = Draft.answer(ResponderType.GENERAL_KNOWLEDGE, "Your bill is probably $137.14.", CHUNKS);

      GuardrailVerdict verdict = guardrail.check(draft, WITH_ACCOUNT);

      assertEquals(GuardrailVerdict.Outcome.REROUTE, verdict.outcome());
      assertNull(verdict.response());
    }

    @Test
    void escalationIsRerouted() {
      Draft draft = Draft.escalation(ResponderType.GENERAL_KNOWLEDGE, "account identifier present in session");

      assertEquals(GuardrailVerdict.Outcome.REROUTE, guardrail.check(draft, WITH_ACCOUNT).outcome());
    }
  }

  @Nested
  class Account {

    private final AccountGuardrail guardrail = new AccountGuardrail();

    @Test
    void wellFormedJsonPasses() {
      Draft draft = Draft.answer(ResponderType.ACCOUNT_SPECIFIC, """
          {"answer": "Unlimited Plus costs $55.00 per line.",
           "citations": [{"doc_id": "plans", "chunk_id": "chunk_0", "quote": "Unlimited Plus is $55.00 per line"}]}
          """, CHUNKS);

      GuardrailVerdict verdict = guardrail.check(draft, WITH_ACCOUNT);

      assertEquals(GuardrailVerdict.Outcome.PASS, verdict.outcome());
      assertEquals(1, verdict.response().citations().size());
      assertEquals(0.8, verdict.response().confidence());
    }

    @Test
    void malformedJsonAsksForRegeneration() {
      Draft draft = Draft.answer(ResponderType.ACCOUNT_SPECIFIC, "Sure! Your bill is $137.14.", CHUNKS);

      GuardrailVerdict verdict = guardrail.check(draft, WITH_ACCOUNT);

      assertEquals(GuardrailVerdict.Outcome.REGENERATE, verdict.outcome());
      assertNotNull(verdict.reason());
    }

    @Test
    void notFoundPassesAsAnUncitedAnswer() {
      Draft draft = Draft.notFound(ResponderType.ACCOUNT_SPECIFIC, AccountResponder.NOT_FOUND_ANSWER);

      GuardrailVerdict verdict = guardrail.check(draft, WITH_ACCOUNT);

      assertEquals(GuardrailVerdict.Outcome.PASS, verdict.outcome());
      assertTrue(verdict.response().citations().isEmpty());
      assertEquals(0.0, verdict.response().confidence());
    }

    @Test
    void escalationIsRerouted() {
      Draft draft = Draft.escalation(ResponderType.ACCOUNT_SPECIFIC, "not an account question");

      assertEquals(GuardrailVerdict.Outcome.REROUTE, guardrail.check(draft, ANONYMOUS).outcome());
    }
  }
}
