package com.telcomax.assistant.llm;

import static org.junit.jupiter.api.Assertions.*;

import com.telcomax.assistant.support.FakeGenerationClient;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

public class RetryingGenerationClientTest {

  private final Retry retry = Retry.of("generation-test", RetryConfig.custom()
      .maxAttempts(3)
      .waitDuration(Duration.ofMillis(1))
      .retryExceptions(GenerationException.class)
      .build());

  @Test
  void transientFailureIsRetried() {
    AtomicInteger attempts = new AtomicInteger();
    FakeGenerationClient delegate = new FakeGenerationClient(call -> {
      if (attempts.incrementAndGet() < 3) {
        throw new GenerationException("timeout");
      }
      return "account_specific";
    });

    String reply = new RetryingGenerationClient(delegate, retry).complete("system", "prompt", 0.0, 10);

    assertEquals("account_specific", reply);
    assertEquals(3, delegate.calls().size());
    assertEquals("system", delegate.calls().get(2).system());
  }

  @Test
  void lastFailurePropagatesWhenAttemptsAreExhausted() {
    FakeGenerationClient delegate = FakeGenerationClient.failing(new GenerationException("model down"));

    GenerationException e = assertThrows(GenerationException.class,
        () -> new RetryingGenerationClient(delegate, retry).complete("prompt", 0.0, 10));

    assertEquals("model down", e.getMessage());
    assertEquals(3, delegate.calls().size());
  }

  @Test
  void otherFailuresAreNotRetried() {
    FakeGenerationClient delegate = FakeGenerationClient.failing(new IllegalArgumentException("bad prompt"));

    assertThrows(IllegalArgumentException.class,
        () -> new RetryingGenerationClient(delegate, retry).complete("prompt", 0.0, 10));
    assertEquals(1, delegate.calls().size());
  }
}
