package com.telcomax.assistant.config;

import com.telcomax.assistant.llm.GenerationException;
import com.telcomax.assistant.retrieval.RetrievalException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry policies with exponential backoff and event logging.
 */
@Configuration
public class ResilienceConfig {

  private static final Logger log = LoggerFactory.getLogger(ResilienceConfig.class);

  @Bean
  public Retry generationRetry(
      @Value("${app.generation.max-attempts:3}") int maxAttempts,
      @Value("${app.generation.initial-backoff:PT0.5S}") Duration initialBackoff) {
    RetryConfig config = RetryConfig.custom()
        .maxAttempts(maxAttempts)
        .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, 2.0))
        .retryExceptions(GenerationException.class)
        .build();
    return withEventLogging(Retry.of("generation", config));
  }

  /**
   * Cell-level retry for transient backend failures only. Judge parse errors and argument errors
   * fail the cell on the first attempt.
   */
  @Bean
  public Retry evaluationCellRetry(
      @Value("${app.eval.max-attempts:3}") int maxAttempts,
      @Value("${app.eval.initial-backoff:PT1S}") Duration initialBackoff) {
    RetryConfig config = RetryConfig.custom()
        .maxAttempts(maxAttempts)
        .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, 2.0))
        .retryExceptions(GenerationException.class, RetrievalException.class)
        .build();
    return withEventLogging(Retry.of("evaluationCell", config));
  }

  static Retry withEventLogging(Retry retry) {
    retry.getEventPublisher()
        .onRetry(event ->
            log.warn("Retrying name={} attempt={} reason={}",
                retry.getName(),
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()))
        .onError(event ->
            log.error("Retries exhausted name={} attempts={}",
                retry.getName(), event.getNumberOfRetryAttempts()));
    return retry;
  }
}
