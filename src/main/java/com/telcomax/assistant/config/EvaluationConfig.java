package com.telcomax.assistant.config;

import com.telcomax.assistant.eval.AnswerJudge;
import com.telcomax.assistant.eval.EvaluationHarness;
import com.telcomax.assistant.eval.EvaluationService;
import com.telcomax.assistant.eval.EvaluationSettings;
import com.telcomax.assistant.eval.ReportWriter;
import com.telcomax.assistant.llm.GenerationClient;
import com.telcomax.assistant.rag.ChunkStrategyFactory;
import com.telcomax.assistant.rag.CorpusIngestor;
import com.telcomax.assistant.retrieval.RetrievalStrategyFactory;
import io.github.resilience4j.retry.Retry;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.io.Resource;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class EvaluationConfig {

  @Bean
  public EvaluationSettings evaluationSettings(
      @Value("${app.eval.namespace-prefix:eval-}") String namespacePrefix,
      @Value("${app.retrieval.top-k:4}") int topK,
      @Value("${app.namespaces.reference:telecom-wiki}") String referenceNamespace,
      @Value("${app.namespaces.customer:customer-docs}") String customerNamespace) {
    EvaluationSettings settings =
        new EvaluationSettings(namespacePrefix, topK, Set.of(referenceNamespace, customerNamespace));
    settings.checkIsolation();
    return settings;
  }

  @Bean(name = "evaluationExecutor")
  public ThreadPoolTaskExecutor evaluationExecutor(@Value("${app.eval.workers:4}") int workers) {
    if (workers <= 0) {
      throw new IllegalStateException("app.eval.workers must be positive: " + workers);
    }
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers);
    executor.setQueueCapacity(1000);
    executor.setThreadNamePrefix("eval-cell-");
    // a full queue makes the submitting thread run the cell
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }

  @Bean
  @Lazy
  public EvaluationHarness evaluationHarness(
      CorpusIngestor ingestor,
      ChunkStrategyFactory chunkStrategies,
      RetrievalStrategyFactory retrievalStrategies,
      @Qualifier("answerGenerationClient") GenerationClient answerClient,
      @Qualifier("evaluationExecutor") ThreadPoolTaskExecutor executor,
      @Qualifier("evaluationCellRetry") Retry cellRetry,
      EvaluationSettings settings) {
    return new EvaluationHarness(ingestor, chunkStrategies, retrievalStrategies, answerClient,
        new AnswerJudge(answerClient), executor, cellRetry, settings);
  }

  @Bean
  @Lazy
  public EvaluationService evaluationService(
      @Lazy EvaluationHarness harness,
      CorpusIngestor ingestor,
      Clock clock,
      @Value("${app.eval.output-dir:evaluation_results}") String outputDir,
      @Value("${app.eval.queries:classpath:/eval/eval_queries.txt}") Resource queries,
      @Value("${app.eval.corpus-pattern:classpath:/docs/customer/*.txt}") String corpusPattern) {
    return new EvaluationService(harness, ingestor, new ReportWriter(Path.of(outputDir), clock), queries, corpusPattern);
  }
}
