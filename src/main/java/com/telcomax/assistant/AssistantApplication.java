package com.telcomax.assistant;

import com.telcomax.assistant.cli.ConsoleRunner;
import com.telcomax.assistant.rag.ChunkStrategyFactory;
import com.telcomax.assistant.rag.ChunkStrategyType;
import com.telcomax.assistant.rag.CorpusIngestor;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.core.annotation.Order;

@SpringBootApplication
public class AssistantApplication {

  private static final Logger log = LoggerFactory.getLogger(AssistantApplication.class);

  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(AssistantApplication.class);
    if (!ConsoleRunner.isConsoleInvocation(args)) {
      app.run(args);
      return;
    }

    app.setWebApplicationType(WebApplicationType.NONE);
    int exitCode;
    try {
      exitCode = SpringApplication.exit(app.run(args));
    } catch (RuntimeException e) {
      log.error("Startup failed: {}", e.getMessage());
      exitCode = 1;
    }
    System.exit(exitCode);
  }

  @Bean
  @Order(0)
  CommandLineRunner ingestCorpora(
      CorpusIngestor ingestor,
      ChunkStrategyFactory chunkStrategies,
      @Value("${app.rag.ingest-on-startup:false}") boolean ingestOnStartup,
      @Value("${app.rag.reference-pattern:classpath:/docs/reference/*.txt}") String referencePattern,
      @Value("${app.rag.customer-pattern:classpath:/docs/customer/*.txt}") String customerPattern,
      @Value("${app.namespaces.reference:telecom-wiki}") String referenceNamespace,
      @Value("${app.namespaces.customer:customer-docs}") String customerNamespace) {
    return args -> {
      if (!ingestOnStartup) {
        return;
      }

      try {
        int reference = ingestor.reingest(ingestor.load(referencePattern), referenceNamespace,
            chunkStrategies.create(ChunkStrategyType.FIXED_SIZE));
        int customer = ingestor.reingest(ingestor.load(customerPattern), customerNamespace,
            chunkStrategies.create(ChunkStrategyType.FIXED_SIZE));
        log.info("Ingested reference={} customer={} chunks", reference, customer);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to ingest startup corpora", e);
      }
    };
  }
}
