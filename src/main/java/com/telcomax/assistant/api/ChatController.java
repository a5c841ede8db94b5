package com.telcomax.assistant.api;

import com.telcomax.assistant.agent.TurnOrchestrator;
import com.telcomax.assistant.model.TurnResult;
import com.telcomax.assistant.retrieval.RetrievalStrategy;
import com.telcomax.assistant.retrieval.RetrievalStrategyFactory;
import com.telcomax.assistant.retrieval.RetrievalStrategyType;
import java.util.UUID;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/chat")
public class ChatController {

  private final TurnOrchestrator orchestrator;
  private final RetrievalStrategyFactory strategies;
  private final RetrievalStrategyType defaultStrategy;

  public ChatController(
      TurnOrchestrator orchestrator,
      RetrievalStrategyFactory strategies,
      RetrievalStrategyType defaultStrategy) {
    this.orchestrator = orchestrator;
    this.strategies = strategies;
    this.defaultStrategy = defaultStrategy;
  }

  @PostMapping
  public TurnResult chat(@RequestBody ChatRequest req) {
    if (req.question() == null || req.question().isBlank()) {
      throw new IllegalArgumentException("question must not be blank");
    }
    String sessionId = req.sessionId();
    if (sessionId == null || sessionId.isBlank()) {
      sessionId = UUID.randomUUID().toString();
    }

    RetrievalStrategy retrieval = req.strategy() == null || req.strategy().isBlank()
        ? strategies.create(defaultStrategy)
        : strategies.create(req.strategy());

    return orchestrator.handle(sessionId, req.question(), retrieval);
  }
}
