package com.telcomax.assistant.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.telcomax.assistant.agent.TurnOrchestrator;
import com.telcomax.assistant.agent.TurnState;
import com.telcomax.assistant.model.IntentLabel;
import com.telcomax.assistant.model.ResponderType;
import com.telcomax.assistant.model.TurnResult;
import com.telcomax.assistant.rag.InMemoryVectorIndex;
import com.telcomax.assistant.retrieval.RetrievalStrategyFactory;
import com.telcomax.assistant.retrieval.RetrievalStrategyType;
import com.telcomax.assistant.retrieval.VectorSearch;
import com.telcomax.assistant.support.FakeGenerationClient;
import com.telcomax.assistant.support.HashingEmbedder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

public class ChatControllerTest {

  private TurnOrchestrator orchestrator;
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    orchestrator = mock(TurnOrchestrator.class);
    RetrievalStrategyFactory strategies = new RetrievalStrategyFactory(
        new VectorSearch(new HashingEmbedder(), new InMemoryVectorIndex(), new SimpleMeterRegistry()),
        FakeGenerationClient.replying("unused"));
    mvc = MockMvcBuilders
        .standaloneSetup(new ChatController(orchestrator, strategies, RetrievalStrategyType.DIRECT))
        .setControllerAdvice(new ApiExceptionAdvice())
        .build();
  }

  @Test
  void questionIsHandledWithTheRequestedStrategy() throws Exception {
    when(orchestrator.handle(anyString(), anyString(), any())).thenReturn(new TurnResult(
        "abc", TurnState.APPROVED, IntentLabel.GENERAL_KNOWLEDGE, ResponderType.GENERAL_KNOWLEDGE,
        "AT&T was founded on March 3, 1885.", List.of(), List.of(), List.of("ROUTING -> general_knowledge")));

    mvc.perform(post("/chat")
            .contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"sessionId": "abc", "question": "When was AT&T founded?", "strategy": "multi-query"}
                """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("APPROVED"))
        .andExpect(jsonPath("$.response").value("AT&T was founded on March 3, 1885."))
        .andExpect(jsonPath("$.trace[0]").value("ROUTING -> general_knowledge"));

    verify(orchestrator).handle(eq("abc"), eq("When was AT&T founded?"),
        argThat(r -> r.type() == RetrievalStrategyType.MULTI_QUERY));
  }

  @Test
  void blankQuestionIsABadRequest() throws Exception {
    mvc.perform(post("/chat")
            .contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"sessionId": "abc", "question": "  "}
                """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("bad_request"))
        .andExpect(jsonPath("$.message").value("question must not be blank"));

    verifyNoInteractions(orchestrator);
  }

  @Test
  void unknownStrategyIsABadRequest() throws Exception {
    mvc.perform(post("/chat")
            .contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"question": "What is my bill?", "strategy": "bm25"}
                """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.path").value("/chat"));

    verifyNoInteractions(orchestrator);
  }
}
