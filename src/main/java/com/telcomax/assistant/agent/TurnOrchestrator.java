package com.telcomax.assistant.agent;

import com.telcomax.assistant.llm.GenerationException;
import com.telcomax.assistant.memory.ConversationTurn;
import com.telcomax.assistant.memory.EntityExtractor;
import com.telcomax.assistant.memory.Session;
import com.telcomax.assistant.memory.SessionMemory;
import com.telcomax.assistant.model.AgentResponse;
import com.telcomax.assistant.model.Citation;
import com.telcomax.assistant.model.IntentLabel;
import com.telcomax.assistant.model.ResponderType;
import com.telcomax.assistant.model.TurnResult;
import com.telcomax.assistant.model.ValidationResult;
import com.telcomax.assistant.retrieval.RetrievalException;
import com.telcomax.assistant.retrieval.RetrievalStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Runs one customer turn through the state machine
 * {@code ROUTING -> MEMORY_MERGE -> DISPATCH -> GUARDRAIL_CHECK -> [REROUTE -> DISPATCH] ->
 * VALIDATE -> APPROVED | REJECTED}, with {@code ERROR} reachable from any state on an
 * unrecoverable collaborator failure.
 *
 * <p>Both the user message and the final reply are appended to the session once the turn has
 * reached a terminal state, whichever it is.
 */
@Service
public class TurnOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TurnOrchestrator.class);

    static final int MAX_REROUTES = 1;
    static final int ROUTER_HISTORY_TURNS = 4;
    static final int MAX_SESSION_ID_LENGTH = 128;

    static final String GENERATION_FAILURE_RESPONSE =
            "I'm sorry, I'm having trouble answering right now. "
                    + "Would you like me to connect you with a support agent?";
    static final String RETRIEVAL_FAILURE_RESPONSE =
            "I'm sorry, I can't reach our reference information right now. "
                    + "Would you like me to connect you with a support agent?";
    static final String SAFE_RESPONSE =
            "I'm sorry, I can't help with that request right now. "
                    + "Please contact TelcoMax support for assistance.";

    private final IntentRouter router;
    private final SessionMemory sessionMemory;
    private final EntityExtractor entityExtractor;
    private final Map<ResponderType, DomainResponder> responders = new EnumMap<>(ResponderType.class);
    private final Map<ResponderType, Guardrail> guardrails = new EnumMap<>(ResponderType.class);
    private final ResponseValidator validator;
    private final int topK;
    private final int maxQueryChars;
    private final Clock clock;
    private final Map<TurnState, Timer> stateTimers = new EnumMap<>(TurnState.class);
    private final MeterRegistry meterRegistry;

    public TurnOrchestrator(
            IntentRouter router,
            SessionMemory sessionMemory,
            EntityExtractor entityExtractor,
            List<DomainResponder> responders,
            List<Guardrail> guardrails,
            ResponseValidator validator,
            @Value("${app.retrieval.top-k:4}") int topK,
            @Value("${app.chat.max-query-chars:4000}") int maxQueryChars,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.router = router;
        this.sessionMemory = sessionMemory;
        this.entityExtractor = entityExtractor;
        this.validator = validator;
        this.topK = topK;
        this.maxQueryChars = maxQueryChars;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        for (DomainResponder responder : responders) {
            this.responders.put(responder.type(), responder);
        }
        for (Guardrail guardrail : guardrails) {
            this.guardrails.put(guardrail.responder(), guardrail);
        }
        for (ResponderType type : ResponderType.values()) {
            if (!this.responders.containsKey(type) || !this.guardrails.containsKey(type)) {
                throw new IllegalStateException("Missing responder or guardrail for " + type);
            }
        }
        if (topK <= 0) {
            throw new IllegalStateException("app.retrieval.top-k must be positive: " + topK);
        }
        if (maxQueryChars <= 0) {
            throw new IllegalStateException("app.chat.max-query-chars must be positive: " + maxQueryChars);
        }

        for (TurnState state : TurnState.values()) {
            if (!state.terminal()) {
                stateTimers.put(state, Timer.builder("assistant.turn.state.duration")
                        .description("Time spent in one turn state")
                        .tag("state", state.name())
                        .register(meterRegistry));
            }
        }
    }

    /**
     * Main entry point. The retrieval strategy is fixed for the whole turn.
     *
     * @throws IllegalArgumentException for a blank or over-long session id or query; nothing is
     *     recorded in that case
     */
    public TurnResult handle(String sessionId, String query, RetrievalStrategy retrieval) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        if (sessionId.length() > MAX_SESSION_ID_LENGTH) {
            throw new IllegalArgumentException("sessionId longer than " + MAX_SESSION_ID_LENGTH + " characters");
        }
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (query.length() > maxQueryChars) {
            throw new IllegalArgumentException("query longer than " + maxQueryChars + " characters");
        }
        MDC.put("sessionId", sessionId);
        Turn turn = new Turn(sessionId, query, retrieval);
        try {
            run(turn);
            return turn.result();
        } finally {
            recordTurns(turn);
            Counter.builder("assistant.turn.outcome")
                    .tag("state", turn.state.name())
                    .register(meterRegistry)
                    .increment();
            MDC.remove("sessionId");
        }
    }

    private void run(Turn turn) {
        try {
            while (!turn.state.terminal()) {
                TurnState from = turn.state;
                long startNanos = System.nanoTime();
                TurnState to = step(turn);
                long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
                stateTimers.get(from).record(durationMs, TimeUnit.MILLISECONDS);
                turn.transition(to);
            }
            log.info("Turn completed state={} intent={} responder={} reroutes={}",
                    turn.state, turn.intent == null ? null : turn.intent.label(), turn.responder, turn.reroutes);
        } catch (GuardrailLoopExceededException e) {
            log.error("Guardrail loop exceeded sessionId={} trace={}", turn.sessionId, turn.trace, e);
            turn.fail(SAFE_RESPONSE);
        } catch (GenerationException e) {
            log.error("Generation failed after retries sessionId={} state={}", turn.sessionId, turn.state, e);
            turn.fail(GENERATION_FAILURE_RESPONSE);
        } catch (RetrievalException e) {
            log.error("Retrieval failed sessionId={} responder={}", turn.sessionId, turn.responder, e);
            turn.fail(RETRIEVAL_FAILURE_RESPONSE);
        }
    }

    private TurnState step(Turn turn) {
        return switch (turn.state) {
            case ROUTING -> route(turn);
            case MEMORY_MERGE -> mergeMemory(turn);
            case DISPATCH -> dispatch(turn);
            case GUARDRAIL_CHECK -> checkGuardrail(turn);
            case REROUTE -> reroute(turn);
            case VALIDATE -> validate(turn);
            default -> throw new IllegalStateException("No transition out of " + turn.state);
        };
    }

    private TurnState route(Turn turn) {
        Session session = sessionMemory.getOrCreate(turn.sessionId);
        turn.intent = router.classify(turn.query, session.recentTurns(ROUTER_HISTORY_TURNS));
        turn.responder = ResponderType.forIntent(turn.intent);
        log.info("Routed intent={}", turn.intent.label());
        return TurnState.MEMORY_MERGE;
    }

    private TurnState mergeMemory(Turn turn) {
        turn.session = sessionMemory.mergeEntities(turn.sessionId, entityExtractor.extract(turn.query));
        return TurnState.DISPATCH;
    }

    private TurnState dispatch(Turn turn) {
        ResponderContext context =
                new ResponderContext(turn.session, turn.query, turn.retrieval, topK, turn.strict);
        turn.draft = responders.get(turn.responder).draft(context);
        return TurnState.GUARDRAIL_CHECK;
    }

    private TurnState checkGuardrail(Turn turn) {
        GuardrailVerdict verdict = guardrails.get(turn.draft.responder()).check(turn.draft, turn.session);
        switch (verdict.outcome()) {
            case REROUTE:
                log.info("Guardrail requested reroute responder={} reason={}", turn.responder, verdict.reason());
                return TurnState.REROUTE;
            case REGENERATE:
                if (turn.strict) {
                    log.error("Responder output malformed after strict regeneration sessionId={} reason={}",
                            turn.sessionId, verdict.reason());
                    turn.response = null;
                    turn.text = GENERATION_FAILURE_RESPONSE;
                    return TurnState.ERROR;
                }
                turn.strict = true;
                return TurnState.DISPATCH;
            default:
                break;
        }

        turn.response = verdict.response();
        if (turn.responder == ResponderType.GENERAL_KNOWLEDGE) {
            turn.text = turn.response.answer();
            return TurnState.APPROVED;
        }
        return TurnState.VALIDATE;
    }

    private TurnState reroute(Turn turn) {
        if (turn.reroutes >= MAX_REROUTES) {
            throw new GuardrailLoopExceededException(
                    "Second reroute requested by " + turn.responder + " guardrail");
        }
        turn.reroutes++;
        turn.responder = turn.responder == ResponderType.GENERAL_KNOWLEDGE
                ? ResponderType.ACCOUNT_SPECIFIC
                : ResponderType.GENERAL_KNOWLEDGE;
        turn.strict = false;
        turn.draft = null;
        return TurnState.DISPATCH;
    }

    private TurnState validate(Turn turn) {
        ValidationResult validation = validator.validate(turn.response);
        if (validation.approved()) {
            turn.citations = turn.response.citations();
            turn.text = withSources(turn.response);
            return TurnState.APPROVED;
        }
        turn.rejectionReasons = validation.reasons();
        turn.text = ClarifyingQuestions.message(validation.reasons());
        log.info("Response rejected reasons={}", validation.reasons());
        return TurnState.REJECTED;
    }

    static String withSources(AgentResponse response) {
        StringBuilder sb = new StringBuilder(response.answer());
        if (!response.citations().isEmpty()) {
            sb.append("\n\nSources:");
            int i = 1;
            for (Citation c : response.citations()) {
                String quote = c.quote().length() > 60 ? c.quote().substring(0, 60) : c.quote();
                sb.append("\n  [").append(i++).append("] ").append(c.docId())
                        .append(": \"").append(quote).append("...\"");
            }
        }
        return sb.toString();
    }

    /**
     * A store failure here is logged and does not replace the turn's outcome.
     */
    private void recordTurns(Turn turn) {
        try {
            sessionMemory.appendTurn(turn.sessionId, ConversationTurn.user(turn.query, clock.instant()));
            if (turn.text != null) {
                sessionMemory.appendTurn(turn.sessionId,
                        ConversationTurn.system(turn.text, clock.instant(), turn.responder));
            }
        } catch (DataAccessException | IllegalStateException e) {
            log.error("Failed to record turn sessionId={} state={}", turn.sessionId, turn.state, e);
        }
    }

    /**
     * Mutable state of one turn. Confined to the calling thread.
     */
    private static final class Turn {
        final String sessionId;
        final String query;
        final RetrievalStrategy retrieval;
        final List<String> trace = new ArrayList<>();

        TurnState state = TurnState.ROUTING;
        IntentLabel intent;
        ResponderType responder;
        Session session;
        Draft draft;
        AgentResponse response;
        boolean strict;
        int reroutes;
        String text;
        List<Citation> citations = List.of();
        List<String> rejectionReasons = List.of();

        Turn(String sessionId, String query, RetrievalStrategy retrieval) {
            this.sessionId = sessionId;
            this.query = query;
            this.retrieval = retrieval;
        }

        void transition(TurnState to) {
            trace.add(state + " -> " + to);
            state = to;
        }

        void fail(String message) {
            text = message;
            citations = List.of();
            transition(TurnState.ERROR);
        }

        TurnResult result() {
            return new TurnResult(sessionId, state, intent, responder, text,
                    citations, rejectionReasons, List.copyOf(trace));
        }
    }
}
