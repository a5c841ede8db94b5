package com.telcomax.assistant.agent;

import com.telcomax.assistant.llm.GenerationClient;
import com.telcomax.assistant.memory.ConversationTurn;
import com.telcomax.assistant.model.IntentLabel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Labels a query as general knowledge or account specific. Classification runs at temperature 0;
 * an unusable label is retried once and then treated as account specific.
 */
@Component
public class IntentRouter {

    private static final Logger log = LoggerFactory.getLogger(IntentRouter.class);

    static final int HISTORY_TURNS = 4;

    private static final String ROUTER_SYSTEM_PROMPT = """
            You are a query classifier for TelcoMax Wireless customer support.
            Respond with ONLY the label, nothing else.
            """;

    private static final String ROUTER_PROMPT = """
            Classify the customer query into ONE of these labels:

            general_knowledge - questions about plans, pricing, features, company facts, or
            billing processes in general (not this customer's own account)
              Examples: "What plans do you offer?", "How does proration work?", "When was AT&T founded?"

            account_specific - questions about the customer's OWN bill, charges, amounts,
            payments or account balance
              Examples: "What's my bill?", "How much do I owe?", "Why was I charged $X?"

            Use the recent conversation to resolve references like "it" or "that bill".

            %s
            Customer query: "%s"

            Label:
            """;

    private final GenerationClient routerClient;
    private final Timer routerTimer;
    private final Counter fallbackCounter;

    public IntentRouter(
            @Qualifier("routerGenerationClient") GenerationClient routerClient,
            MeterRegistry meterRegistry) {
        this.routerClient = routerClient;
        this.routerTimer = Timer.builder("assistant.router.duration")
                .description("Intent classification duration")
                .register(meterRegistry);
        this.fallbackCounter = Counter.builder("assistant.router.fallback")
                .description("Classifications defaulted after unusable labels")
                .register(meterRegistry);
    }

    public IntentLabel classify(String query, List<ConversationTurn> recentTurns) {
        String prompt = ROUTER_PROMPT.formatted(history(recentTurns), query);

        long startNanos = System.nanoTime();
        try {
            return classifyOnce(prompt);
        } catch (ClassificationException first) {
            log.warn("Unusable router label, retrying reason={}", first.getMessage());
            try {
                return classifyOnce(prompt);
            } catch (ClassificationException second) {
                fallbackCounter.increment();
                log.warn("Router label unusable twice, defaulting intent={} reason={}",
                        IntentLabel.ACCOUNT_SPECIFIC.label(), second.getMessage());
                return IntentLabel.ACCOUNT_SPECIFIC;
            }
        } finally {
            long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
            routerTimer.record(durationMs, TimeUnit.MILLISECONDS);
        }
    }

    private IntentLabel classifyOnce(String prompt) {
        String raw = routerClient.complete(ROUTER_SYSTEM_PROMPT, prompt, 0.0, 20);
        IntentLabel intent = IntentLabel.parse(raw);
        log.debug("Router label raw={} intent={}", raw.strip(), intent.label());
        return intent;
    }

    private static String history(List<ConversationTurn> recentTurns) {
        if (recentTurns == null || recentTurns.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("Recent conversation:\n");
        int from = Math.max(0, recentTurns.size() - HISTORY_TURNS);
        for (ConversationTurn turn : recentTurns.subList(from, recentTurns.size())) {
            sb.append(turn.role().name().toLowerCase()).append(": ").append(turn.text()).append('\n');
        }
        return sb.toString();
    }
}
