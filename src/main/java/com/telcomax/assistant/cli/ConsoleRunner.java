package com.telcomax.assistant.cli;

import com.telcomax.assistant.agent.TurnOrchestrator;
import com.telcomax.assistant.eval.ComparisonReport;
import com.telcomax.assistant.eval.EvaluationService;
import com.telcomax.assistant.memory.Session;
import com.telcomax.assistant.memory.SessionMemory;
import com.telcomax.assistant.model.TurnResult;
import com.telcomax.assistant.retrieval.RetrievalStrategy;
import com.telcomax.assistant.retrieval.RetrievalStrategyFactory;
import com.telcomax.assistant.retrieval.RetrievalStrategyType;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnNotWebApplication;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Console surface, active when the application starts without a web server.
 *
 * <pre>
 *   --query="What is my bill for January 2026?" [--session=abc] [--strategy=hyde]
 *   --interactive [--session=abc] [--strategy=multi-query]
 *   --evaluate
 * </pre>
 *
 * Exit code is 1 on configuration errors (unknown strategy, missing arguments, evaluation
 * namespace aliasing) and 0 otherwise.
 */
@Component
@Order(10)
@ConditionalOnNotWebApplication
public class ConsoleRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRunner.class);

    static final Set<String> CONSOLE_OPTIONS = Set.of("query", "interactive", "evaluate");

    private final TurnOrchestrator orchestrator;
    private final SessionMemory sessionMemory;
    private final RetrievalStrategyFactory strategies;
    private final RetrievalStrategyType defaultStrategy;
    private final ObjectProvider<EvaluationService> evaluationService;
    private final BufferedReader in;
    private final PrintStream out;

    private int exitCode;

    @Autowired
    public ConsoleRunner(
            TurnOrchestrator orchestrator,
            SessionMemory sessionMemory,
            RetrievalStrategyFactory strategies,
            RetrievalStrategyType defaultStrategy,
            ObjectProvider<EvaluationService> evaluationService) {
        this(orchestrator, sessionMemory, strategies, defaultStrategy, evaluationService,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    ConsoleRunner(
            TurnOrchestrator orchestrator,
            SessionMemory sessionMemory,
            RetrievalStrategyFactory strategies,
            RetrievalStrategyType defaultStrategy,
            ObjectProvider<EvaluationService> evaluationService,
            BufferedReader in,
            PrintStream out) {
        this.orchestrator = orchestrator;
        this.sessionMemory = sessionMemory;
        this.strategies = strategies;
        this.defaultStrategy = defaultStrategy;
        this.evaluationService = evaluationService;
        this.in = in;
        this.out = out;
    }

    /**
     * True when the raw command line asks for a console action rather than the web server.
     */
    public static boolean isConsoleInvocation(String[] args) {
        return Arrays.stream(args)
                .filter(a -> a.startsWith("--"))
                .map(a -> a.substring(2).split("=", 2)[0])
                .anyMatch(CONSOLE_OPTIONS::contains);
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            if (args.containsOption("evaluate")) {
                evaluate();
                return;
            }

            RetrievalStrategy retrieval = strategies.create(
                    single(args, "strategy").orElse(defaultStrategy.label()));
            String sessionId = single(args, "session").orElse(UUID.randomUUID().toString());

            if (args.containsOption("interactive")) {
                interactive(sessionId, retrieval);
            } else if (args.containsOption("query")) {
                String query = single(args, "query")
                        .filter(q -> !q.isBlank())
                        .orElseThrow(() -> new IllegalArgumentException("--query needs a value"));
                print(orchestrator.handle(sessionId, query, retrieval));
            }
        } catch (IllegalArgumentException | IllegalStateException | BeansException e) {
            log.error("Console run failed: {}", e.getMessage());
            out.println("Error: " + e.getMessage());
            exitCode = 1;
        } catch (IOException e) {
            log.error("Console I/O failed", e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void interactive(String sessionId, RetrievalStrategy retrieval) throws IOException {
        out.println("TelcoMax billing assistant. Session: " + sessionId
                + " (strategy: " + retrieval.type().label() + ")");
        out.println("Commands: 'session' shows remembered context, 'exit' or 'quit' ends.");
        while (true) {
            out.print("\nYou: ");
            out.flush();
            String line = in.readLine();
            if (line == null) {
                return;
            }
            String input = line.strip();
            String command = input.toLowerCase(Locale.ROOT);
            if (input.isEmpty()) {
                continue;
            }
            if (command.equals("exit") || command.equals("quit")) {
                out.println("Goodbye.");
                return;
            }
            if (command.equals("session")) {
                Session session = sessionMemory.getOrCreate(sessionId);
                String summary = session.contextSummary();
                out.println(summary.isEmpty() ? "No session context yet." : summary);
                out.println("Turns: " + session.turns().size());
                continue;
            }
            print(orchestrator.handle(sessionId, input, retrieval));
        }
    }

    private void evaluate() throws IOException {
        EvaluationService service = evaluationService.getObject();
        ComparisonReport report = service.evaluate();
        out.println(report.render());
    }

    private void print(TurnResult result) {
        out.println();
        out.println("Assistant: " + result.response());
        out.println();
        out.println("[" + result.state() + "] intent="
                + (result.intent() == null ? "-" : result.intent().label())
                + " responder=" + result.responder());
        for (String step : result.trace()) {
            out.println("  " + step);
        }
    }

    private static Optional<String> single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        if (values.size() > 1) {
            throw new IllegalArgumentException("--" + name + " given more than once");
        }
        return Optional.of(values.get(0));
    }
}
