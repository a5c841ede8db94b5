package com.telcomax.assistant.agent;

import com.telcomax.assistant.llm.GenerationClient;
import com.telcomax.assistant.model.ResponderType;
import com.telcomax.assistant.retrieval.RetrievalException;
import com.telcomax.assistant.retrieval.ScoredChunk;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Answers questions about the customer's own account from the customer document namespace.
 * The retrieval query is scoped with the session's entity summary.
 */
@Component
public class AccountResponder implements DomainResponder {

    private static final Logger log = LoggerFactory.getLogger(AccountResponder.class);

    static final String NOT_FOUND_ANSWER = """
            I couldn't find specific information about your account in our records. This might be because:
            - The account number or details weren't found
            - The billing period mentioned isn't available
            Please verify your account information.""";

    static final String DEGRADED_ANSWER =
            "I'm unable to look up your account records right now.";

    private static final String SYSTEM_PROMPT = """
            You are a TelcoMax Wireless Billing Specialist with access to customer account data.

            Rules:
            - ONLY use information from the DOCUMENTS provided
            - Never make up or estimate amounts
            - If information isn't in the documents, say "not found"
            - For billing amounts include the exact dollar amount and the billing period
            - Cite the document id and chunk id for every fact, with a short verbatim quote
              (max 20 words) that contains any amount you state

            Respond ONLY in JSON with this exact shape:
            {
              "answer": "<answer with specific amounts and dates>",
              "citations": [
                {"doc_id": "<document id>", "chunk_id": "<chunk id>", "quote": "<verbatim quote>"}
              ]
            }
            """;

    private static final String STRICT_SUFFIX = """

            Your previous reply could not be parsed.
            Return ONE JSON object and nothing else: no markdown, no code fences, no commentary.
            Use only the fields "answer" and "citations"; every citation needs "doc_id",
            "chunk_id" and "quote" as strings.
            """;

    private final GenerationClient answerClient;
    private final String namespace;

    public AccountResponder(
            @Qualifier("answerGenerationClient") GenerationClient answerClient,
            @Value("${app.namespaces.customer:customer-docs}") String namespace) {
        this.answerClient = answerClient;
        this.namespace = namespace;
    }

    @Override
    public ResponderType type() {
        return ResponderType.ACCOUNT_SPECIFIC;
    }

    @Override
    public Draft draft(ResponderContext context) {
        String summary = context.session().contextSummary();
        String searchQuery = summary.isEmpty() ? context.query() : summary + " " + context.query();

        List<ScoredChunk> chunks;
        try {
            chunks = context.retrieval().retrieve(searchQuery, namespace, context.topK());
        } catch (RetrievalException e) {
            log.warn("Account retrieval failed sessionId={} strategy={}",
                    context.session().id(), context.retrieval().type().label(), e);
            return Draft.degraded(type(), DEGRADED_ANSWER);
        }

        if (chunks.isEmpty()) {
            log.info("No account documents found sessionId={}", context.session().id());
            return Draft.notFound(type(), NOT_FOUND_ANSWER);
        }

        StringBuilder prompt = new StringBuilder("DOCUMENTS:\n").append(documents(chunks)).append('\n');
        if (!summary.isEmpty()) {
            prompt.append("CUSTOMER CONTEXT:\n").append(summary)
                    .append("\nUse this context to understand which customer/account this query is about.\n\n");
        }
        prompt.append("QUESTION:\n").append(context.query());

        String system = context.strict() ? SYSTEM_PROMPT + STRICT_SUFFIX : SYSTEM_PROMPT;
        String text = answerClient.complete(system, prompt.toString(), 0.3, 1000);
        return Draft.answer(type(), text, chunks);
    }

    private static String documents(List<ScoredChunk> chunks) {
        StringBuilder sb = new StringBuilder();
        for (ScoredChunk chunk : chunks) {
            sb.append("doc_id: ").append(chunk.docId())
                    .append(" | chunk_id: ").append(chunk.chunkId())
                    .append(String.format(Locale.ROOT, " | score: %.3f%n", chunk.score()))
                    .append(chunk.text()).append("\n---\n");
        }
        return sb.toString();
    }
}
