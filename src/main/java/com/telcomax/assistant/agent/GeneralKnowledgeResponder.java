package com.telcomax.assistant.agent;

import com.telcomax.assistant.llm.GenerationClient;
import com.telcomax.assistant.model.ResponderType;
import com.telcomax.assistant.retrieval.ScoredChunk;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class GeneralKnowledgeResponder implements DomainResponder {

    private static final Logger log = LoggerFactory.getLogger(GeneralKnowledgeResponder.class);

    private static final String SYSTEM_PROMPT = """
            You are a friendly and professional TelcoMax Wireless customer service representative.

            Rules:
            - Answer questions about plans, pricing, features, policies and general facts
            - Use REFERENCE material when it is relevant; if information is missing, say so
            - NEVER state amounts for an individual customer's bill, balance or charges
            - You may quote published plan prices (e.g. "The Pro plan is $49.99/month")
            - Be concise, friendly and use simple language
            """;

    private final GenerationClient answerClient;
    private final String namespace;

    public GeneralKnowledgeResponder(
            @Qualifier("answerGenerationClient") GenerationClient answerClient,
            @Value("${app.namespaces.reference:telecom-wiki}") String namespace) {
        this.answerClient = answerClient;
        this.namespace = namespace;
    }

    @Override
    public ResponderType type() {
        return ResponderType.GENERAL_KNOWLEDGE;
    }

    @Override
    public Draft draft(ResponderContext context) {
        if (context.session().hasAccountId()) {
            log.info("Escalating general draft sessionId={} reason=account id in session",
                    context.session().id());
            return Draft.escalation(type(), "account identifier present in session");
        }

        List<ScoredChunk> chunks =
                context.retrieval().retrieve(context.query(), namespace, context.topK());

        String reference = chunks.isEmpty()
                ? "REFERENCE: none found\n\n"
                : "REFERENCE:\n" + ScoredChunk.formatContext(chunks) + "\n\n";
        String prompt = reference + "QUESTION:\n" + context.query();

        String text = answerClient.complete(SYSTEM_PROMPT, prompt, 0.7, 500).strip();
        return Draft.answer(type(), text, chunks);
    }
}
