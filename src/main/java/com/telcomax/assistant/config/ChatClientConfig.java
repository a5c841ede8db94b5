package com.telcomax.assistant.config;

import com.telcomax.assistant.llm.ChatClientGenerationClient;
import com.telcomax.assistant.llm.GenerationClient;
import com.telcomax.assistant.llm.RetryingGenerationClient;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChatClientConfig {

    @Bean(name = "routerChatClient")
    public ChatClient routerChatClient(
            OllamaChatModel chatModel,
            @Value("${app.models.router:llama3.2:3b}") String routerModel) {
        return ChatClient.builder(chatModel)
                .defaultOptions(OllamaChatOptions.builder().model(routerModel).build())
                .build();
    }

    @Bean(name = "answerChatClient")
    public ChatClient answerChatClient(
            OllamaChatModel chatModel,
            @Value("${app.models.answer:mistral:7b-instruct}") String answerModel) {
        return ChatClient.builder(chatModel)
                .defaultOptions(OllamaChatOptions.builder().model(answerModel).build())
                .build();
    }

    @Bean(name = "routerGenerationClient")
    public GenerationClient routerGenerationClient(
            @Qualifier("routerChatClient") ChatClient chatClient,
            @Value("${app.models.router:llama3.2:3b}") String routerModel,
            @Qualifier("generationRetry") Retry generationRetry,
            MeterRegistry meterRegistry) {
        return new RetryingGenerationClient(
                new ChatClientGenerationClient(chatClient, routerModel, "router", meterRegistry),
                generationRetry);
    }

    @Bean(name = "answerGenerationClient")
    public GenerationClient answerGenerationClient(
            @Qualifier("answerChatClient") ChatClient chatClient,
            @Value("${app.models.answer:mistral:7b-instruct}") String answerModel,
            @Qualifier("generationRetry") Retry generationRetry,
            MeterRegistry meterRegistry) {
        return new RetryingGenerationClient(
                new ChatClientGenerationClient(chatClient, answerModel, "answer", meterRegistry),
                generationRetry);
    }
}
