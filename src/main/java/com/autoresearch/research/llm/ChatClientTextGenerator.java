package com.autoresearch.research.llm;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.service.ResearchMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
@Slf4j
public class ChatClientTextGenerator implements TextGenerationService {

    private final ChatClient chatClient;
    private final ChatClient openAiChatClient;
    private final ResearchProperties properties;
    private final ResearchMetricsService metricsService;
    private final ExecutorService generationExecutor;

    public ChatClientTextGenerator(ChatClient chatClient,
                                   @Qualifier("openAiChatClient") ObjectProvider<ChatClient> openAiChatClientProvider,
                                   ResearchProperties properties,
                                   ResearchMetricsService metricsService,
                                   @Qualifier("generationExecutor") ExecutorService generationExecutor) {
        this.chatClient = chatClient;
        this.openAiChatClient = openAiChatClientProvider.getIfAvailable();
        this.properties = properties;
        this.metricsService = metricsService;
        this.generationExecutor = generationExecutor;
    }

    @Override
    public String generate(String prompt, GenerationConstraints constraints) {
        Duration timeout = constraints.timeout() != null ? constraints.timeout() : properties.getGenerationTimeout();
        metricsService.recordLlmRequest(constraints.purpose());
        String content;
        try {
            content = CompletableFuture.supplyAsync(() -> call(prompt, constraints), generationExecutor)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .join();
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            String reason = cause instanceof TimeoutException
                    ? "timed out after " + timeout.toMillis() + " ms"
                    : String.valueOf(cause.getMessage());
            metricsService.recordLlmFailure(constraints.purpose(), reason);
            throw new GenerationException(constraints.purpose() + " generation failed: " + reason, cause);
        }
        if (!StringUtils.hasText(content)) {
            metricsService.recordLlmFailure(constraints.purpose(), "empty response");
            throw new GenerationException(constraints.purpose() + " generation returned no text");
        }
        return content.trim();
    }

    private String call(String prompt, GenerationConstraints constraints) {
        ChatClient.ChatClientRequestSpec spec = getChatRequestSpec();
        if (StringUtils.hasText(constraints.systemPrompt())) {
            spec = spec.system(constraints.systemPrompt());
        }
        String userText = constraints.maxWords() > 0
                ? prompt + "\n\nRespond in at most " + constraints.maxWords() + " words."
                : prompt;
        return spec.user(userText).call().content();
    }

    private ChatClient.ChatClientRequestSpec getChatRequestSpec() {
        if (properties.getAiProvider() == ResearchProperties.AiProvider.OPENAI) {
            if (openAiChatClient == null) {
                throw new IllegalStateException("OpenAI provider is not properly configured. "
                        + "Check that you have a valid API key in your configuration.");
            }
            var spec = openAiChatClient.prompt();
            String model = properties.getOpenai().getModel();
            if (StringUtils.hasText(model)) {
                spec = spec.options(OpenAiChatOptions.builder().model(model).build());
            }
            return spec;
        }
        return chatClient.prompt();
    }
}
