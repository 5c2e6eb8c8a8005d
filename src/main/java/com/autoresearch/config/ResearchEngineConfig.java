package com.autoresearch.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableScheduling
public class ResearchEngineConfig {

    @Bean
    @Primary
    public ChatClient chatClient(GoogleGenAiChatModel googleGenAiChatModel) {
        return ChatClient.builder(googleGenAiChatModel).build();
    }

    @Bean
    public ChatClient openAiChatClient(ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        OpenAiChatModel model = openAiChatModelProvider.getIfAvailable();
        return model != null ? ChatClient.builder(model).build() : null;
    }

    /**
     * Provider calls; several concurrent runs share it, each bounded by its own permit count.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService searchExecutor(ResearchProperties properties) {
        return Executors.newFixedThreadPool(Math.max(4, properties.getMaxConcurrentSearches() * 4));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService generationExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService runExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
