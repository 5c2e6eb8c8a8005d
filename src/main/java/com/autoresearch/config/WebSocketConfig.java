package com.autoresearch.config;

import com.autoresearch.stream.ResearchStreamWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Exposes live run progress at {@code research.stream.path}.
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
@Slf4j
public class WebSocketConfig implements WebSocketConfigurer {

    private final ResearchStreamWebSocketHandler researchStreamHandler;
    private final ResearchProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        ResearchProperties.StreamConfig stream = properties.getStream();
        String[] origins = stream.getAllowedOrigins().toArray(new String[0]);
        registry.addHandler(researchStreamHandler, stream.getPath()).setAllowedOrigins(origins);
        log.info("Research progress stream registered at {} for origins {}.", stream.getPath(),
                stream.getAllowedOrigins());
    }
}
