package com.autoresearch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Configuration
public class RestClientConfig {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    @Bean
    public RestClientCustomizer restClientCustomizer(ResearchProperties properties) {
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout(CONNECT_TIMEOUT);
            factory.setReadTimeout(properties.getFanOutTimeout());
            // BufferingClientHttpRequestFactory allows multiple reads of the response body
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(factory));
        };
    }

    /**
     * Logs provider traffic at DEBUG with credentials masked.
     */
    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {

        private static final Logger httpLogger = LoggerFactory.getLogger("com.autoresearch.http.logging");
        private static final Set<String> SECRET_HEADERS = Set.of("x-subscription-token", "x-api-key",
                "authorization");
        private static final Pattern SECRET_PARAMS = Pattern.compile("(?i)([?&](?:api_key|key)=)[^&]*");
        private static final String MASK = "****";

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
                throws IOException {
            if (!httpLogger.isDebugEnabled()) {
                return execution.execute(request, body);
            }
            logRequest(request, body);
            ClientHttpResponse response = execution.execute(request, body);
            logResponse(response);
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            httpLogger.debug("--> {} {}", request.getMethod(), maskUri(request.getURI()));
            httpLogger.debug("Headers: {}", maskHeaders(request.getHeaders()));
            if (body.length > 0) {
                httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }

        private void logResponse(ClientHttpResponse response) throws IOException {
            try {
                httpLogger.debug("<-- {}", response.getStatusCode());
            } catch (IOException e) {
                httpLogger.debug("<-- status unknown");
            }
            byte[] body = StreamUtils.copyToByteArray(response.getBody());
            if (body.length > 0) {
                httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }

        static String maskUri(URI uri) {
            return SECRET_PARAMS.matcher(uri.toString()).replaceAll("$1" + MASK);
        }

        static HttpHeaders maskHeaders(HttpHeaders headers) {
            HttpHeaders masked = new HttpHeaders();
            headers.forEach((name, values) -> {
                if (SECRET_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                    masked.add(name, MASK);
                } else {
                    masked.addAll(name, values);
                }
            });
            return masked;
        }
    }
}
