package com.autoresearch.config;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RestClientConfigTest {

    @Test
    void testMaskUriHidesKeys() {
        URI uri = URI.create("https://serpapi.com/search.json?q=tea&api_key=secret123&num=5");

        String masked = RestClientConfig.LoggingRequestInterceptor.maskUri(uri);

        assertEquals("https://serpapi.com/search.json?q=tea&api_key=****&num=5", masked);
    }

    @Test
    void testMaskUriHidesGoogleKey() {
        URI uri = URI.create("https://www.googleapis.com/customsearch/v1?key=abc&cx=engine&q=tea");

        assertEquals("https://www.googleapis.com/customsearch/v1?key=****&cx=engine&q=tea",
                RestClientConfig.LoggingRequestInterceptor.maskUri(uri));
    }

    @Test
    void testMaskHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Subscription-Token", "brave-secret");
        headers.add("x-api-key", "exa-secret");
        headers.add("Accept", "application/json");

        HttpHeaders masked = RestClientConfig.LoggingRequestInterceptor.maskHeaders(headers);

        assertEquals(List.of("****"), masked.get("X-Subscription-Token"));
        assertEquals(List.of("****"), masked.get("x-api-key"));
        assertEquals(List.of("application/json"), masked.get("Accept"));
    }
}
