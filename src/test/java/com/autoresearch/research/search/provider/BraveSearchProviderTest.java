package com.autoresearch.research.search.provider;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.RawResult;
import com.autoresearch.research.search.ProviderException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class BraveSearchProviderTest {

    private MockRestServiceServer server;
    private BraveSearchProvider provider;

    @BeforeEach
    void setUp() {
        ResearchProperties properties = new ResearchProperties();
        ResearchProperties.ProviderSettings settings = new ResearchProperties.ProviderSettings();
        settings.setApiKey("brave-key");
        properties.setProviders(Map.of("brave", settings));
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new BraveSearchProvider(builder, properties, new ObjectMapper());
    }

    @Test
    void testParsesWebResults() {
        server.expect(requestTo(org.hamcrest.Matchers.startsWith("https://api.search.brave.com/res/v1/web/search")))
                .andExpect(queryParam("q", "green%20tea"))
                .andExpect(header("X-Subscription-Token", "brave-key"))
                .andRespond(withSuccess("""
                        {"web": {"results": [
                          {"url": "https://example.com/a", "title": "A", "description": "About tea",
                           "page_age": "2024-03-01T00:00:00"},
                          {"url": "", "title": "no url"},
                          {"url": "https://example.com/b", "title": "B", "description": "More tea"}
                        ]}}
                        """, MediaType.APPLICATION_JSON));

        List<RawResult> results = provider.query("green tea", 5);

        server.verify();
        assertEquals(2, results.size());
        RawResult first = results.get(0);
        assertEquals("brave", first.provider());
        assertEquals("https://example.com/a", first.url());
        assertEquals("About tea", first.snippet());
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), first.publishedAt());
        assertEquals(0.9, first.relevance(), 1e-9);
        assertTrue(results.get(1).relevance() < first.relevance());
    }

    @Test
    void testRateLimitMapsToQuota() {
        server.expect(requestTo(org.hamcrest.Matchers.startsWith("https://api.search.brave.com")))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        ProviderException ex = assertThrows(ProviderException.class, () -> provider.query("tea", 5));
        assertEquals(ProviderException.Kind.QUOTA, ex.getKind());
        assertEquals("brave", ex.getProvider());
    }

    @Test
    void testServerErrorMapsToTransport() {
        server.expect(requestTo(org.hamcrest.Matchers.startsWith("https://api.search.brave.com")))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        ProviderException ex = assertThrows(ProviderException.class, () -> provider.query("tea", 5));
        assertEquals(ProviderException.Kind.TRANSPORT, ex.getKind());
    }

    @Test
    void testNonJsonBodyIsMalformed() {
        server.expect(requestTo(org.hamcrest.Matchers.startsWith("https://api.search.brave.com")))
                .andRespond(withSuccess("<html>oops</html>", MediaType.TEXT_HTML));

        ProviderException ex = assertThrows(ProviderException.class, () -> provider.query("tea", 5));
        assertEquals(ProviderException.Kind.MALFORMED, ex.getKind());
    }

    @Test
    void testUnavailableWithoutApiKey() {
        RestClient.Builder builder = RestClient.builder();
        BraveSearchProvider keyless = new BraveSearchProvider(builder, new ResearchProperties(), new ObjectMapper());
        assertFalse(keyless.isAvailable());
        assertTrue(provider.isAvailable());
        assertEquals(2, provider.priority());
        assertFalse(provider.premiumOnly());
    }
}
