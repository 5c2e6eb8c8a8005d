package com.autoresearch.research.search.provider;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.RawResult;
import com.autoresearch.research.search.ProviderException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WikipediaSearchProviderTest {

    private MockRestServiceServer server;
    private WikipediaSearchProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new WikipediaSearchProvider(builder, new ResearchProperties(), new ObjectMapper());
    }

    @Test
    void testBuildsArticleUrlsAndStripsMarkup() {
        server.expect(requestTo(startsWith("https://en.wikipedia.org/w/rest.php/v1/search/page")))
                .andRespond(withSuccess("""
                        {"pages": [
                          {"key": "Green_tea", "title": "Green tea", "description": "Type of tea",
                           "excerpt": "<span class=\\"searchmatch\\">Green</span> tea is a type of tea"},
                          {"title": "missing key"}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        List<RawResult> results = provider.query("green tea", 5);

        assertEquals(1, results.size());
        RawResult page = results.get(0);
        assertEquals("https://en.wikipedia.org/wiki/Green_tea", page.url());
        assertEquals("Type of tea. Green tea is a type of tea", page.snippet());
        assertEquals(0.85, page.relevance(), 1e-9);
    }

    @Test
    void testArrayRootIsMalformed() {
        server.expect(requestTo(startsWith("https://en.wikipedia.org")))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        ProviderException ex = assertThrows(ProviderException.class, () -> provider.query("tea", 5));
        assertEquals(ProviderException.Kind.MALFORMED, ex.getKind());
    }

    @Test
    void testAvailableWithoutKey() {
        assertTrue(provider.isAvailable());
        assertEquals(3, provider.priority());
    }
}
