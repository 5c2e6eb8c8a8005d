package com.autoresearch.research.search.provider;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.RawResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * Google results through SerpAPI. Premium tier only by default.
 */
@Component
public class SerpApiSearchProvider extends AbstractHttpSearchProvider {

    public static final String NAME = "serpapi";

    public SerpApiSearchProvider(RestClient.Builder restClientBuilder, ResearchProperties properties,
                                 ObjectMapper objectMapper) {
        super(restClientBuilder, properties, objectMapper);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://serpapi.com";
    }

    @Override
    protected int defaultPriority() {
        return 1;
    }

    @Override
    protected boolean defaultPremiumOnly() {
        return true;
    }

    @Override
    protected double defaultBaselineRelevance() {
        return 0.95;
    }

    @Override
    protected boolean requiresApiKey() {
        return true;
    }

    @Override
    protected String fetch(String text, int limit) {
        return restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/search")
                        .queryParam("engine", "google")
                        .queryParam("q", text)
                        .queryParam("num", limit)
                        .queryParam("api_key", settings.getApiKey())
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(String.class);
    }

    @Override
    protected List<RawResult> parse(JsonNode root, int limit) {
        JsonNode results = root.path("organic_results");
        if (!results.isArray()) {
            return List.of();
        }
        return collect(results, limit, (item, rank) -> new RawResult(NAME, text(item, "link"), text(item, "title"),
                text(item, "snippet"), parseDate(text(item, "date")), null,
                rankedRelevance(baselineRelevance(), rank)));
    }
}
