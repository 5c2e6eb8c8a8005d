package com.autoresearch.research.search.provider;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.RawResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * Google Programmable Search. Needs both an API key and a search engine id ({@code cx}).
 */
@Component
public class GoogleCseSearchProvider extends AbstractHttpSearchProvider {

    public static final String NAME = "google-cse";
    private static final int MAX_PAGE_SIZE = 10;

    public GoogleCseSearchProvider(RestClient.Builder restClientBuilder, ResearchProperties properties,
                                   ObjectMapper objectMapper) {
        super(restClientBuilder, properties, objectMapper);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return super.isAvailable() && StringUtils.hasText(settings.getEngineId());
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://www.googleapis.com";
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
                .uri(uriBuilder -> uriBuilder.path("/customsearch/v1")
                        .queryParam("key", settings.getApiKey())
                        .queryParam("cx", settings.getEngineId())
                        .queryParam("q", text)
                        .queryParam("num", Math.min(limit, MAX_PAGE_SIZE))
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(String.class);
    }

    @Override
    protected List<RawResult> parse(JsonNode root, int limit) {
        JsonNode items = root.path("items");
        if (!items.isArray()) {
            return List.of();
        }
        return collect(items, limit, (item, rank) -> new RawResult(NAME, text(item, "link"), text(item, "title"),
                text(item, "snippet"), null, null, rankedRelevance(baselineRelevance(), rank)));
    }
}
