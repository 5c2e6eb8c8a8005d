package com.autoresearch.research.search.provider;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.RawResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;

@Component
public class BraveSearchProvider extends AbstractHttpSearchProvider {

    public static final String NAME = "brave";

    public BraveSearchProvider(RestClient.Builder restClientBuilder, ResearchProperties properties,
                               ObjectMapper objectMapper) {
        super(restClientBuilder, properties, objectMapper);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.search.brave.com";
    }

    @Override
    protected int defaultPriority() {
        return 2;
    }

    @Override
    protected boolean defaultPremiumOnly() {
        return false;
    }

    @Override
    protected double defaultBaselineRelevance() {
        return 0.9;
    }

    @Override
    protected boolean requiresApiKey() {
        return true;
    }

    @Override
    protected String fetch(String text, int limit) {
        return restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/res/v1/web/search")
                        .queryParam("q", text)
                        .queryParam("count", Math.min(limit, 20))
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .header("X-Subscription-Token", settings.getApiKey())
                .retrieve()
                .body(String.class);
    }

    @Override
    protected List<RawResult> parse(JsonNode root, int limit) {
        JsonNode results = root.path("web").path("results");
        if (!results.isArray()) {
            return List.of();
        }
        return collect(results, limit, (item, rank) -> new RawResult(NAME, text(item, "url"), text(item, "title"),
                text(item, "description"), parseDate(text(item, "page_age")), null,
                rankedRelevance(baselineRelevance(), rank)));
    }
}
