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
import java.util.Map;

/**
 * Neural search. Exa reports its own relevance score, which replaces the configured baseline when present.
 */
@Component
public class ExaSearchProvider extends AbstractHttpSearchProvider {

    public static final String NAME = "exa";
    private static final int MAX_SNIPPET = 500;

    public ExaSearchProvider(RestClient.Builder restClientBuilder, ResearchProperties properties,
                             ObjectMapper objectMapper) {
        super(restClientBuilder, properties, objectMapper);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.exa.ai";
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
        return 0.8;
    }

    @Override
    protected boolean requiresApiKey() {
        return true;
    }

    @Override
    protected String fetch(String text, int limit) {
        Map<String, Object> body = Map.of(
                "query", text,
                "numResults", limit,
                "type", "auto",
                "contents", Map.of("text", Map.of("maxCharacters", MAX_SNIPPET)));
        return restClient.post()
                .uri("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .header("x-api-key", settings.getApiKey())
                .body(body)
                .retrieve()
                .body(String.class);
    }

    @Override
    protected List<RawResult> parse(JsonNode root, int limit) {
        JsonNode results = root.path("results");
        if (!results.isArray()) {
            return List.of();
        }
        return collect(results, limit, (item, rank) -> {
            String snippet = text(item, "text");
            if (snippet.length() > MAX_SNIPPET) {
                snippet = snippet.substring(0, MAX_SNIPPET);
            }
            double base = item.hasNonNull("score") ? item.get("score").asDouble() : baselineRelevance();
            String author = text(item, "author");
            return new RawResult(NAME, text(item, "url"), text(item, "title"), snippet,
                    parseDate(text(item, "publishedDate")), StringUtils.hasText(author) ? author : null,
                    rankedRelevance(base, rank));
        });
    }
}
