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
import java.util.regex.Pattern;

@Component
public class WikipediaSearchProvider extends AbstractHttpSearchProvider {

    public static final String NAME = "wikipedia";
    private static final String USER_AGENT = "research-engine/0.1 (https://github.com/autoresearch/research-engine)";
    private static final Pattern MARKUP = Pattern.compile("<[^>]+>");

    public WikipediaSearchProvider(RestClient.Builder restClientBuilder, ResearchProperties properties,
                                   ObjectMapper objectMapper) {
        super(restClientBuilder, properties, objectMapper);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://en.wikipedia.org";
    }

    @Override
    protected int defaultPriority() {
        return 3;
    }

    @Override
    protected boolean defaultPremiumOnly() {
        return false;
    }

    @Override
    protected double defaultBaselineRelevance() {
        return 0.85;
    }

    @Override
    protected boolean requiresApiKey() {
        return false;
    }

    @Override
    protected String fetch(String text, int limit) {
        return restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/w/rest.php/v1/search/page")
                        .queryParam("q", text)
                        .queryParam("limit", Math.min(limit, 10))
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .header("User-Agent", USER_AGENT)
                .retrieve()
                .body(String.class);
    }

    @Override
    protected List<RawResult> parse(JsonNode root, int limit) {
        JsonNode pages = root.path("pages");
        if (!pages.isArray()) {
            return List.of();
        }
        String base = StringUtils.hasText(settings.getBaseUrl()) ? settings.getBaseUrl() : defaultBaseUrl();
        return collect(pages, limit, (page, rank) -> {
            String key = text(page, "key");
            if (!StringUtils.hasText(key)) {
                return null;
            }
            String excerpt = MARKUP.matcher(text(page, "excerpt")).replaceAll("");
            String description = text(page, "description");
            String snippet = StringUtils.hasText(description) ? description + ". " + excerpt : excerpt;
            return new RawResult(NAME, base + "/wiki/" + key, text(page, "title"), snippet.trim(), null, null,
                    rankedRelevance(baselineRelevance(), rank));
        });
    }
}
