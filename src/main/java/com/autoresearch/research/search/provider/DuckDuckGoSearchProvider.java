package com.autoresearch.research.search.provider;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.RawResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;

/**
 * DuckDuckGo instant answers. Needs no key; nested topic groups are flattened.
 */
@Component
public class DuckDuckGoSearchProvider extends AbstractHttpSearchProvider {

    public static final String NAME = "duckduckgo";

    public DuckDuckGoSearchProvider(RestClient.Builder restClientBuilder, ResearchProperties properties,
                                    ObjectMapper objectMapper) {
        super(restClientBuilder, properties, objectMapper);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.duckduckgo.com";
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
        return 0.7;
    }

    @Override
    protected boolean requiresApiKey() {
        return false;
    }

    @Override
    protected String fetch(String text, int limit) {
        // DuckDuckGo answers with application/x-javascript, so the body is read as text.
        return restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/")
                        .queryParam("q", text)
                        .queryParam("format", "json")
                        .queryParam("no_html", 1)
                        .queryParam("skip_disambig", 1)
                        .build())
                .retrieve()
                .body(String.class);
    }

    @Override
    protected List<RawResult> parse(JsonNode root, int limit) {
        List<JsonNode> items = new ArrayList<>();
        if (StringUtils.hasText(text(root, "AbstractURL")) && StringUtils.hasText(text(root, "AbstractText"))) {
            items.add(root);
        }
        flattenTopics(root.path("RelatedTopics"), items);
        return collect(items, limit, (item, rank) -> {
            if (item == root) {
                String heading = text(root, "Heading");
                return new RawResult(NAME, text(root, "AbstractURL"), heading, text(root, "AbstractText"), null, null,
                        rankedRelevance(baselineRelevance(), rank));
            }
            String snippet = text(item, "Text");
            return new RawResult(NAME, text(item, "FirstURL"), titleFrom(snippet), snippet, null, null,
                    rankedRelevance(baselineRelevance(), rank));
        });
    }

    private void flattenTopics(JsonNode topics, List<JsonNode> into) {
        if (!topics.isArray()) {
            return;
        }
        for (JsonNode topic : topics) {
            if (topic.has("Topics")) {
                flattenTopics(topic.get("Topics"), into);
            } else if (topic.hasNonNull("FirstURL")) {
                into.add(topic);
            }
        }
    }

    private static String titleFrom(String snippet) {
        int dash = snippet.indexOf(" - ");
        String title = dash > 0 ? snippet.substring(0, dash) : snippet;
        return title.length() > 120 ? title.substring(0, 120) : title;
    }
}
