package com.autoresearch.research.search.provider;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.RawResult;
import com.autoresearch.research.search.ProviderException;
import com.autoresearch.research.search.SearchProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Base for JSON-over-HTTP providers. Subclasses issue the request and map the parsed body; transport, status and
 * parse failures are translated here into {@link ProviderException} kinds.
 */
@Slf4j
public abstract class AbstractHttpSearchProvider implements SearchProvider {

    private static final double RANK_DECAY = 0.05;
    private static final double MIN_RANK_FACTOR = 0.5;

    protected final RestClient restClient;
    protected final ResearchProperties.ProviderSettings settings;
    private final ObjectMapper objectMapper;

    protected AbstractHttpSearchProvider(RestClient.Builder restClientBuilder, ResearchProperties properties,
                                         ObjectMapper objectMapper) {
        this.settings = properties.getProviderSettings(name());
        this.objectMapper = objectMapper;
        String baseUrl = StringUtils.hasText(settings.getBaseUrl()) ? settings.getBaseUrl() : defaultBaseUrl();
        this.restClient = restClientBuilder.clone().baseUrl(baseUrl).build();
    }

    protected abstract String defaultBaseUrl();

    protected abstract int defaultPriority();

    protected abstract boolean defaultPremiumOnly();

    protected abstract double defaultBaselineRelevance();

    protected abstract boolean requiresApiKey();

    /**
     * Performs the HTTP call and returns the raw body.
     */
    protected abstract String fetch(String text, int limit);

    protected abstract List<RawResult> parse(JsonNode root, int limit);

    @Override
    public int priority() {
        return settings.getPriority() != null ? settings.getPriority() : defaultPriority();
    }

    @Override
    public boolean premiumOnly() {
        return settings.getPremiumOnly() != null ? settings.getPremiumOnly() : defaultPremiumOnly();
    }

    @Override
    public boolean isAvailable() {
        if (!settings.isEnabled()) {
            return false;
        }
        return !requiresApiKey() || StringUtils.hasText(settings.getApiKey());
    }

    @Override
    public Duration timeout() {
        return settings.getTimeout();
    }

    @Override
    public List<RawResult> query(String text, int limit) {
        String body;
        try {
            body = fetch(text, limit);
        } catch (RestClientResponseException ex) {
            throw fromStatus(ex.getStatusCode(), ex);
        } catch (ResourceAccessException ex) {
            if (isTimeout(ex)) {
                throw new ProviderException(name(), ProviderException.Kind.TIMEOUT, "request timed out", ex);
            }
            throw new ProviderException(name(), ProviderException.Kind.TRANSPORT, ex.getMessage(), ex);
        } catch (RestClientException ex) {
            throw new ProviderException(name(), ProviderException.Kind.TRANSPORT, ex.getMessage(), ex);
        }
        if (!StringUtils.hasText(body)) {
            throw new ProviderException(name(), ProviderException.Kind.MALFORMED, "empty response body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new ProviderException(name(), ProviderException.Kind.MALFORMED, "response is not JSON", ex);
        }
        if (root == null || !root.isObject()) {
            throw new ProviderException(name(), ProviderException.Kind.MALFORMED, "unexpected response shape");
        }
        List<RawResult> results = parse(root, limit);
        log.debug("{} returned {} results for '{}'.", name(), results.size(), text);
        return results;
    }

    protected double rankedRelevance(double base, int rank) {
        double factor = Math.max(MIN_RANK_FACTOR, 1.0 - RANK_DECAY * rank);
        return base * factor;
    }

    protected double baselineRelevance() {
        return settings.getBaselineRelevance() != null ? settings.getBaselineRelevance() : defaultBaselineRelevance();
    }

    protected List<RawResult> collect(Iterable<JsonNode> items, int limit, ItemMapper mapper) {
        List<RawResult> results = new ArrayList<>();
        int rank = 0;
        for (JsonNode item : items) {
            if (results.size() >= limit) {
                break;
            }
            RawResult result = mapper.map(item, rank);
            if (result != null && StringUtils.hasText(result.url())) {
                results.add(result);
                rank++;
            }
        }
        return results;
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText("");
    }

    /**
     * Accepts ISO instants, offset date-times and plain dates; anything else is treated as unknown.
     */
    @Nullable
    protected static Instant parseDate(@Nullable String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value)
                    .atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private ProviderException fromStatus(HttpStatusCode status, RestClientResponseException ex) {
        int code = status.value();
        if (code == 429 || code == 402 || code == 403) {
            return new ProviderException(name(), ProviderException.Kind.QUOTA, "quota exceeded (" + code + ")", ex);
        }
        if (code == 408 || code == 504) {
            return new ProviderException(name(), ProviderException.Kind.TIMEOUT, "upstream timeout (" + code + ")", ex);
        }
        return new ProviderException(name(), ProviderException.Kind.TRANSPORT, "HTTP " + code, ex);
    }

    private static boolean isTimeout(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException
                    || current instanceof InterruptedIOException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    @FunctionalInterface
    protected interface ItemMapper {
        @Nullable
        RawResult map(JsonNode item, int rank);
    }
}
