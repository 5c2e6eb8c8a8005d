package com.autoresearch.config;

import com.autoresearch.research.model.ResearchMode;
import com.autoresearch.research.model.Tier;
import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "research")
public class ResearchProperties {

    private int maxConcurrentSearches = 4;
    private Duration fanOutTimeout = Duration.ofSeconds(20);
    private int minViableResults = 1;
    private Duration generationTimeout = Duration.ofSeconds(30);
    private Duration runGrace = Duration.ofSeconds(5);
    private Duration runRetention = Duration.ofMinutes(30);
    private Duration metricsLogInterval = Duration.ofMinutes(15);
    private AiProvider aiProvider = AiProvider.GOOGLE;
    private OpenAIConfig openai = new OpenAIConfig();
    private GoogleConfig google = new GoogleConfig();
    private Map<ResearchMode, ModeSettings> modes = defaultModes();
    private TierConfig tiers = new TierConfig();
    private Map<String, ProviderSettings> providers = new LinkedHashMap<>();
    private CacheConfig cache = new CacheConfig();
    private ScoringConfig scoring = new ScoringConfig();
    private VerificationConfig verification = new VerificationConfig();
    private StreamConfig stream = new StreamConfig();

    public enum AiProvider {
        GOOGLE, OPENAI
    }

    public static class GoogleConfig {
        private String model;

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class OpenAIConfig {
        private String model = "gpt-4o-mini";

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    private static Map<ResearchMode, ModeSettings> defaultModes() {
        Map<ResearchMode, ModeSettings> defaults = new EnumMap<>(ResearchMode.class);
        defaults.put(ResearchMode.QUICK, new ModeSettings(2, 500, 1, Duration.ofSeconds(60), 1, 5, false));
        defaults.put(ResearchMode.STANDARD, new ModeSettings(5, 2000, 3, Duration.ofMinutes(3), 2, 5, false));
        defaults.put(ResearchMode.DEEP, new ModeSettings(15, 5000, 5, Duration.ofMinutes(10), 3, 10, true));
        return defaults;
    }

    public static class ModeSettings {
        private int maxSources;
        private int maxWords;
        private int maxIterations;
        private Duration maxWallTime;
        private int minCorroboration;
        private int resultsPerQuery;
        private boolean premiumOnly;

        public ModeSettings() {}

        public ModeSettings(int maxSources, int maxWords, int maxIterations, Duration maxWallTime,
                            int minCorroboration, int resultsPerQuery, boolean premiumOnly) {
            this.maxSources = maxSources;
            this.maxWords = maxWords;
            this.maxIterations = maxIterations;
            this.maxWallTime = maxWallTime;
            this.minCorroboration = minCorroboration;
            this.resultsPerQuery = resultsPerQuery;
            this.premiumOnly = premiumOnly;
        }

        public int getMaxSources() { return maxSources; }
        public void setMaxSources(int maxSources) { this.maxSources = maxSources; }
        public int getMaxWords() { return maxWords; }
        public void setMaxWords(int maxWords) { this.maxWords = maxWords; }
        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public Duration getMaxWallTime() { return maxWallTime; }
        public void setMaxWallTime(Duration maxWallTime) { this.maxWallTime = maxWallTime; }
        public int getMinCorroboration() { return minCorroboration; }
        public void setMinCorroboration(int minCorroboration) { this.minCorroboration = minCorroboration; }
        public int getResultsPerQuery() { return resultsPerQuery; }
        public void setResultsPerQuery(int resultsPerQuery) { this.resultsPerQuery = resultsPerQuery; }
        public boolean isPremiumOnly() { return premiumOnly; }
        public void setPremiumOnly(boolean premiumOnly) { this.premiumOnly = premiumOnly; }
    }

    public static class TierConfig {
        private Tier defaultTier = Tier.FREE;
        private Map<String, Tier> users = new HashMap<>();

        public Tier getDefaultTier() { return defaultTier; }

        public void setDefaultTier(Tier defaultTier) {
            if (defaultTier == null) {
                return;
            }
            this.defaultTier = defaultTier;
        }

        public Map<String, Tier> getUsers() { return users; }

        public void setUsers(Map<String, Tier> users) {
            if (users == null) {
                return;
            }
            this.users = new HashMap<>(users);
        }

        public Tier tierFor(String userId) {
            if (userId == null) {
                return defaultTier;
            }
            return users.getOrDefault(userId, defaultTier);
        }
    }

    public static class ProviderSettings {
        private boolean enabled = true;
        private String apiKey;
        private String baseUrl;
        private String engineId;
        private Integer priority;
        private Boolean premiumOnly;
        private Duration timeout = Duration.ofSeconds(10);
        private int quotaLimit;
        private Duration quotaWindow = Duration.ofDays(30);
        private Double baselineRelevance;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getEngineId() { return engineId; }
        public void setEngineId(String engineId) { this.engineId = engineId; }
        public Integer getPriority() { return priority; }
        public void setPriority(Integer priority) { this.priority = priority; }
        public Boolean getPremiumOnly() { return premiumOnly; }
        public void setPremiumOnly(Boolean premiumOnly) { this.premiumOnly = premiumOnly; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getQuotaLimit() { return quotaLimit; }
        public void setQuotaLimit(int quotaLimit) { this.quotaLimit = quotaLimit; }
        public Duration getQuotaWindow() { return quotaWindow; }
        public void setQuotaWindow(Duration quotaWindow) { this.quotaWindow = quotaWindow; }
        public Double getBaselineRelevance() { return baselineRelevance; }
        public void setBaselineRelevance(Double baselineRelevance) { this.baselineRelevance = baselineRelevance; }
    }

    public static class CacheConfig {
        public enum Store { MEMORY, JPA }

        private Store store = Store.MEMORY;
        private Duration ttl = Duration.ofHours(24);
        private double similarityThreshold = 0.85;
        private int recentWindow = 256;
        private Duration sweepInterval = Duration.ofMinutes(10);

        public Store getStore() { return store; }
        public void setStore(Store store) { this.store = store; }
        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
        public double getSimilarityThreshold() { return similarityThreshold; }
        public void setSimilarityThreshold(double similarityThreshold) { this.similarityThreshold = similarityThreshold; }
        public int getRecentWindow() { return recentWindow; }
        public void setRecentWindow(int recentWindow) { this.recentWindow = recentWindow; }
        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
    }

    public static class ScoringConfig {
        private double relevanceWeight = 0.6;
        private double credibilityWeight = 0.4;
        private double credibilityFloor = 40.0;
        private double neutralScore = 50.0;
        private double topicMatchThreshold = 0.5;

        public double getRelevanceWeight() { return relevanceWeight; }
        public void setRelevanceWeight(double relevanceWeight) { this.relevanceWeight = relevanceWeight; }
        public double getCredibilityWeight() { return credibilityWeight; }
        public void setCredibilityWeight(double credibilityWeight) { this.credibilityWeight = credibilityWeight; }
        public double getCredibilityFloor() { return credibilityFloor; }
        public void setCredibilityFloor(double credibilityFloor) { this.credibilityFloor = credibilityFloor; }
        public double getNeutralScore() { return neutralScore; }
        public void setNeutralScore(double neutralScore) { this.neutralScore = neutralScore; }
        public double getTopicMatchThreshold() { return topicMatchThreshold; }
        public void setTopicMatchThreshold(double topicMatchThreshold) { this.topicMatchThreshold = topicMatchThreshold; }
    }

    public static class StreamConfig {
        private String path = "/ws/research";
        private List<String> allowedOrigins = List.of("*");

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public List<String> getAllowedOrigins() { return allowedOrigins; }
        public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }
    }

    public static class VerificationConfig {
        private double minClaimConfidence = 60.0;
        private boolean extraCycleEnabled = true;

        public double getMinClaimConfidence() { return minClaimConfidence; }
        public void setMinClaimConfidence(double minClaimConfidence) { this.minClaimConfidence = minClaimConfidence; }
        public boolean isExtraCycleEnabled() { return extraCycleEnabled; }
        public void setExtraCycleEnabled(boolean extraCycleEnabled) { this.extraCycleEnabled = extraCycleEnabled; }
    }

    public Duration getMetricsLogInterval() {
        return metricsLogInterval;
    }

    public void setMetricsLogInterval(Duration metricsLogInterval) {
        this.metricsLogInterval = metricsLogInterval;
    }

    public StreamConfig getStream() {
        return stream;
    }

    public void setStream(StreamConfig stream) {
        this.stream = stream;
    }

    public int getMaxConcurrentSearches() {
        return maxConcurrentSearches;
    }

    public void setMaxConcurrentSearches(int maxConcurrentSearches) {
        this.maxConcurrentSearches = maxConcurrentSearches;
    }

    public Duration getFanOutTimeout() {
        return fanOutTimeout;
    }

    public void setFanOutTimeout(Duration fanOutTimeout) {
        this.fanOutTimeout = fanOutTimeout;
    }

    public int getMinViableResults() {
        return minViableResults;
    }

    public void setMinViableResults(int minViableResults) {
        this.minViableResults = minViableResults;
    }

    public Duration getGenerationTimeout() {
        return generationTimeout;
    }

    public void setGenerationTimeout(Duration generationTimeout) {
        this.generationTimeout = generationTimeout;
    }

    public Duration getRunGrace() {
        return runGrace;
    }

    public void setRunGrace(Duration runGrace) {
        this.runGrace = runGrace;
    }

    public Duration getRunRetention() {
        return runRetention;
    }

    public void setRunRetention(Duration runRetention) {
        this.runRetention = runRetention;
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public void setAiProvider(AiProvider aiProvider) {
        this.aiProvider = aiProvider;
    }

    public OpenAIConfig getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAIConfig openai) {
        this.openai = openai;
    }

    public GoogleConfig getGoogle() {
        return google;
    }

    public void setGoogle(GoogleConfig google) {
        this.google = google;
    }

    public Map<ResearchMode, ModeSettings> getModes() {
        return modes;
    }

    public void setModes(Map<ResearchMode, ModeSettings> modes) {
        if (modes == null) {
            return;
        }
        Map<ResearchMode, ModeSettings> merged = defaultModes();
        merged.putAll(modes);
        this.modes = merged;
    }

    public ModeSettings getModeSettings(ResearchMode mode) {
        ModeSettings settings = modes.get(mode);
        return settings != null ? settings : defaultModes().get(mode);
    }

    public TierConfig getTiers() {
        return tiers;
    }

    public void setTiers(TierConfig tiers) {
        this.tiers = tiers != null ? tiers : new TierConfig();
    }

    public Map<String, ProviderSettings> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderSettings> providers) {
        if (providers == null) {
            return;
        }
        Map<String, ProviderSettings> normalized = new LinkedHashMap<>();
        providers.forEach((name, settings) -> normalized.put(name.toLowerCase(Locale.ROOT), settings));
        this.providers = normalized;
    }

    public ProviderSettings getProviderSettings(String name) {
        ProviderSettings settings = providers.get(name.toLowerCase(Locale.ROOT));
        return settings != null ? settings : new ProviderSettings();
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache != null ? cache : new CacheConfig();
    }

    public ScoringConfig getScoring() {
        return scoring;
    }

    public void setScoring(ScoringConfig scoring) {
        this.scoring = scoring != null ? scoring : new ScoringConfig();
    }

    public VerificationConfig getVerification() {
        return verification;
    }

    public void setVerification(VerificationConfig verification) {
        this.verification = verification != null ? verification : new VerificationConfig();
    }
}
