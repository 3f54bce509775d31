package com.hifi.marketsearch.config;

import com.hifi.marketsearch.search.provider.storefront.StorefrontPlatform;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "search")
public class SearchProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private static final String DEFAULT_SORT = "date";

    private String userAgent;
    private boolean debug;
    private int providerTimeoutSeconds = 60;
    private int providerConcurrency = 8;
    private int requestTimeoutSeconds = 30;
    private int perHostDelayMs = 1000;
    private int globalConcurrency = 5;
    private String defaultSort = DEFAULT_SORT;
    private Query query = new Query();
    private Shutdown shutdown = new Shutdown();
    private List<Storefront> storefronts = new ArrayList<>();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public int getProviderTimeoutSeconds() {
        return Math.max(1, providerTimeoutSeconds);
    }

    public void setProviderTimeoutSeconds(int providerTimeoutSeconds) {
        this.providerTimeoutSeconds = Math.max(1, providerTimeoutSeconds);
    }

    public int getProviderConcurrency() {
        return Math.max(1, providerConcurrency);
    }

    public void setProviderConcurrency(int providerConcurrency) {
        this.providerConcurrency = Math.max(1, providerConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public String getDefaultSort() {
        return defaultSort == null || defaultSort.isBlank() ? DEFAULT_SORT : defaultSort.trim();
    }

    public void setDefaultSort(String defaultSort) {
        this.defaultSort = defaultSort;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    public Shutdown getShutdown() {
        return shutdown;
    }

    public void setShutdown(Shutdown shutdown) {
        this.shutdown = shutdown;
    }

    public List<Storefront> getStorefronts() {
        return storefronts;
    }

    public void setStorefronts(List<Storefront> storefronts) {
        this.storefronts = storefronts == null ? new ArrayList<>() : storefronts;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Query {
        private Map<String, List<String>> synonyms = new LinkedHashMap<>();

        public Map<String, List<String>> getSynonyms() {
            return synonyms;
        }

        public void setSynonyms(Map<String, List<String>> synonyms) {
            this.synonyms = synonyms == null ? new LinkedHashMap<>() : synonyms;
        }
    }

    public static class Shutdown {
        private int releaseTimeoutSeconds = 5;
        private int totalTimeoutSeconds = 10;

        public int getReleaseTimeoutSeconds() {
            return Math.max(1, releaseTimeoutSeconds);
        }

        public void setReleaseTimeoutSeconds(int releaseTimeoutSeconds) {
            this.releaseTimeoutSeconds = Math.max(1, releaseTimeoutSeconds);
        }

        public int getTotalTimeoutSeconds() {
            return Math.max(getReleaseTimeoutSeconds(), totalTimeoutSeconds);
        }

        public void setTotalTimeoutSeconds(int totalTimeoutSeconds) {
            this.totalTimeoutSeconds = Math.max(1, totalTimeoutSeconds);
        }
    }

    public static class Storefront {
        private String name;
        private StorefrontPlatform platform;
        private String baseUrl;
        private String path = "";
        private int maxPages = 5;
        private boolean enabled = true;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public StorefrontPlatform getPlatform() {
            return platform;
        }

        public void setPlatform(StorefrontPlatform platform) {
            this.platform = platform;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getPath() {
            return path == null ? "" : path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Cli {
        private boolean run;
        private String terms = "";
        private int days;
        private String include = "";
        private String exclude = "";
        private String sort = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getTerms() {
            return terms;
        }

        public void setTerms(String terms) {
            this.terms = terms == null ? "" : terms;
        }

        public int getDays() {
            return days;
        }

        public void setDays(int days) {
            this.days = days;
        }

        public String getInclude() {
            return include;
        }

        public void setInclude(String include) {
            this.include = include == null ? "" : include;
        }

        public String getExclude() {
            return exclude;
        }

        public void setExclude(String exclude) {
            this.exclude = exclude == null ? "" : exclude;
        }

        public String getSort() {
            return sort;
        }

        public void setSort(String sort) {
            this.sort = sort == null ? "" : sort;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
