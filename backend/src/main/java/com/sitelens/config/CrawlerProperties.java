package com.sitelens.config;

import com.sitelens.crawl.model.DeepCrawlConfig;
import com.sitelens.crawl.structure.ScoringWeights;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@ConfigurationProperties(prefix = "sitelens")
public class CrawlerProperties {
    private static final List<String> DEFAULT_USER_AGENTS = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:121.0) Gecko/20100101 Firefox/121.0",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.1 Safari/605.1.15"
    );
    static final List<String> DEFAULT_EXCLUDE_PATTERNS = List.of(
        "\\.pdf$",
        "\\.zip$",
        "\\.jpg$",
        "\\.png$",
        "\\.gif$",
        "#.*$"
    );

    private String version = "0.1.0";
    private List<String> userAgents = new ArrayList<>();
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 0;
    private int requestRetryBaseDelayMs = 1000;
    private int requestRetryMaxDelayMs = 8000;
    private List<Integer> requestRetryStatuses = new ArrayList<>();
    private boolean requestRetryOnNetworkErrors = true;
    private int requestRetryNetworkDelayMs = 0;
    private boolean requestRetryJitter = true;
    private int globalConcurrency = 4;
    private int maxBodyBytes = 5 * 1024 * 1024;
    private int maxStoredSessions = 100;
    private Deep deep = new Deep();
    private Analysis analysis = new Analysis();
    private Cli cli = new Cli();

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public List<String> getUserAgents() {
        return normalizeUserAgents(userAgents);
    }

    public void setUserAgents(List<String> userAgents) {
        this.userAgents = userAgents == null ? new ArrayList<>() : new ArrayList<>(userAgents);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    /**
     * Statuses that trigger a retry. Empty means 403, 408, 429 and every 5xx.
     */
    public List<Integer> getRequestRetryStatuses() {
        return requestRetryStatuses;
    }

    public void setRequestRetryStatuses(List<Integer> requestRetryStatuses) {
        this.requestRetryStatuses = requestRetryStatuses == null
            ? new ArrayList<>()
            : requestRetryStatuses.stream().filter(Objects::nonNull).collect(Collectors.toCollection(ArrayList::new));
    }

    public boolean isRequestRetryOnNetworkErrors() {
        return requestRetryOnNetworkErrors;
    }

    public void setRequestRetryOnNetworkErrors(boolean requestRetryOnNetworkErrors) {
        this.requestRetryOnNetworkErrors = requestRetryOnNetworkErrors;
    }

    /**
     * Fixed delay before retrying a timeout or I/O error; 0 uses the status backoff.
     */
    public int getRequestRetryNetworkDelayMs() {
        return Math.max(0, requestRetryNetworkDelayMs);
    }

    public void setRequestRetryNetworkDelayMs(int requestRetryNetworkDelayMs) {
        this.requestRetryNetworkDelayMs = Math.max(0, requestRetryNetworkDelayMs);
    }

    public boolean isRequestRetryJitter() {
        return requestRetryJitter;
    }

    public void setRequestRetryJitter(boolean requestRetryJitter) {
        this.requestRetryJitter = requestRetryJitter;
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getMaxBodyBytes() {
        return Math.max(1024, maxBodyBytes);
    }

    public void setMaxBodyBytes(int maxBodyBytes) {
        this.maxBodyBytes = Math.max(1024, maxBodyBytes);
    }

    public int getMaxStoredSessions() {
        return Math.max(1, maxStoredSessions);
    }

    public void setMaxStoredSessions(int maxStoredSessions) {
        this.maxStoredSessions = Math.max(1, maxStoredSessions);
    }

    public Deep getDeep() {
        return deep;
    }

    public void setDeep(Deep deep) {
        this.deep = deep;
    }

    public Analysis getAnalysis() {
        return analysis;
    }

    public void setAnalysis(Analysis analysis) {
        this.analysis = analysis;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static List<String> normalizeUserAgents(List<String> candidates) {
        if (candidates == null) {
            return DEFAULT_USER_AGENTS;
        }
        List<String> cleaned = candidates.stream()
            .filter(value -> value != null && !value.isBlank())
            .map(String::trim)
            .toList();
        return cleaned.isEmpty() ? DEFAULT_USER_AGENTS : cleaned;
    }

    public static class Deep {
        private int maxDepth = 2;
        private int maxPages = 50;
        private boolean stayInDomain = true;
        private boolean stayInSubdomain = false;
        private List<String> includePatterns = new ArrayList<>();
        private List<String> excludePatterns = new ArrayList<>(DEFAULT_EXCLUDE_PATTERNS);
        private double rate = 2.0;
        private boolean filterNavigation = true;
        private int minContentLength = 200;

        public int getMaxDepth() {
            return Math.max(0, maxDepth);
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = Math.max(0, maxDepth);
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public boolean isStayInDomain() {
            return stayInDomain;
        }

        public void setStayInDomain(boolean stayInDomain) {
            this.stayInDomain = stayInDomain;
        }

        public boolean isStayInSubdomain() {
            return stayInSubdomain;
        }

        public void setStayInSubdomain(boolean stayInSubdomain) {
            this.stayInSubdomain = stayInSubdomain;
        }

        public List<String> getIncludePatterns() {
            return includePatterns;
        }

        public void setIncludePatterns(List<String> includePatterns) {
            this.includePatterns = includePatterns == null ? new ArrayList<>() : new ArrayList<>(includePatterns);
        }

        public List<String> getExcludePatterns() {
            return excludePatterns;
        }

        public void setExcludePatterns(List<String> excludePatterns) {
            this.excludePatterns = excludePatterns == null ? new ArrayList<>() : new ArrayList<>(excludePatterns);
        }

        public double getRate() {
            return rate > 0 ? rate : 2.0;
        }

        public void setRate(double rate) {
            this.rate = rate > 0 ? rate : 2.0;
        }

        public boolean isFilterNavigation() {
            return filterNavigation;
        }

        public void setFilterNavigation(boolean filterNavigation) {
            this.filterNavigation = filterNavigation;
        }

        public int getMinContentLength() {
            return Math.max(0, minContentLength);
        }

        public void setMinContentLength(int minContentLength) {
            this.minContentLength = Math.max(0, minContentLength);
        }

        public DeepCrawlConfig toCrawlConfig(List<String> startUrls) {
            return new DeepCrawlConfig(
                startUrls,
                getMaxDepth(),
                getMaxPages(),
                stayInDomain,
                stayInSubdomain,
                includePatterns,
                excludePatterns,
                getRate(),
                null,
                filterNavigation,
                getMinContentLength()
            );
        }
    }

    public static class Analysis {
        private int minContentLength = 200;
        private double autoSaveThreshold = 0.5;
        private double profileMinConfidence = 0.6;
        private ScoringWeights weights = new ScoringWeights();

        public int getMinContentLength() {
            return Math.max(0, minContentLength);
        }

        public void setMinContentLength(int minContentLength) {
            this.minContentLength = Math.max(0, minContentLength);
        }

        public double getAutoSaveThreshold() {
            return clampUnit(autoSaveThreshold);
        }

        public void setAutoSaveThreshold(double autoSaveThreshold) {
            this.autoSaveThreshold = clampUnit(autoSaveThreshold);
        }

        public double getProfileMinConfidence() {
            return clampUnit(profileMinConfidence);
        }

        public void setProfileMinConfidence(double profileMinConfidence) {
            this.profileMinConfidence = clampUnit(profileMinConfidence);
        }

        public ScoringWeights getWeights() {
            return weights;
        }

        public void setWeights(ScoringWeights weights) {
            this.weights = weights == null ? new ScoringWeights() : weights;
        }

        private static double clampUnit(double value) {
            if (Double.isNaN(value)) {
                return 0.0;
            }
            return Math.min(1.0, Math.max(0.0, value));
        }
    }

    public static class Cli {
        private boolean run = false;
        private String startUrls = "";
        private boolean exitAfterRun = false;
        private int shutdownGraceSeconds = 30;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getStartUrls() {
            return startUrls;
        }

        public void setStartUrls(String startUrls) {
            this.startUrls = startUrls == null ? "" : startUrls;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }

        public int getShutdownGraceSeconds() {
            return shutdownGraceSeconds;
        }

        public void setShutdownGraceSeconds(int shutdownGraceSeconds) {
            this.shutdownGraceSeconds = Math.max(0, shutdownGraceSeconds);
        }
    }
}
