package org.smileyface.docexplorer.crawler;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Configuration properties for page exploration: traversal bounds, fetch timeouts, extraction
 * thresholds and the rendering engine.
 */
@ConfigurationProperties(prefix = "explorer")
public class ExplorerProperties {

    private static final Logger log = LogManager.getLogger(ExplorerProperties.class);

    static final String DEFAULTS_RESOURCE = "DocExplorerConfig.json";

    /** Upper bound accepted for a request depth. Depth 1 fetches the root page only. */
    private int maxDepthLimit = 5;

    /** Depth used when a request does not specify one. */
    private int defaultDepth = 1;

    /** User agent of the lightweight fetcher; a regular browser string so sites serve normal markup. */
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";

    /** Lightweight fetch timeout in milliseconds. */
    private int requestTimeoutMs = 10000;

    /** Maximum body size read by the lightweight fetcher. */
    private int maxBodyBytes = 5 * 1024 * 1024;

    /** Minimum characters of page text below which a fetched page counts as empty. */
    private int minTextLength = 100;

    /** A main-content candidate is accepted once its text is longer than this. */
    private int mainContentMinChars = 200;

    /** Maximum characters of content kept per page, truncation marker included. */
    private int maxContentLength = 10000;

    private String truncationMarker = "\n\n[Content truncated]";

    /** Links kept in each page result, after ranking. */
    private int maxLinksPerPage = 10;

    /** Same-domain links followed from each page. */
    private int maxChildrenPerPage = 5;

    /** Child branches dispatched together; the next group starts when the current one finished. */
    private int fanOut = 3;

    /** Fetches allowed in flight at the same time for one request. */
    private int maxConcurrentFetches = 5;

    /** Global budget of one exploration request in milliseconds. */
    private long globalTimeoutMs = 45000;

    private Render render = new Render();

    /** Ordered main-content selectors, most specific first. */
    private List<String> contentSelectors = new ArrayList<>(List.of("main", "article", "body"));

    /** Terms in link text that hint at informative content. */
    private List<String> informativeWords = new ArrayList<>();

    /** Link texts that denote site chrome rather than content. Compared case-insensitively. */
    private List<String> boilerplateLinkLabels = new ArrayList<>();

    /** Cached lower-cased view of {@link #boilerplateLinkLabels}. */
    private Set<String> boilerplateLabelSet = Set.of();

    /**
     * Loads list defaults from classpath resource DocExplorerConfig.json if available.
     * Spring still binds/overrides values from application properties as usual.
     */
    public ExplorerProperties() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                ObjectMapper mapper = new ObjectMapper()
                        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
                ExplorerDefaults cfg = mapper.readValue(in, ExplorerDefaults.class);
                if (cfg.contentSelectors != null && !cfg.contentSelectors.isEmpty()) {
                    this.contentSelectors = new ArrayList<>(cfg.contentSelectors);
                }
                if (cfg.informativeWords != null) this.informativeWords = new ArrayList<>(cfg.informativeWords);
                if (cfg.boilerplateLinkLabels != null) this.boilerplateLinkLabels = new ArrayList<>(cfg.boilerplateLinkLabels);
                if (cfg.blockedResourceTypes != null) this.render.blockedResourceTypes = new ArrayList<>(cfg.blockedResourceTypes);
                if (cfg.browserArgs != null) this.render.browserArgs = new ArrayList<>(cfg.browserArgs);
            } else {
                log.warn("Classpath resource {} not found; using built-in defaults", DEFAULTS_RESOURCE);
            }
        } catch (Exception e) {
            // Keep built-in defaults when the file is malformed; do not fail application startup
            log.error("Failed to load explorer defaults from classpath resource {}", DEFAULTS_RESOURCE, e);
        }
        rebuildBoilerplateLabels();
    }

    public int getMaxDepthLimit() { return maxDepthLimit; }
    public void setMaxDepthLimit(int maxDepthLimit) { this.maxDepthLimit = Math.max(1, maxDepthLimit); }

    public int getDefaultDepth() { return defaultDepth; }
    public void setDefaultDepth(int defaultDepth) { this.defaultDepth = Math.max(1, defaultDepth); }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public int getRequestTimeoutMs() { return requestTimeoutMs; }
    public void setRequestTimeoutMs(int requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

    public int getMaxBodyBytes() { return maxBodyBytes; }
    public void setMaxBodyBytes(int maxBodyBytes) { this.maxBodyBytes = maxBodyBytes; }

    public int getMinTextLength() { return minTextLength; }
    public void setMinTextLength(int minTextLength) { this.minTextLength = Math.max(0, minTextLength); }

    public int getMainContentMinChars() { return mainContentMinChars; }
    public void setMainContentMinChars(int mainContentMinChars) { this.mainContentMinChars = Math.max(0, mainContentMinChars); }

    public int getMaxContentLength() { return maxContentLength; }
    public void setMaxContentLength(int maxContentLength) { this.maxContentLength = maxContentLength; }

    public String getTruncationMarker() { return truncationMarker; }
    public void setTruncationMarker(String truncationMarker) {
        this.truncationMarker = truncationMarker == null ? "" : truncationMarker;
    }

    public int getMaxLinksPerPage() { return maxLinksPerPage; }
    public void setMaxLinksPerPage(int maxLinksPerPage) { this.maxLinksPerPage = Math.max(0, maxLinksPerPage); }

    public int getMaxChildrenPerPage() { return maxChildrenPerPage; }
    public void setMaxChildrenPerPage(int maxChildrenPerPage) { this.maxChildrenPerPage = Math.max(0, maxChildrenPerPage); }

    public int getFanOut() { return fanOut; }
    public void setFanOut(int fanOut) { this.fanOut = Math.max(1, fanOut); }

    public int getMaxConcurrentFetches() { return maxConcurrentFetches; }
    public void setMaxConcurrentFetches(int maxConcurrentFetches) { this.maxConcurrentFetches = Math.max(1, maxConcurrentFetches); }

    public long getGlobalTimeoutMs() { return globalTimeoutMs; }
    public void setGlobalTimeoutMs(long globalTimeoutMs) { this.globalTimeoutMs = Math.max(1, globalTimeoutMs); }

    public Render getRender() { return render; }
    public void setRender(Render render) { this.render = render != null ? render : new Render(); }

    public List<String> getContentSelectors() { return contentSelectors; }
    public void setContentSelectors(List<String> contentSelectors) {
        this.contentSelectors = contentSelectors != null ? contentSelectors : new ArrayList<>();
    }

    public List<String> getInformativeWords() { return informativeWords; }
    public void setInformativeWords(List<String> informativeWords) {
        this.informativeWords = informativeWords != null ? informativeWords : new ArrayList<>();
    }

    public List<String> getBoilerplateLinkLabels() { return boilerplateLinkLabels; }
    public void setBoilerplateLinkLabels(List<String> boilerplateLinkLabels) {
        this.boilerplateLinkLabels = boilerplateLinkLabels != null ? boilerplateLinkLabels : new ArrayList<>();
        rebuildBoilerplateLabels();
    }

    /**
     * Returns true when the trimmed link text is, as a whole, one of the boilerplate labels
     * ("home", "login", ...), ignoring case.
     */
    public boolean isBoilerplateLabel(String linkText) {
        if (linkText == null) return false;
        return boilerplateLabelSet.contains(linkText.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Clamps a requested depth into {@code 1..maxDepthLimit}; null selects the default depth.
     */
    public int clampDepth(Integer requested) {
        int depth = requested == null ? defaultDepth : requested;
        return Math.min(Math.max(1, depth), maxDepthLimit);
    }

    /**
     * Longest time an exploration can hold its caller: the global budget plus the render session's close
     * allowance, spent after the deadline while the engine is released.
     */
    public long getResponseBoundMs() {
        return globalTimeoutMs + render.getCloseTimeoutMs();
    }

    private void rebuildBoilerplateLabels() {
        Set<String> set = new LinkedHashSet<>();
        for (String label : boilerplateLinkLabels) {
            if (label != null && !label.isBlank()) set.add(label.trim().toLowerCase(Locale.ROOT));
        }
        this.boilerplateLabelSet = Set.copyOf(set);
    }

    /**
     * Rendering engine settings.
     */
    public static class Render {

        /** "playwright" launches headless Chromium; "none" disables rendered fetches. */
        private String engine = "playwright";

        private boolean headless = true;

        /** Timeout of one navigation attempt in milliseconds. */
        private int navigationTimeoutMs = 10000;

        private int navigationAttempts = 3;

        /** Fixed pause between navigation or launch attempts. */
        private long retryBackoffMs = 1000;

        private int launchAttempts = 3;

        /** How long releasing the engine may take before its thread is abandoned. */
        private long closeTimeoutMs = 5000;

        private List<String> blockedResourceTypes = new ArrayList<>();

        private List<String> browserArgs = new ArrayList<>();

        public String getEngine() { return engine; }
        public void setEngine(String engine) { this.engine = engine; }

        public boolean isHeadless() { return headless; }
        public void setHeadless(boolean headless) { this.headless = headless; }

        public int getNavigationTimeoutMs() { return navigationTimeoutMs; }
        public void setNavigationTimeoutMs(int navigationTimeoutMs) { this.navigationTimeoutMs = navigationTimeoutMs; }

        public int getNavigationAttempts() { return navigationAttempts; }
        public void setNavigationAttempts(int navigationAttempts) { this.navigationAttempts = Math.max(1, navigationAttempts); }

        public long getRetryBackoffMs() { return retryBackoffMs; }
        public void setRetryBackoffMs(long retryBackoffMs) { this.retryBackoffMs = Math.max(0, retryBackoffMs); }

        public int getLaunchAttempts() { return launchAttempts; }
        public void setLaunchAttempts(int launchAttempts) { this.launchAttempts = Math.max(1, launchAttempts); }

        public long getCloseTimeoutMs() { return closeTimeoutMs; }
        public void setCloseTimeoutMs(long closeTimeoutMs) { this.closeTimeoutMs = Math.max(0, closeTimeoutMs); }

        public List<String> getBlockedResourceTypes() { return blockedResourceTypes; }
        public void setBlockedResourceTypes(List<String> blockedResourceTypes) {
            this.blockedResourceTypes = blockedResourceTypes != null ? blockedResourceTypes : new ArrayList<>();
        }

        public List<String> getBrowserArgs() { return browserArgs; }
        public void setBrowserArgs(List<String> browserArgs) {
            this.browserArgs = browserArgs != null ? browserArgs : new ArrayList<>();
        }
    }

    // --------- Nested DTO for JSON mapping ---------
    public static class ExplorerDefaults {
        public List<String> contentSelectors;
        public List<String> informativeWords;
        public List<String> boilerplateLinkLabels;
        public List<String> blockedResourceTypes;
        public List<String> browserArgs;
    }
}
