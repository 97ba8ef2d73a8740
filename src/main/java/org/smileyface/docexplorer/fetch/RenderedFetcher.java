package org.smileyface.docexplorer.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.docexplorer.crawler.ExplorationContext;
import org.smileyface.docexplorer.crawler.ExplorerProperties;
import org.smileyface.docexplorer.extractor.MinCharacterRule;
import org.smileyface.docexplorer.render.RenderedPage;
import org.smileyface.docexplorer.render.RenderingEngine;
import org.smileyface.docexplorer.util.UrlUtils;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Fetches a page through the request's rendering engine, so that script-built content is present.
 *
 * <p>Navigation failures are retried with a fixed backoff. A non-200 status or a page whose body text stays
 * below the minimum length fails immediately; those are answers, not transient errors.</p>
 */
@Component
public class RenderedFetcher implements PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(RenderedFetcher.class);

    private final ExplorerProperties properties;

    public RenderedFetcher(ExplorerProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public FetchOutcome fetch(URI uri, ExplorationContext ctx) throws FetchException {
        ctx.checkCancelled();
        return ctx.getRenderSession().call(engine -> render(engine, uri, ctx));
    }

    private FetchOutcome render(RenderingEngine engine, URI uri, ExplorationContext ctx) throws FetchException {
        ExplorerProperties.Render cfg = properties.getRender();
        int attempts = cfg.getNavigationAttempts();
        Duration timeout = Duration.ofMillis(cfg.getNavigationTimeoutMs());
        MinCharacterRule minText = new MinCharacterRule(properties.getMinTextLength());

        RuntimeException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            ctx.checkCancelled();
            try (RenderedPage page = engine.navigate(uri, timeout)) {
                int status = page.status();
                if (status == -1) {
                    return FetchOutcome.fatal(FetchErrorType.RENDER_TIMEOUT, "No response received for " + uri);
                }
                if (status != 200) {
                    return FetchOutcome.fatal(FetchErrorType.HTTP_STATUS, "Failed to load page: HTTP " + status);
                }
                if (!minText.isMatched(page.bodyText())) {
                    return FetchOutcome.fatal(FetchErrorType.EMPTY_CONTENT, "Page appears to be empty");
                }
                String html = page.html();
                log.debug("Rendered {} (attempt {}/{}, chars={})", uri, attempt, attempts, html.length());
                return FetchOutcome.success(new FetchedPage(uri, location(page, uri), html, FetchStrategy.RENDERED, status));
            } catch (RuntimeException e) {
                last = e;
                log.warn("Navigation attempt {}/{} failed for {}: {}", attempt, attempts, uri, e.getMessage());
                if (attempt < attempts) {
                    ctx.pause(cfg.getRetryBackoffMs());
                }
            }
        }
        return FetchOutcome.retryable(FetchErrorType.RENDER_TIMEOUT,
                "Navigation failed after " + attempts + " attempts: " + (last != null ? last.getMessage() : "unknown error"));
    }

    private static URI location(RenderedPage page, URI requested) {
        URI location = UrlUtils.parseHttpUrl(page.location());
        return location != null ? location : requested;
    }
}
