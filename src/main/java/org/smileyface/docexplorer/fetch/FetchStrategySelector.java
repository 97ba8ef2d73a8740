package org.smileyface.docexplorer.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.docexplorer.crawler.ExplorationContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Objects;

/**
 * Chooses how a page is retrieved: the lightweight fetch first, the rendered fetch when the lightweight one
 * reports a retryable failure. A fatal lightweight failure, such as an invalid URL, is not retried.
 * When no rendering engine is available the lightweight failure is reported.
 */
@Component
public class FetchStrategySelector {

    private static final Logger log = LoggerFactory.getLogger(FetchStrategySelector.class);

    private final PageFetcher lightweight;
    private final PageFetcher rendered;

    @Autowired
    public FetchStrategySelector(LightweightFetcher lightweight, RenderedFetcher rendered) {
        this((PageFetcher) lightweight, (PageFetcher) rendered);
    }

    public FetchStrategySelector(PageFetcher lightweight, PageFetcher rendered) {
        this.lightweight = Objects.requireNonNull(lightweight, "lightweight");
        this.rendered = Objects.requireNonNull(rendered, "rendered");
    }

    /**
     * @return the fetched page
     * @throws FetchException classified failure once both strategies gave up, or on cancellation
     */
    public FetchedPage fetch(URI uri, ExplorationContext ctx) throws FetchException {
        FetchOutcome first = lightweight.fetch(uri, ctx);
        if (first instanceof FetchOutcome.Success success) {
            return success.page();
        }
        if (first instanceof FetchOutcome.Fatal fatal) {
            throw fatal.toException();
        }
        FetchOutcome.Retryable retryable = (FetchOutcome.Retryable) first;
        log.debug("Lightweight fetch of {} failed ({}: {}); falling back to rendered fetch",
                uri, retryable.type(), retryable.reason());

        FetchOutcome second;
        try {
            second = rendered.fetch(uri, ctx);
        } catch (FetchException e) {
            if (e.getType() != FetchErrorType.ENGINE_UNAVAILABLE) throw e;
            // no renderer: the lightweight failure is the more useful reason
            throw new FetchException(retryable.type(),
                    retryable.reason() + " (rendered fetch unavailable: " + e.getMessage() + ")", e);
        }
        if (second instanceof FetchOutcome.Success success) {
            return success.page();
        }
        if (second instanceof FetchOutcome.Fatal fatal) {
            throw fatal.toException();
        }
        throw ((FetchOutcome.Retryable) second).toException();
    }
}
