package org.smileyface.docexplorer.fetch;

import org.smileyface.docexplorer.crawler.ExplorationContext;

import java.net.URI;

/**
 * One way of retrieving a page.
 */
@FunctionalInterface
public interface PageFetcher {

    /**
     * Retrieves the page. Failures are reported through the returned outcome; only cancellation of the
     * request is thrown.
     *
     * @param uri absolute http(s) URI
     * @param ctx the request the fetch belongs to
     * @throws FetchException with {@link FetchErrorType#DEADLINE_EXCEEDED} when the request was cancelled
     */
    FetchOutcome fetch(URI uri, ExplorationContext ctx) throws FetchException;
}
