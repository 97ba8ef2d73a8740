package org.smileyface.docexplorer.fetch;

import java.net.URI;
import java.util.Objects;

/**
 * Raw markup of a retrieved page.
 *
 * @param uri      the URI that was requested
 * @param baseUri  the URI relative links resolve against (the final URI after redirects)
 * @param body     markup as text
 * @param strategy how the page was retrieved
 * @param status   HTTP status, -1 when the engine did not report one
 */
public record FetchedPage(URI uri, URI baseUri, String body, FetchStrategy strategy, int status) {

    public FetchedPage {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(strategy, "strategy");
        baseUri = baseUri == null ? uri : baseUri;
        body = body == null ? "" : body;
    }
}
