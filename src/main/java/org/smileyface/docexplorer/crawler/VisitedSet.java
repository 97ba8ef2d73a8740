package org.smileyface.docexplorer.crawler;

import org.smileyface.docexplorer.util.UrlUtils;

import java.net.URI;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * URIs already fetched or in flight during one exploration request. Membership uses the normalized
 * form of a URI, so "http://Host/a#x" and "http://host:80/a" are the same page.
 *
 * <p>{@link #claim(URI)} is an atomic check-and-insert: when sibling branches race for the same URI,
 * exactly one of them wins.</p>
 */
public final class VisitedSet {

    private final Set<String> seen = ConcurrentHashMap.newKeySet();

    /**
     * Claims the URI for fetching.
     *
     * @return true if the caller now owns the URI; false if it was claimed before or is not http(s)
     */
    public boolean claim(URI uri) {
        String key = UrlUtils.normalize(uri);
        return key != null && seen.add(key);
    }

    public boolean contains(URI uri) {
        String key = UrlUtils.normalize(uri);
        return key != null && seen.contains(key);
    }

    public int size() {
        return seen.size();
    }
}
