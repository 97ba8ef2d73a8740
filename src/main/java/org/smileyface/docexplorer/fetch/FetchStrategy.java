package org.smileyface.docexplorer.fetch;

/**
 * How a page was retrieved.
 */
public enum FetchStrategy {
    /** Direct HTTP request, markup as served. */
    LIGHTWEIGHT,

    /** Headless browser navigation, markup after scripts ran. */
    RENDERED
}
