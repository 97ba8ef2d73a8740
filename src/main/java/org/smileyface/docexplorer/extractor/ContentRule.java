package org.smileyface.docexplorer.extractor;

import org.jsoup.nodes.Element;

/**
 * A rule used during main-content selection to decide whether a candidate element carries
 * enough content to be accepted.
 */
@FunctionalInterface
public interface ContentRule {
    /**
     * Returns true if the provided element matches this rule.
     *
     * @param element a Jsoup Element from the parsed page (may be null)
     * @return true if matched
     */
    boolean isMatched(Element element);
}
