package org.smileyface.docexplorer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.net.URI;
import java.util.Objects;

/**
 * An outbound link discovered on a page, resolved to an absolute URI and scored for relevance.
 * The relevance score is a heuristic and only its relative ordering is meaningful; it is not part
 * of the serialized response.
 */
public final class LinkCandidate {

    private final URI url;
    private final String text;
    private final double relevance;

    public LinkCandidate(URI url, String text, double relevance) {
        this.url = Objects.requireNonNull(url, "url");
        this.text = text == null ? "" : text;
        this.relevance = Math.max(0d, relevance);
    }

    public URI getUrl() { return url; }

    public String getText() { return text; }

    @JsonIgnore
    public double getRelevance() { return relevance; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LinkCandidate that = (LinkCandidate) o;
        return Double.compare(that.relevance, relevance) == 0
                && url.equals(that.url)
                && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, text, relevance);
    }

    @Override
    public String toString() {
        return "LinkCandidate{" +
                "url=" + url +
                ", text='" + text + '\'' +
                ", relevance=" + relevance +
                '}';
    }
}
