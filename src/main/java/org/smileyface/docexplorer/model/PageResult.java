package org.smileyface.docexplorer.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * Content and ranked links of one successfully explored page. Immutable once constructed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PageResult {

    private final URI url;
    private final String title;        // optional, null when neither <title> nor the path yields one
    private final String content;      // cleaned, length-bounded text
    private final List<LinkCandidate> links;

    public PageResult(URI url, String title, String content, List<LinkCandidate> links) {
        this.url = Objects.requireNonNull(url, "url");
        this.title = (title == null || title.isBlank()) ? null : title;
        this.content = content == null ? "" : content;
        this.links = links == null ? List.of() : List.copyOf(links);
    }

    public URI getUrl() { return url; }

    public String getTitle() { return title; }

    public String getContent() { return content; }

    public List<LinkCandidate> getLinks() { return links; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PageResult that = (PageResult) o;
        return url.equals(that.url)
                && Objects.equals(title, that.title)
                && content.equals(that.content)
                && links.equals(that.links);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, title, content, links);
    }

    @Override
    public String toString() {
        return "PageResult{" +
                "url=" + url +
                ", title='" + title + '\'' +
                ", contentLength=" + content.length() +
                ", links=" + links.size() +
                '}';
    }
}
