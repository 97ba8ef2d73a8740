package org.smileyface.docexplorer.extractor;

import org.smileyface.docexplorer.model.LinkCandidate;

import java.util.List;

/**
 * Title, cleaned text and scored links of one fetched page, links in document order.
 */
public record ExtractedPage(String title, String content, List<LinkCandidate> links) {

    public ExtractedPage {
        links = links == null ? List.of() : List.copyOf(links);
        content = content == null ? "" : content;
    }

    public boolean hasContent() {
        return !content.isBlank();
    }
}
