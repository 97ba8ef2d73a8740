package org.smileyface.docexplorer.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.smileyface.docexplorer.fetch.FetchStrategy;
import org.smileyface.docexplorer.fetch.FetchedPage;
import org.smileyface.docexplorer.util.UrlUtils;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Extracts title, principal text and scored links from one fetched page.
 *
 * <p>Links are always scored on the parsed DOM. Text comes from pattern-based stripping of the raw
 * markup for lightweight fetches and from the selected main-content element for rendered pages, whose
 * markup only becomes meaningful after scripts ran.</p>
 */
@Component
public class ContentExtractor {

    private final ContentNormalizer normalizer;
    private final LinkExtractor linkExtractor;

    public ContentExtractor(ContentNormalizer normalizer, LinkExtractor linkExtractor) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.linkExtractor = Objects.requireNonNull(linkExtractor, "linkExtractor");
    }

    public ExtractedPage extract(FetchedPage page) {
        Objects.requireNonNull(page, "page");
        Document doc = Jsoup.parse(page.body(), page.baseUri().toString());
        Element main = normalizer.selectMainElement(doc);

        String content = page.strategy() == FetchStrategy.RENDERED
                ? normalizer.normalizeElement(main)
                : normalizer.normalizeMarkup(page.body());

        return new ExtractedPage(resolveTitle(doc, page), content, linkExtractor.extract(doc, main));
    }

    private static String resolveTitle(Document doc, FetchedPage page) {
        String title = doc.title();
        if (title != null && !title.isBlank()) {
            return title.trim();
        }
        return UrlUtils.titleFromPath(page.uri());
    }
}
