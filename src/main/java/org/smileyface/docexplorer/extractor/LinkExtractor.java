package org.smileyface.docexplorer.extractor;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.smileyface.docexplorer.crawler.ExplorerProperties;
import org.smileyface.docexplorer.model.LinkCandidate;
import org.smileyface.docexplorer.util.UrlUtils;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Collects the outbound links of a parsed page and scores each one for relevance.
 *
 * <p>Score = min(text length / 10, 5), plus 5 when the anchor sits inside the main-content element,
 * plus 2 for every distinct informative term contained in the link text.</p>
 */
@Component
public class LinkExtractor {

    static final double TEXT_LENGTH_DIVISOR = 10d;
    static final double TEXT_SCORE_CAP = 5d;
    static final double MAIN_CONTENT_BONUS = 5d;
    static final double INFORMATIVE_WORD_BONUS = 2d;

    private static final List<String> SKIPPED_HREF_PREFIXES = List.of("#", "javascript:", "mailto:", "tel:");

    private final ExplorerProperties properties;

    public LinkExtractor(ExplorerProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Extracts scored links in document order. Relative hrefs are resolved against the document's
     * base URI; anchors that cannot be resolved to an absolute http(s) URI are dropped.
     *
     * @param doc         parsed page, created with its base URI
     * @param mainElement selected main-content element (may be null)
     */
    public List<LinkCandidate> extract(Document doc, Element mainElement) {
        if (doc == null) return List.of();
        List<LinkCandidate> out = new ArrayList<>();
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href").trim();
            if (isSkipped(href)) continue;

            URI uri = resolve(a);
            if (uri == null) continue;

            String text = a.text().trim();
            out.add(new LinkCandidate(uri, text, score(text, isInside(a, mainElement))));
        }
        return out;
    }

    /**
     * Relevance of a link with the given text; only relative ordering of scores is meaningful.
     */
    public double score(String text, boolean insideMainContent) {
        String t = text == null ? "" : text;
        double relevance = Math.min(t.length() / TEXT_LENGTH_DIVISOR, TEXT_SCORE_CAP);
        if (insideMainContent) {
            relevance += MAIN_CONTENT_BONUS;
        }
        String lower = t.toLowerCase(Locale.ROOT);
        for (String word : properties.getInformativeWords()) {
            if (word != null && !word.isBlank() && lower.contains(word.toLowerCase(Locale.ROOT))) {
                relevance += INFORMATIVE_WORD_BONUS;
            }
        }
        return relevance;
    }

    private static boolean isSkipped(String href) {
        if (href.isEmpty()) return true;
        String lower = href.toLowerCase(Locale.ROOT);
        for (String prefix : SKIPPED_HREF_PREFIXES) {
            if (lower.startsWith(prefix)) return true;
        }
        return false;
    }

    private static URI resolve(Element anchor) {
        String abs = anchor.absUrl("href");
        if (abs.isEmpty()) return null;
        URI uri = toUri(abs);
        return uri != null && UrlUtils.isHttp(uri) && uri.getHost() != null ? uri : null;
    }

    /**
     * Parses an absolute URL, percent-encoding characters such as spaces or '|' that browsers accept in
     * an href but {@link URI} rejects.
     */
    static URI toUri(String abs) {
        try {
            return URI.create(abs);
        } catch (IllegalArgumentException e) {
            try {
                URL url = new URL(abs);
                return new URI(url.getProtocol(), url.getUserInfo(), url.getHost(), url.getPort(),
                        url.getPath(), url.getQuery(), url.getRef());
            } catch (MalformedURLException | URISyntaxException ex) {
                return null;
            }
        }
    }

    private static boolean isInside(Element anchor, Element container) {
        if (container == null) return false;
        for (Element p = anchor.parent(); p != null; p = p.parent()) {
            if (p == container) return true;
        }
        return false;
    }
}
