package org.smileyface.docexplorer.extractor;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.docexplorer.crawler.ExplorerProperties;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns page markup into cleaned, length-bounded plain text.
 *
 * <p>Two entry points exist. {@link #normalizeMarkup(String)} works on raw markup by pattern removal and is
 * used for pages retrieved without rendering. {@link #normalizeElement(Element)} works on the main-content
 * element chosen by {@link #selectMainElement(Document)} and is used for rendered pages.</p>
 */
@Component
public class ContentNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ContentNormalizer.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;
    private static final Pattern HEAD_BLOCK = Pattern.compile("<head\\b[^>]*>.*?</head\\s*>", FLAGS);
    private static final Pattern SCRIPT_BLOCK = Pattern.compile("<script\\b[^>]*>.*?</script\\s*>", FLAGS);
    private static final Pattern STYLE_BLOCK = Pattern.compile("<style\\b[^>]*>.*?</style\\s*>", FLAGS);
    private static final Pattern COMMENT = Pattern.compile("<!--.*?-->", Pattern.DOTALL);
    private static final Pattern TAG = Pattern.compile("<[^>]*>");

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\r\\u00A0]+");
    private static final Pattern LINE_EDGE_SPACE = Pattern.compile("(?m)^ | $");
    private static final Pattern BLANK_LINE_RUN = Pattern.compile("\\n{3,}");

    private final ExplorerProperties properties;
    private final ContentRule acceptRule;

    public ContentNormalizer(ExplorerProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.acceptRule = MinCharacterRule.longerThan(properties.getMainContentMinChars());
    }

    /**
     * Strips markup from a raw page and returns cleaned, truncated text.
     */
    public String normalizeMarkup(String html) {
        return truncate(clean(stripMarkup(html)));
    }

    /**
     * Returns the cleaned, truncated text of an element; empty for null.
     */
    public String normalizeElement(Element element) {
        if (element == null) return "";
        return truncate(clean(element.text()));
    }

    /**
     * Removes head, script and style blocks, comments and all remaining tags, then unescapes entities.
     */
    public String stripMarkup(String html) {
        if (html == null || html.isEmpty()) return "";
        String s = HEAD_BLOCK.matcher(html).replaceAll(" ");
        s = SCRIPT_BLOCK.matcher(s).replaceAll(" ");
        s = STYLE_BLOCK.matcher(s).replaceAll(" ");
        s = COMMENT.matcher(s).replaceAll(" ");
        s = TAG.matcher(s).replaceAll(" ");
        return Parser.unescapeEntities(s, false);
    }

    /**
     * Collapses runs of horizontal whitespace to one space, trims every line and keeps at most one
     * blank line between paragraphs. Applying it twice gives the same result as applying it once.
     */
    public String clean(String text) {
        if (text == null || text.isEmpty()) return "";
        String s = text.replace("\r\n", "\n");
        s = HORIZONTAL_WHITESPACE.matcher(s).replaceAll(" ");
        s = LINE_EDGE_SPACE.matcher(s).replaceAll("");
        s = BLANK_LINE_RUN.matcher(s).replaceAll("\n\n");
        return s.strip();
    }

    /**
     * Cuts text longer than the configured maximum so that the result, truncation marker included,
     * is exactly the maximum length. Shorter text is returned unchanged.
     */
    public String truncate(String text) {
        if (text == null) return "";
        int max = properties.getMaxContentLength();
        if (max <= 0 || text.length() <= max) return text;
        String marker = properties.getTruncationMarker();
        if (marker.length() >= max) {
            return text.substring(0, max);
        }
        return text.substring(0, max - marker.length()) + marker;
    }

    /**
     * Picks the element holding the principal content. Selectors are tried in configured order; for a
     * selector matching several elements the one with the longest text represents it. The first
     * representative longer than the configured minimum wins; otherwise the longest representative seen
     * is used, and the body when no selector matched at all.
     */
    public Element selectMainElement(Document doc) {
        if (doc == null) return null;
        Element fallback = null;
        for (String selector : properties.getContentSelectors()) {
            if (selector == null || selector.isBlank()) continue;
            Elements matches;
            try {
                matches = doc.select(selector);
            } catch (Selector.SelectorParseException e) {
                log.warn("Invalid content selector in explorer config: {} (ignored)", selector);
                continue;
            }
            if (matches.isEmpty()) continue;

            Element best = longest(matches);
            if (acceptRule.isMatched(best)) {
                return best;
            }
            if (fallback == null || textLength(best) > textLength(fallback)) {
                fallback = best;
            }
        }
        return fallback != null ? fallback : doc.body();
    }

    private static Element longest(Elements elements) {
        Element best = elements.first();
        int bestLength = textLength(best);
        for (Element e : elements) {
            int len = textLength(e);
            if (len > bestLength) {
                best = e;
                bestLength = len;
            }
        }
        return best;
    }

    private static int textLength(Element e) {
        return e == null ? 0 : e.text().length();
    }
}
