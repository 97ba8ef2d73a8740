package org.smileyface.docexplorer.fetch;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.docexplorer.crawler.ExplorationContext;
import org.smileyface.docexplorer.crawler.ExplorerProperties;
import org.smileyface.docexplorer.extractor.ContentNormalizer;
import org.smileyface.docexplorer.extractor.MinCharacterRule;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.Locale;
import java.util.Objects;

/**
 * Fetches a page with a single direct HTTP GET through Jsoup, without running scripts.
 *
 * <p>Only an HTTP 200 with a textual content type and a minimum amount of text counts as success. Everything
 * else is reported as retryable so that a rendered fetch can be tried instead; script-driven pages typically
 * fail the text check.</p>
 */
@Component
public class LightweightFetcher implements PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(LightweightFetcher.class);

    private static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private static final String ACCEPT_LANGUAGE = "en-US,en;q=0.9";

    private final ExplorerProperties properties;
    private final ContentNormalizer normalizer;

    public LightweightFetcher(ExplorerProperties properties, ContentNormalizer normalizer) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    @Override
    public FetchOutcome fetch(URI uri, ExplorationContext ctx) throws FetchException {
        ctx.checkCancelled();
        Connection.Response res;
        String body;
        try {
            Connection conn = Jsoup.connect(uri.toString())
                    .userAgent(Objects.toString(properties.getUserAgent(), "DocExplorer/0.1"))
                    .header("Accept", ACCEPT)
                    .header("Accept-Language", ACCEPT_LANGUAGE)
                    .timeout(Math.max(0, properties.getRequestTimeoutMs()))
                    .maxBodySize(Math.max(0, properties.getMaxBodyBytes()))
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true);
            res = conn.execute();
            body = res.body();
        } catch (IllegalArgumentException e) {
            return FetchOutcome.fatal(FetchErrorType.INVALID_URL, "Invalid URL " + uri + ": " + e.getMessage());
        } catch (SocketTimeoutException e) {
            return FetchOutcome.retryable(FetchErrorType.NETWORK_ERROR,
                    "Timed out after " + properties.getRequestTimeoutMs() + " ms");
        } catch (IOException | UncheckedIOException e) {
            return FetchOutcome.retryable(FetchErrorType.NETWORK_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        ctx.checkCancelled();

        int status = res.statusCode();
        if (status != 200) {
            return FetchOutcome.retryable(FetchErrorType.HTTP_STATUS, "HTTP " + status);
        }
        String contentType = res.contentType();
        if (!isTextual(contentType)) {
            return FetchOutcome.retryable(FetchErrorType.NON_TEXT_RESPONSE, "Unexpected content type " + contentType);
        }
        String text = normalizer.clean(normalizer.stripMarkup(body));
        if (!new MinCharacterRule(properties.getMinTextLength()).isMatched(text)) {
            return FetchOutcome.retryable(FetchErrorType.EMPTY_CONTENT,
                    "Only " + text.length() + " characters of text; page may need rendering");
        }
        log.debug("Fetched {} directly (status={}, contentType={}, bytes={})", uri, status, contentType, body.length());
        return FetchOutcome.success(new FetchedPage(uri, finalUri(res.url(), uri), body, FetchStrategy.LIGHTWEIGHT, status));
    }

    static boolean isTextual(String contentType) {
        if (contentType == null || contentType.isBlank()) return true;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.startsWith("text/") || ct.contains("html") || ct.contains("xml");
    }

    private static URI finalUri(URL url, URI requested) {
        if (url == null) return requested;
        try {
            return url.toURI();
        } catch (URISyntaxException e) {
            return requested;
        }
    }
}
