package org.smileyface.docexplorer.render;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.docexplorer.crawler.ExplorerProperties;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Headless Chromium through Playwright. One instance holds one Playwright driver, one browser and one
 * browser context; every navigation opens a fresh page in that context.
 */
public final class PlaywrightRenderingEngine implements RenderingEngine {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightRenderingEngine.class);

    private static final String WAIT_FOR_BODY_TEXT =
            "() => !!(document.body && document.body.textContent && document.body.textContent.length > 0)";
    private static final String BODY_TEXT = "() => document.body ? (document.body.textContent || '') : ''";

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;

    private PlaywrightRenderingEngine(ExplorerProperties properties) {
        ExplorerProperties.Render render = properties.getRender();
        Set<String> blocked = render.getBlockedResourceTypes().stream()
                .map(type -> type.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());

        Playwright pw = Playwright.create();
        try {
            Browser b = pw.chromium().launch(new BrowserType.LaunchOptions()
                    .setHeadless(render.isHeadless())
                    .setArgs(render.getBrowserArgs()));
            BrowserContext ctx = b.newContext(new Browser.NewContextOptions()
                    .setUserAgent(properties.getUserAgent())
                    .setViewportSize(1200, 800));
            ctx.route("**/*", route -> {
                if (blocked.contains(route.request().resourceType())) {
                    route.abort();
                } else {
                    route.resume();
                }
            });
            this.playwright = pw;
            this.browser = b;
            this.context = ctx;
        } catch (RuntimeException e) {
            pw.close();
            throw e;
        }
    }

    /**
     * Launcher creating a new engine per call, for use by a {@link RenderSession}.
     */
    public static RenderingEngineLauncher launcher(ExplorerProperties properties) {
        Objects.requireNonNull(properties, "properties");
        return () -> new PlaywrightRenderingEngine(properties);
    }

    @Override
    public RenderedPage navigate(URI uri, Duration timeout) {
        double timeoutMs = (double) timeout.toMillis();
        Page page = context.newPage();
        try {
            page.setDefaultTimeout(timeoutMs);
            Response response = page.navigate(uri.toString(), new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.NETWORKIDLE)
                    .setTimeout(timeoutMs));
            waitForBodyText(page, uri, timeoutMs);
            return new PlaywrightPage(page, response == null ? -1 : response.status());
        } catch (RuntimeException e) {
            page.close();
            throw e;
        }
    }

    private static void waitForBodyText(Page page, URI uri, double timeoutMs) {
        try {
            page.waitForFunction(WAIT_FOR_BODY_TEXT, null, new Page.WaitForFunctionOptions().setTimeout(timeoutMs));
        } catch (TimeoutError e) {
            // an empty body is reported by the caller's content check
            log.debug("Body text did not appear within {} ms: {}", (long) timeoutMs, uri);
        }
    }

    @Override
    public void close() {
        try {
            context.close();
        } catch (PlaywrightException e) {
            log.warn("Failed to close browser context: {}", e.getMessage());
        }
        try {
            browser.close();
        } catch (PlaywrightException e) {
            log.warn("Failed to close browser: {}", e.getMessage());
        }
        playwright.close();
    }

    private static final class PlaywrightPage implements RenderedPage {

        private final Page page;
        private final int status;

        PlaywrightPage(Page page, int status) {
            this.page = page;
            this.status = status;
        }

        @Override
        public int status() {
            return status;
        }

        @Override
        public String location() {
            return page.url();
        }

        @Override
        public String bodyText() {
            return Objects.toString(page.evaluate(BODY_TEXT), "");
        }

        @Override
        public String html() {
            return page.content();
        }

        @Override
        public void close() {
            try {
                page.close();
            } catch (PlaywrightException e) {
                log.debug("Failed to close page: {}", e.getMessage());
            }
        }
    }
}
