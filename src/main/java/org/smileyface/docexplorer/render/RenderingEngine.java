package org.smileyface.docexplorer.render;

import java.net.URI;
import java.time.Duration;

/**
 * A launched headless rendering engine. Implementations are not thread-safe; {@link RenderSession}
 * confines every call to a single thread.
 */
public interface RenderingEngine extends AutoCloseable {

    /**
     * Opens a page, navigates to the URI and waits for the network to go idle or the timeout to pass.
     * Images, stylesheets, fonts and media are not loaded.
     *
     * @throws RuntimeException when navigation fails or times out
     */
    RenderedPage navigate(URI uri, Duration timeout);

    /**
     * Releases the engine and everything it launched.
     */
    @Override
    void close();
}
