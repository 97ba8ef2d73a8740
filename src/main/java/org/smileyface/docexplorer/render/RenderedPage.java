package org.smileyface.docexplorer.render;

/**
 * A page opened by a {@link RenderingEngine}. Must be closed after use.
 */
public interface RenderedPage extends AutoCloseable {

    /** HTTP status of the main document, -1 when none was reported. */
    int status();

    /** URL of the document after redirects, or null when unknown. */
    String location();

    /** Text content of the document body as evaluated in the page. */
    String bodyText();

    /** Serialized DOM after scripts ran. */
    String html();

    @Override
    void close();
}
