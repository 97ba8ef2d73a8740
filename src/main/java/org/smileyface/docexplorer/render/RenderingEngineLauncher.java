package org.smileyface.docexplorer.render;

/**
 * Starts a new rendering engine instance.
 */
@FunctionalInterface
public interface RenderingEngineLauncher {

    RenderingEngine launch() throws Exception;

    /**
     * False when rendered fetching is switched off; launch is then never attempted.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * A launcher for deployments without a browser.
     */
    static RenderingEngineLauncher unavailable() {
        return new RenderingEngineLauncher() {
            @Override
            public RenderingEngine launch() {
                throw new IllegalStateException("Rendered fetching is disabled");
            }

            @Override
            public boolean isAvailable() {
                return false;
            }
        };
    }
}
