package org.smileyface.docexplorer.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.docexplorer.crawler.ExplorerProperties;
import org.smileyface.docexplorer.render.PlaywrightRenderingEngine;
import org.smileyface.docexplorer.render.RenderingEngineLauncher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

@Configuration
public class BeanConfig {

    private static final Logger log = LogManager.getLogger(BeanConfig.class);

    /**
     * Selects the rendering engine based on the configuration property {@code explorer.render.engine}.
     * Supported values:
     * - "playwright" (default): headless Chromium through {@link PlaywrightRenderingEngine}
     * - "none": rendered fetches are disabled and pages needing them fail their branch
     */
    @Bean
    public RenderingEngineLauncher renderingEngineLauncher(ExplorerProperties properties) {
        log.info("Explorations answer within {} ms (global timeout {} ms, engine release {} ms)",
                properties.getResponseBoundMs(), properties.getGlobalTimeoutMs(),
                properties.getRender().getCloseTimeoutMs());
        String engine = properties.getRender().getEngine();
        String kind = engine == null ? "playwright" : engine.trim().toLowerCase(Locale.ROOT);
        if ("none".equals(kind)) {
            log.info("Rendered fetching disabled (explorer.render.engine=none)");
            return RenderingEngineLauncher.unavailable();
        }
        if (!"playwright".equals(kind)) {
            log.warn("Unknown rendering engine '{}'; using playwright", engine);
        }
        return PlaywrightRenderingEngine.launcher(properties);
    }
}
