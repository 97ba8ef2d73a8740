package org.smileyface.docexplorer.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.docexplorer.crawler.ExplorationContext;
import org.smileyface.docexplorer.crawler.ExplorerProperties;
import org.smileyface.docexplorer.model.ExplorationResult;
import org.smileyface.docexplorer.render.RenderingEngineLauncher;
import org.smileyface.docexplorer.util.UrlUtils;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.Objects;

/**
 * Entry point of an exploration: validates the input, creates the request's context and runs the
 * traversal under the deadline guard. Never throws for fetch or traversal errors; those are reported
 * through {@link ExplorationResult#getError()}.
 */
@Service
public class DocExplorerService {

    private static final Logger log = LoggerFactory.getLogger(DocExplorerService.class);

    private final DeadlineGuard guard;
    private final ExplorerProperties properties;
    private final RenderingEngineLauncher launcher;

    public DocExplorerService(DeadlineGuard guard, ExplorerProperties properties, RenderingEngineLauncher launcher) {
        this.guard = Objects.requireNonNull(guard, "guard");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
    }

    /**
     * Explores the page at {@code url} and its same-domain neighborhood.
     *
     * @param url   absolute http(s) URL of the root page
     * @param depth maximum exploration depth; 1 fetches the root only, values below 1 are treated as 1
     */
    public ExplorationResult explore(String url, int depth) {
        int maxDepth = Math.max(1, depth);
        URI root = UrlUtils.parseHttpUrl(url);
        if (root == null) {
            log.warn("Rejected exploration of invalid URL: {}", url);
            return ExplorationResult.failed(url, maxDepth, "Invalid URL provided: " + url);
        }

        try (ExplorationContext ctx = new ExplorationContext(root, maxDepth, properties, launcher)) {
            ExplorationResult result = guard.run(ctx);
            log.info("Explored {} to depth {}: {} page(s){}", root, maxDepth, result.getPagesExplored(),
                    result.getError() != null ? " (" + result.getError() + ")" : "");
            return result;
        }
    }
}
