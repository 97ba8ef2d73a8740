package org.smileyface.docexplorer.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.docexplorer.crawler.ExplorationContext;
import org.smileyface.docexplorer.crawler.ExplorerProperties;
import org.smileyface.docexplorer.crawler.FrontierWalker;
import org.smileyface.docexplorer.fetch.FetchException;
import org.smileyface.docexplorer.model.ExplorationResult;
import org.smileyface.docexplorer.model.ExplorationState;
import org.smileyface.docexplorer.model.PageResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a traversal under the global time budget.
 *
 * <p>When the budget expires the request is cancelled: its workers are interrupted, pages finishing
 * afterwards are discarded and the pages completed so far are returned, in completion order, together with
 * a timeout message. A traversal that ends without any page because its root could not be fetched is a
 * failure.</p>
 */
@Component
public class DeadlineGuard {

    private static final Logger log = LoggerFactory.getLogger(DeadlineGuard.class);

    private final FrontierWalker walker;
    private final ExplorerProperties properties;

    public DeadlineGuard(FrontierWalker walker, ExplorerProperties properties) {
        this.walker = Objects.requireNonNull(walker, "walker");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    public ExplorationResult run(ExplorationContext ctx) {
        String rootUrl = ctx.getRootUri().toString();
        int depth = ctx.getMaxDepth();
        long budgetMs = properties.getGlobalTimeoutMs();

        ctx.transitionTo(ExplorationState.EXPLORING);
        Future<List<PageResult>> traversal;
        try {
            traversal = ctx.submit(() -> walker.walk(ctx));
        } catch (RejectedExecutionException e) {
            ctx.transitionTo(ExplorationState.FAILED);
            return ExplorationResult.failed(rootUrl, depth, "Error fetching content: exploration could not be started");
        }

        try {
            List<PageResult> pages = traversal.get(budgetMs, TimeUnit.MILLISECONDS);
            return finished(ctx, rootUrl, depth, pages);
        } catch (TimeoutException e) {
            return expired(ctx, traversal, rootUrl, depth, budgetMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Exploration {} interrupted; returning partial result", ctx.getId());
            return expired(ctx, traversal, rootUrl, depth, ctx.elapsed().toMillis());
        } catch (ExecutionException e) {
            log.error("Exploration {} of {} failed", ctx.getId(), rootUrl, e.getCause());
            ctx.transitionTo(ExplorationState.FAILED);
            return ExplorationResult.failed(rootUrl, depth, "Error fetching content: " + e.getCause());
        }
    }

    private static ExplorationResult finished(ExplorationContext ctx, String rootUrl, int depth, List<PageResult> pages) {
        if (pages.isEmpty()) {
            FetchException rootFailure = ctx.getRootFailure();
            String reason = rootFailure != null ? rootFailure.getMessage() : "no content could be extracted";
            ctx.transitionTo(ExplorationState.FAILED);
            return ExplorationResult.failed(rootUrl, depth, "Error fetching content: " + reason);
        }
        ctx.transitionTo(ExplorationState.COMPLETED);
        return ExplorationResult.completed(rootUrl, depth, pages);
    }

    private static ExplorationResult expired(ExplorationContext ctx, Future<?> traversal,
                                             String rootUrl, int depth, long afterMs) {
        ctx.cancel();
        traversal.cancel(true);
        List<PageResult> pages = ctx.completedPages();
        ctx.transitionTo(ExplorationState.TIMED_OUT);
        String error = "Exploration timed out after " + afterMs + " ms; returning "
                + pages.size() + " page(s) gathered so far";
        return ExplorationResult.timedOut(rootUrl, depth, pages, error);
    }
}
