package org.smileyface.docexplorer.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.docexplorer.extractor.ContentExtractor;
import org.smileyface.docexplorer.extractor.ExtractedPage;
import org.smileyface.docexplorer.fetch.FetchErrorType;
import org.smileyface.docexplorer.fetch.FetchException;
import org.smileyface.docexplorer.fetch.FetchStrategySelector;
import org.smileyface.docexplorer.fetch.FetchedPage;
import org.smileyface.docexplorer.model.LinkCandidate;
import org.smileyface.docexplorer.model.PageResult;
import org.smileyface.docexplorer.util.UrlUtils;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Explores a root page and its same-domain neighborhood, depth-first per branch and breadth-limited per page.
 *
 * <p>For every page: fetch, extract, drop boilerplate links, rank the rest by relevance (stable, so ties keep
 * document order) and keep the top {@code maxLinksPerPage} in the result. Of those, up to
 * {@code maxChildrenPerPage} same-host links not yet claimed in the request's {@link VisitedSet} are explored
 * one level deeper. Children run on the request's worker pool in groups of {@code fanOut}; a group must finish
 * before the next one starts. A failing branch contributes nothing and never aborts its siblings.</p>
 *
 * <p>Depth is 1-indexed from the caller's view: with {@code maxDepth = 1} only the root is fetched.</p>
 */
@Component
public class FrontierWalker {

    private static final Logger log = LoggerFactory.getLogger(FrontierWalker.class);

    private static final Comparator<LinkCandidate> BY_RELEVANCE_DESC =
            Comparator.comparingDouble(LinkCandidate::getRelevance).reversed();

    private final FetchStrategySelector fetcher;
    private final ContentExtractor extractor;
    private final ExplorerProperties properties;

    public FrontierWalker(FetchStrategySelector fetcher, ContentExtractor extractor, ExplorerProperties properties) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Explores from the context's root URI. A page's own result precedes the results of its children; child
     * results follow group order and, within a group, dispatch order.
     *
     * @return pages that were fetched and extracted successfully
     */
    public List<PageResult> walk(ExplorationContext ctx) {
        URI root = ctx.getRootUri();
        if (!ctx.getVisited().claim(root)) {
            return List.of();
        }
        return explore(root, 0, ctx);
    }

    private List<PageResult> explore(URI uri, int depth, ExplorationContext ctx) {
        if (depth >= ctx.getMaxDepth() || ctx.isCancelled()) {
            return List.of();
        }
        log.debug("Fetching {} (depth {}/{})", uri, depth, ctx.getMaxDepth());

        PageResult page;
        List<LinkCandidate> kept;
        try {
            ExtractedPage extracted = extractor.extract(fetch(uri, ctx));
            if (!extracted.hasContent()) {
                throw new FetchException(FetchErrorType.EMPTY_CONTENT, "Failed to extract content from " + uri);
            }
            kept = rank(extracted.links());
            page = new PageResult(uri, extracted.title(), extracted.content(), kept);
        } catch (FetchException e) {
            branchFailed(uri, depth, ctx, e);
            return List.of();
        } catch (RuntimeException e) {
            log.warn("Unexpected error while exploring {} (depth {})", uri, depth, e);
            branchFailed(uri, depth, ctx, new FetchException(FetchErrorType.NETWORK_ERROR, e.toString(), e));
            return List.of();
        }

        if (!ctx.recordCompleted(page)) {
            // finished after the deadline; the guard already answered with what it had
            return List.of();
        }
        List<PageResult> results = new ArrayList<>();
        results.add(page);

        if (depth + 1 < ctx.getMaxDepth()) {
            List<URI> children = claimChildren(kept, ctx);
            int fanOut = properties.getFanOut();
            for (int from = 0; from < children.size() && !ctx.isCancelled(); from += fanOut) {
                List<URI> group = children.subList(from, Math.min(from + fanOut, children.size()));
                results.addAll(runGroup(group, depth + 1, ctx));
            }
        }
        return results;
    }

    private FetchedPage fetch(URI uri, ExplorationContext ctx) throws FetchException {
        ctx.acquireFetchPermit();
        try {
            FetchedPage fetched = fetcher.fetch(uri, ctx);
            ctx.checkCancelled();
            return fetched;
        } finally {
            ctx.releaseFetchPermit();
        }
    }

    /**
     * Drops boilerplate navigation links, sorts by relevance and keeps the configured number of links.
     */
    List<LinkCandidate> rank(List<LinkCandidate> links) {
        List<LinkCandidate> ranked = new ArrayList<>(links.size());
        for (LinkCandidate link : links) {
            if (!properties.isBoilerplateLabel(link.getText())) {
                ranked.add(link);
            }
        }
        ranked.sort(BY_RELEVANCE_DESC);
        int limit = Math.min(properties.getMaxLinksPerPage(), ranked.size());
        return List.copyOf(ranked.subList(0, limit));
    }

    /**
     * Claims up to {@code maxChildrenPerPage} same-host links, in ranked order. A claimed URI is owned by this
     * branch from now on; siblings racing for it see it as visited.
     */
    private List<URI> claimChildren(List<LinkCandidate> ranked, ExplorationContext ctx) {
        URI root = ctx.getRootUri();
        int max = properties.getMaxChildrenPerPage();
        List<URI> children = new ArrayList<>();
        for (LinkCandidate link : ranked) {
            if (children.size() >= max) break;
            URI target = UrlUtils.withoutFragment(link.getUrl());
            if (!UrlUtils.isSameHost(target, root)) continue;
            if (ctx.getVisited().claim(target)) {
                children.add(target);
            }
        }
        return children;
    }

    private List<PageResult> runGroup(List<URI> group, int depth, ExplorationContext ctx) {
        List<Future<List<PageResult>>> futures = new ArrayList<>(group.size());
        try {
            for (URI child : group) {
                futures.add(ctx.submit(() -> explore(child, depth, ctx)));
            }
        } catch (RejectedExecutionException e) {
            // the pool only rejects once the request was cancelled
            futures.forEach(f -> f.cancel(true));
            return List.of();
        }

        List<PageResult> out = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Future<List<PageResult>> future = futures.get(i);
            try {
                out.addAll(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
                break;
            } catch (CancellationException e) {
                log.debug("Branch {} was cancelled", group.get(i));
            } catch (ExecutionException e) {
                log.warn("Branch {} failed", group.get(i), e.getCause());
            }
        }
        return out;
    }

    private static void branchFailed(URI uri, int depth, ExplorationContext ctx, FetchException e) {
        if (depth == 0) {
            ctx.recordRootFailure(e);
        }
        if (e.getType() == FetchErrorType.DEADLINE_EXCEEDED) {
            log.debug("Skipped {} (depth {}): {}", uri, depth, e.getMessage());
        } else {
            log.warn("Failed to explore {} (depth {}): {} - {}", uri, depth, e.getType(), e.getMessage());
        }
    }
}
