package org.smileyface.docexplorer.crawler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.docexplorer.fetch.FetchErrorType;
import org.smileyface.docexplorer.fetch.FetchException;
import org.smileyface.docexplorer.model.ExplorationState;
import org.smileyface.docexplorer.model.PageResult;
import org.smileyface.docexplorer.render.RenderSession;
import org.smileyface.docexplorer.render.RenderingEngineLauncher;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Everything one exploration request owns: visited set, completed pages, cancellation flag, worker pool,
 * fetch permits and render session. Created per request and closed when the request ends, whatever the
 * outcome; nothing in here is shared with other requests.
 */
public final class ExplorationContext implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(ExplorationContext.class);

    private final String id = UUID.randomUUID().toString().substring(0, 8);
    private final URI rootUri;
    private final int maxDepth;
    private final ExplorerProperties properties;

    private final VisitedSet visited = new VisitedSet();
    private final List<PageResult> completed = new ArrayList<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Semaphore fetchPermits;
    private final ExecutorService workers;
    private final RenderSession renderSession;

    private volatile ExplorationState state = ExplorationState.IDLE;
    private volatile Instant startedAt;
    private volatile FetchException rootFailure;

    public ExplorationContext(URI rootUri, int maxDepth, ExplorerProperties properties,
                              RenderingEngineLauncher launcher) {
        this.rootUri = Objects.requireNonNull(rootUri, "rootUri");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.maxDepth = Math.max(1, maxDepth);
        this.fetchPermits = new Semaphore(properties.getMaxConcurrentFetches(), true);
        this.workers = Executors.newCachedThreadPool(namedThreads("explore-" + id));
        this.renderSession = new RenderSession(id, launcher, properties.getRender());
    }

    public String getId() { return id; }

    public URI getRootUri() { return rootUri; }

    public int getMaxDepth() { return maxDepth; }

    public ExplorerProperties getProperties() { return properties; }

    public VisitedSet getVisited() { return visited; }

    public RenderSession getRenderSession() { return renderSession; }

    public ExplorationState getState() { return state; }

    public FetchException getRootFailure() { return rootFailure; }

    void recordRootFailure(FetchException failure) {
        this.rootFailure = failure;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Marks the request cancelled and interrupts its workers. Pages completing afterwards are discarded.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Exploration {} cancelled ({} page(s) completed)", id, completedCount());
            workers.shutdownNow();
        }
    }

    /**
     * @throws FetchException with {@link FetchErrorType#DEADLINE_EXCEEDED} once the request was cancelled
     */
    public void checkCancelled() throws FetchException {
        if (cancelled.get() || Thread.currentThread().isInterrupted()) {
            throw new FetchException(FetchErrorType.DEADLINE_EXCEEDED, "Exploration " + id + " was cancelled");
        }
    }

    /**
     * Sleeps for a retry backoff, returning early with an exception when the request is cancelled.
     */
    public void pause(long millis) throws FetchException {
        checkCancelled();
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchErrorType.DEADLINE_EXCEEDED, "Interrupted while backing off", e);
        }
        checkCancelled();
    }

    /**
     * Blocks until a fetch slot is free. Every successful call must be paired with {@link #releaseFetchPermit()}.
     */
    public void acquireFetchPermit() throws FetchException {
        checkCancelled();
        try {
            fetchPermits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchErrorType.DEADLINE_EXCEEDED, "Interrupted while waiting for a fetch slot", e);
        }
    }

    public void releaseFetchPermit() {
        fetchPermits.release();
    }

    /**
     * Runs a task on this request's worker pool.
     *
     * @throws java.util.concurrent.RejectedExecutionException when the request was cancelled
     */
    public <T> Future<T> submit(Callable<T> task) {
        return workers.submit(task);
    }

    /**
     * Records a fully extracted page. Ignored once the request is cancelled.
     *
     * @return true if the page was recorded
     */
    public boolean recordCompleted(PageResult page) {
        synchronized (completed) {
            if (cancelled.get()) return false;
            completed.add(page);
            return true;
        }
    }

    /** Pages completed so far, in completion order. */
    public List<PageResult> completedPages() {
        synchronized (completed) {
            return List.copyOf(completed);
        }
    }

    public int completedCount() {
        synchronized (completed) {
            return completed.size();
        }
    }

    public Duration elapsed() {
        Instant start = startedAt;
        return start == null ? Duration.ZERO : Duration.between(start, Instant.now());
    }

    /**
     * Moves the request to a new state with structured logging; terminal states include the duration.
     */
    public void transitionTo(ExplorationState newState) {
        ExplorationState old = this.state;
        if (newState == ExplorationState.EXPLORING) {
            if (startedAt == null) startedAt = Instant.now();
            this.state = newState;
            log.info("Exploration {} state {} -> {} (root={}, maxDepth={})", id, old, newState, rootUri, maxDepth);
            return;
        }
        this.state = newState;
        if (newState.isTerminal()) {
            log.info("Exploration {} state {} -> {} after {} ms (pages={}, visited={})",
                    id, old, newState, elapsed().toMillis(), completedCount(), visited.size());
        } else {
            log.info("Exploration {} state {} -> {}", id, old, newState);
        }
    }

    /**
     * Stops the worker pool and releases the rendering engine. Safe to call more than once.
     */
    @Override
    public void close() {
        workers.shutdownNow();
        renderSession.close();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
