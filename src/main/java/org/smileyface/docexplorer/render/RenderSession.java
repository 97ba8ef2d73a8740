package org.smileyface.docexplorer.render;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.docexplorer.crawler.ExplorerProperties;
import org.smileyface.docexplorer.fetch.FetchErrorType;
import org.smileyface.docexplorer.fetch.FetchException;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns at most one rendering engine for a single exploration request.
 *
 * <p>The engine is launched lazily on first use and reused for later rendered fetches of the same request.
 * All engine calls, the launch and the release run on one dedicated thread, so concurrent branches are
 * serialized and the engine never sees two threads. A failed launch is retried a bounded number of times
 * per call. {@link #close()} releases the engine; later calls are rejected.</p>
 */
public final class RenderSession implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(RenderSession.class);

    /**
     * Work executed against the engine on the session thread.
     */
    @FunctionalInterface
    public interface EngineCall<T> {
        T apply(RenderingEngine engine) throws FetchException;
    }

    private final String requestId;
    private final RenderingEngineLauncher launcher;
    private final ExplorerProperties.Render config;

    private final Object lock = new Object();
    private ExecutorService engineThread;   // guarded by lock, created on first call
    private Future<?> inFlight;             // guarded by lock
    private boolean closed;                 // guarded by lock

    private RenderingEngine engine;         // confined to engineThread

    public RenderSession(String requestId, RenderingEngineLauncher launcher, ExplorerProperties.Render config) {
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Runs the call against this session's engine, launching it first if needed, and waits for the result.
     *
     * @throws FetchException {@link FetchErrorType#ENGINE_UNAVAILABLE} when no engine could be launched,
     *                        {@link FetchErrorType#DEADLINE_EXCEEDED} when interrupted or closed, or
     *                        whatever the call itself throws
     */
    public <T> T call(EngineCall<T> call) throws FetchException {
        if (!launcher.isAvailable()) {
            throw new FetchException(FetchErrorType.ENGINE_UNAVAILABLE, "Rendered fetching is disabled");
        }
        Future<T> future;
        synchronized (lock) {
            if (closed) {
                throw new FetchException(FetchErrorType.DEADLINE_EXCEEDED, "Render session " + requestId + " is closed");
            }
            if (engineThread == null) {
                engineThread = Executors.newSingleThreadExecutor(r -> {
                    Thread t = new Thread(r, "render-" + requestId);
                    t.setDaemon(true);
                    return t;
                });
            }
            future = engineThread.submit(() -> call.apply(acquire()));
            inFlight = future;
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new FetchException(FetchErrorType.DEADLINE_EXCEEDED, "Interrupted while rendering", e);
        } catch (CancellationException e) {
            throw new FetchException(FetchErrorType.DEADLINE_EXCEEDED, "Rendering was cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FetchException fe) {
                throw fe;
            }
            throw new FetchException(FetchErrorType.RENDER_TIMEOUT, "Rendering failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * True once an engine was launched and not yet released.
     */
    public boolean isEngineRunning() {
        ExecutorService thread;
        synchronized (lock) {
            thread = engineThread;
            if (thread == null || closed) return false;
        }
        try {
            return thread.submit(() -> engine != null).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            return false;
        }
    }

    /**
     * Interrupts the running call, if any, releases the engine and stops the session thread. Waits at most
     * the configured close timeout; a call that ignores the interrupt delays the release until it returns,
     * but never skips it.
     */
    @Override
    public void close() {
        ExecutorService thread;
        Future<?> running;
        synchronized (lock) {
            if (closed) return;
            closed = true;
            thread = engineThread;
            running = inFlight;
        }
        if (thread == null) return;

        if (running != null && !running.isDone()) {
            running.cancel(true);
        }
        Future<?> release = thread.submit(this::releaseEngine);
        thread.shutdown();
        try {
            release.get(config.getCloseTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // the queued release still runs once the engine call returns
            log.warn("Render session {} did not release its engine within {} ms; it will be released when the running call returns",
                    requestId, config.getCloseTimeoutMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Render session {} was interrupted while releasing its engine", requestId);
        } catch (ExecutionException e) {
            log.warn("Render session {} failed to release its engine", requestId, e.getCause());
        }
    }

    private RenderingEngine acquire() throws FetchException {
        if (engine != null) return engine;
        int attempts = config.getLaunchAttempts();
        Exception last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new FetchException(FetchErrorType.DEADLINE_EXCEEDED, "Interrupted before engine launch");
            }
            try {
                engine = launcher.launch();
                log.info("Render session {} launched rendering engine (attempt {}/{})", requestId, attempt, attempts);
                return engine;
            } catch (Exception e) {
                last = e;
                log.warn("Render session {} engine launch attempt {}/{} failed: {}",
                        requestId, attempt, attempts, e.getMessage());
                if (attempt < attempts) {
                    backoff();
                }
            }
        }
        throw new FetchException(FetchErrorType.ENGINE_UNAVAILABLE,
                "Rendering engine could not be launched after " + attempts + " attempts: "
                        + (last != null ? last.getMessage() : "unknown error"), last);
    }

    private void backoff() throws FetchException {
        try {
            Thread.sleep(config.getRetryBackoffMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchErrorType.DEADLINE_EXCEEDED, "Interrupted during launch backoff", e);
        }
    }

    private void releaseEngine() {
        if (engine == null) return;
        try {
            engine.close();
            log.info("Render session {} released rendering engine", requestId);
        } finally {
            engine = null;
        }
    }
}
