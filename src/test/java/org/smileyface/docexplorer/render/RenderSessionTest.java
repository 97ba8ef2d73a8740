package org.smileyface.docexplorer.render;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.docexplorer.crawler.ExplorerProperties;
import org.smileyface.docexplorer.fetch.FetchErrorType;
import org.smileyface.docexplorer.fetch.FetchException;
import org.smileyface.docexplorer.testutil.FakeRenderingEngine;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RenderSessionTest {

    private ExplorerProperties.Render config;

    @BeforeEach
    void setUp() {
        config = new ExplorerProperties.Render();
        config.setLaunchAttempts(3);
        config.setRetryBackoffMs(1);
        config.setCloseTimeoutMs(2000);
    }

    @Test
    void call_launchesLazilyAndReusesEngine() throws Exception {
        AtomicInteger launches = new AtomicInteger();
        FakeRenderingEngine engine = new FakeRenderingEngine();
        RenderSession session = new RenderSession("req1", () -> {
            launches.incrementAndGet();
            return engine;
        }, config);

        assertThat(session.isEngineRunning()).isFalse();
        assertThat(launches).hasValue(0);

        RenderingEngine first = session.call(e -> e);
        RenderingEngine second = session.call(e -> e);

        assertThat(first).isSameAs(engine).isSameAs(second);
        assertThat(launches).hasValue(1);
        assertThat(session.isEngineRunning()).isTrue();

        session.close();
        assertThat(engine.isClosed()).isTrue();
        assertThat(session.isEngineRunning()).isFalse();
    }

    @Test
    void call_failedLaunchIsRetried() throws Exception {
        AtomicInteger launches = new AtomicInteger();
        FakeRenderingEngine engine = new FakeRenderingEngine();
        RenderSession session = new RenderSession("req2", () -> {
            if (launches.incrementAndGet() < 3) throw new IllegalStateException("browser crashed on start");
            return engine;
        }, config);

        try (session) {
            RenderingEngine launched = session.call(e -> e);
            assertThat(launched).isSameAs(engine);
            assertThat(launches).hasValue(3);
        }
    }

    @Test
    void call_launchFailingEveryAttempt_isEngineUnavailable() {
        AtomicInteger launches = new AtomicInteger();
        RenderSession session = new RenderSession("req3", () -> {
            launches.incrementAndGet();
            throw new IllegalStateException("no browser installed");
        }, config);

        try (session) {
            FetchException e = catchThrowableOfType(() -> session.call(engine -> engine), FetchException.class);
            assertThat(e.getType()).isEqualTo(FetchErrorType.ENGINE_UNAVAILABLE);
            assertThat(e.getMessage()).contains("after 3 attempts").contains("no browser installed");
            assertThat(launches).hasValue(3);
        }
    }

    @Test
    void call_disabledLauncher_failsWithoutLaunching() {
        RenderSession session = new RenderSession("req4", RenderingEngineLauncher.unavailable(), config);

        FetchException e = catchThrowableOfType(() -> session.call(engine -> engine), FetchException.class);

        assertThat(e.getType()).isEqualTo(FetchErrorType.ENGINE_UNAVAILABLE);
        session.close();
    }

    @Test
    void call_afterClose_isRejected() {
        RenderSession session = new RenderSession("req5", FakeRenderingEngine::new, config);
        session.close();

        FetchException e = catchThrowableOfType(() -> session.call(engine -> engine), FetchException.class);

        assertThat(e.getType()).isEqualTo(FetchErrorType.DEADLINE_EXCEEDED);
    }

    @Test
    void call_unexpectedErrorIsClassifiedAsRenderFailure() {
        RenderSession session = new RenderSession("req6", FakeRenderingEngine::new, config);

        try (session) {
            FetchException e = catchThrowableOfType(() -> session.call(engine -> {
                throw new IllegalStateException("target closed");
            }), FetchException.class);
            assertThat(e.getType()).isEqualTo(FetchErrorType.RENDER_TIMEOUT);
            assertThat(e.getMessage()).contains("target closed");
        }
    }

    @Test
    void call_concurrentCallersAreSerializedOnOneThread() throws Exception {
        RenderSession session = new RenderSession("req7", FakeRenderingEngine::new, config);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        ExecutorService callers = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try (session) {
            Future<?>[] futures = new Future<?>[4];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = callers.submit(() -> {
                    start.await();
                    return session.call(engine -> {
                        maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                        try {
                            Thread.sleep(20);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        active.decrementAndGet();
                        return Thread.currentThread().getName();
                    });
                });
            }
            start.countDown();
            for (Future<?> f : futures) {
                assertThat(f.get(5, TimeUnit.SECONDS)).isEqualTo("render-req7");
            }
            assertThat(maxActive).hasValue(1);
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void close_interruptsRunningCallAndReleasesEngine() throws Exception {
        FakeRenderingEngine engine = new FakeRenderingEngine();
        RenderSession session = new RenderSession("req8", () -> engine, config);
        CountDownLatch started = new CountDownLatch(1);
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<FetchException> pending = caller.submit(() -> catchThrowableOfType(() -> session.call(e -> {
                started.countDown();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new FetchException(FetchErrorType.DEADLINE_EXCEEDED, "interrupted");
                }
                return e;
            }), FetchException.class));

            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            session.close();

            FetchException failure = pending.get(5, TimeUnit.SECONDS);
            assertThat(failure).isNotNull();
            assertThat(failure.getType()).isEqualTo(FetchErrorType.DEADLINE_EXCEEDED);
            assertThat(engine.isClosed()).isTrue();
        } finally {
            caller.shutdownNow();
        }
    }

    @Test
    void close_releasesEngineOnceCallIgnoringInterruptReturns() throws Exception {
        config.setCloseTimeoutMs(200);
        FakeRenderingEngine engine = new FakeRenderingEngine();
        RenderSession session = new RenderSession("req9", () -> engine, config);
        CountDownLatch started = new CountDownLatch(1);
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            caller.submit(() -> session.call(e -> {
                started.countDown();
                long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(800);
                while (System.nanoTime() < until) {
                    Thread.onSpinWait();
                }
                return e;
            }));

            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            long start = System.nanoTime();
            session.close();
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(700);
            assertThat(engine.isClosed()).isFalse();

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!engine.isClosed() && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }
            assertThat(engine.isClosed()).isTrue();
        } finally {
            caller.shutdownNow();
        }
    }
}
