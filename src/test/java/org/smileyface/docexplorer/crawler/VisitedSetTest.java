package org.smileyface.docexplorer.crawler;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

class VisitedSetTest {

    @Test
    void claim_sameNormalizedUriOnlyOnce() {
        VisitedSet visited = new VisitedSet();
        assertThat(visited.claim(URI.create("http://Example.com/docs#intro"))).isTrue();
        assertThat(visited.claim(URI.create("http://example.com:80/docs"))).isFalse();
        assertThat(visited.claim(URI.create("http://example.com/docs?page=2"))).isTrue();
        assertThat(visited.size()).isEqualTo(2);
        assertThat(visited.contains(URI.create("http://example.com/docs#other"))).isTrue();
    }

    @Test
    void claim_nonHttpNeverClaimed() {
        VisitedSet visited = new VisitedSet();
        assertThat(visited.claim(URI.create("mailto:a@b.c"))).isFalse();
        assertThat(visited.size()).isZero();
    }

    @Test
    void claim_concurrentRaceHasExactlyOneWinner() throws Exception {
        VisitedSet visited = new VisitedSet();
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Boolean> task = () -> {
                    start.await();
                    return visited.claim(URI.create("https://docs.example.com/shared"));
                };
                results.add(pool.submit(task));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> f : results) {
                if (f.get()) winners++;
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
