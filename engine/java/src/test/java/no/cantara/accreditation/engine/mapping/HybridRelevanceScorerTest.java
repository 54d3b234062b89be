package no.cantara.accreditation.engine.mapping;

import no.cantara.accreditation.TimeBudget;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HybridRelevanceScorerTest {

    private static final StandardProfile PROFILE = StandardProfile.of(KeywordRelevanceScorerTest.FACULTY);
    private static final RelevanceScorer KEYWORD = (excerpt, profile) -> new Relevance(0.4, MappingMethod.KEYWORD);

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final CountDownLatch release = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    private HybridRelevanceScorer hybrid(RelevanceScorer embedding, Duration timeout) {
        return new HybridRelevanceScorer(KEYWORD, embedding, 0.5, timeout, executor);
    }

    @Test
    void blendsKeywordAndEmbeddingScores() {
        Relevance r = hybrid((e, p) -> new Relevance(0.8, MappingMethod.EMBEDDING), Duration.ofSeconds(5))
                .score("faculty", PROFILE);
        assertEquals(0.6, r.score(), 1e-9);
        assertEquals(MappingMethod.HYBRID, r.method());
    }

    private RelevanceScorer stuck(AtomicInteger calls) {
        return (e, p) -> {
            calls.incrementAndGet();
            try {
                release.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return new Relevance(1.0, MappingMethod.EMBEDDING);
        };
    }

    @Test
    void fallsBackToKeywordScoreOnTimeout() {
        Relevance r = hybrid(stuck(new AtomicInteger()), Duration.ofMillis(50)).score("faculty", PROFILE);
        assertEquals(0.4, r.score(), 1e-9);
        assertEquals(MappingMethod.KEYWORD, r.method());
    }

    @Test
    void fallsBackToKeywordScoreOnFailure() {
        RelevanceScorer broken = (e, p) -> {
            throw new IllegalStateException("model offline");
        };
        Relevance r = hybrid(broken, Duration.ofSeconds(5)).score("faculty", PROFILE);
        assertEquals(0.4, r.score(), 1e-9);
        assertEquals(MappingMethod.KEYWORD, r.method());
    }

    @Test
    void runStopsCallingTheModelAfterATimeout() {
        AtomicInteger calls = new AtomicInteger();
        RelevanceScorer.Run run = hybrid(stuck(calls), Duration.ofMillis(100))
                .startRun(new TimeBudget(Duration.ofSeconds(30)));

        long started = System.nanoTime();
        for (int i = 0; i < 20; i++) {
            Relevance r = run.score("faculty", PROFILE);
            assertEquals(MappingMethod.KEYWORD, r.method());
            assertEquals(0.4, r.score(), 1e-9);
        }
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertTrue(run.timedOut());
        assertEquals(1, calls.get());
        assertTrue(elapsedMs < 2_000, "took " + elapsedMs + " ms");
    }

    @Test
    void spentBudgetSkipsTheModel() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        TimeBudget spent = new TimeBudget(Duration.ofMillis(1));
        Thread.sleep(5);
        RelevanceScorer.Run run = hybrid(stuck(calls), Duration.ofSeconds(5)).startRun(spent);

        assertEquals(MappingMethod.KEYWORD, run.score("faculty", PROFILE).method());
        assertTrue(run.timedOut());
        assertEquals(0, calls.get());
    }

    @Test
    void runWithinBudgetIsNotFlagged() {
        RelevanceScorer.Run run = hybrid((e, p) -> new Relevance(0.8, MappingMethod.EMBEDDING), Duration.ofSeconds(5))
                .startRun(new TimeBudget(Duration.ofSeconds(30)));
        assertEquals(MappingMethod.HYBRID, run.score("faculty", PROFILE).method());
        assertEquals(MappingMethod.HYBRID, run.score("faculty", PROFILE).method());
        assertFalse(run.timedOut());
    }

    @Test
    void rejectedCallFallsBackWithoutEndingTheRun() {
        executor.shutdownNow();
        RelevanceScorer.Run run = hybrid((e, p) -> new Relevance(0.8, MappingMethod.EMBEDDING), Duration.ofSeconds(5))
                .startRun(new TimeBudget(Duration.ofSeconds(30)));
        assertEquals(0.4, run.score("faculty", PROFILE).score(), 1e-9);
        assertFalse(run.timedOut());
    }

    @Test
    void keywordScorerRunNeverTimesOut() {
        RelevanceScorer.Run run = KEYWORD.startRun(new TimeBudget(Duration.ofMillis(1)));
        assertEquals(0.4, run.score("faculty", PROFILE).score(), 1e-9);
        assertFalse(run.timedOut());
    }
}
