package no.cantara.accreditation.engine.mapping;

import no.cantara.accreditation.TimeBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blends keyword and embedding relevance as {@code (1 - w) * keyword + w * embedding}.
 *
 * <p>The embedding call runs on the supplied executor. Each call waits at most the
 * per-call timeout or what is left of the run's budget, whichever is shorter. The first
 * call that times out ends embedding for the rest of the run: later excerpts get the
 * keyword score alone, tagged {@link MappingMethod#KEYWORD}, and the run reports
 * {@link Run#timedOut()}. A failed or rejected call falls back for that excerpt only.
 */
public class HybridRelevanceScorer implements RelevanceScorer {

    private static final Logger log = LoggerFactory.getLogger(HybridRelevanceScorer.class);

    private final RelevanceScorer keyword;
    private final RelevanceScorer embedding;
    private final double embeddingWeight;
    private final Duration timeout;
    private final ExecutorService executor;

    public HybridRelevanceScorer(RelevanceScorer keyword, RelevanceScorer embedding, double embeddingWeight,
                                 Duration timeout, ExecutorService executor) {
        this.keyword = Objects.requireNonNull(keyword, "keyword");
        this.embedding = Objects.requireNonNull(embedding, "embedding");
        this.embeddingWeight = embeddingWeight;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public Relevance score(String excerpt, StandardProfile profile) {
        return startRun(TimeBudget.unlimited()).score(excerpt, profile);
    }

    @Override
    public Run startRun(TimeBudget budget) {
        return new BudgetedRun(Objects.requireNonNull(budget, "budget"));
    }

    private final class BudgetedRun implements Run {

        private final TimeBudget budget;
        private boolean timedOut;

        private BudgetedRun(TimeBudget budget) {
            this.budget = budget;
        }

        @Override
        public Relevance score(String excerpt, StandardProfile profile) {
            Relevance base = keyword.score(excerpt, profile);
            if (timedOut) {
                return base;
            }
            long waitMs = Math.min(timeout.toMillis(), budget.remainingMs());
            if (waitMs <= 0) {
                timedOut = true;
                log.warn("Embedding budget of {} ms spent; keyword scores from {} on",
                        budget.total().toMillis(), profile.standard().id());
                return base;
            }

            Future<Relevance> call;
            try {
                call = executor.submit(() -> embedding.score(excerpt, profile));
            } catch (RejectedExecutionException e) {
                log.warn("Embedding pool is saturated; using keyword score for {}", profile.standard().id());
                return base;
            }
            try {
                Relevance semantic = call.get(waitMs, TimeUnit.MILLISECONDS);
                double blended = (1.0 - embeddingWeight) * base.score() + embeddingWeight * semantic.score();
                return new Relevance(blended, MappingMethod.HYBRID);
            } catch (TimeoutException e) {
                call.cancel(true);
                timedOut = true;
                log.warn("Embedding call for {} exceeded {} ms; keyword scores for the rest of this run",
                        profile.standard().id(), waitMs);
                return base;
            } catch (ExecutionException e) {
                log.warn("Embedding call for {} failed; using keyword score: {}",
                        profile.standard().id(), e.getCause().toString());
                return base;
            } catch (InterruptedException e) {
                call.cancel(true);
                Thread.currentThread().interrupt();
                return base;
            }
        }

        @Override
        public boolean timedOut() {
            return timedOut;
        }
    }
}
