package no.cantara.accreditation.engine.mapping;

import no.cantara.accreditation.TimeBudget;

/**
 * Strategy scoring how well a window of evidence text supports a standard.
 * Implementations must be thread-safe.
 */
public interface RelevanceScorer {

    Relevance score(String excerpt, StandardProfile profile);

    /**
     * Starts the scoring of one mapping run. Scorers that call slow services spend
     * at most {@code budget} on them across the whole run.
     */
    default Run startRun(TimeBudget budget) {
        return this::score;
    }

    /** Scoring state of one mapping run. Used by a single thread. */
    @FunctionalInterface
    interface Run {

        Relevance score(String excerpt, StandardProfile profile);

        /** True once the run stopped waiting for a slow dependency and fell back to keyword scores. */
        default boolean timedOut() {
            return false;
        }
    }
}
