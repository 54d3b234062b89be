package no.cantara.accreditation.engine;

import no.cantara.accreditation.engine.trust.TrustWeights;

import java.time.Duration;

import static no.cantara.accreditation.engine.SettingsChecks.requirePositive;
import static no.cantara.accreditation.engine.SettingsChecks.requireUnit;

/**
 * Tunables for every engine component. {@link #DEFAULT} holds the documented defaults;
 * {@link EngineSettingsLoader} overlays a YAML file on top of them.
 */
public record EngineSettings(
        Mapper mapper,
        TrustWeights trust,
        Risk risk,
        Crosswalk crosswalk,
        Duration loaderBudget
) {
    /**
     * @param excerptWindow    Characters of context kept around a keyword hit.
     * @param maxExcerpts      Excerpts kept per mapping, best first.
     * @param minConfidence    Mappings below this confidence are dropped.
     * @param embeddingWeight  Share of the embedding score in the hybrid blend.
     * @param embeddingTimeout Budget for one embedding call before falling back to keywords.
     * @param embeddingBudget  Embedding time allowed for one whole mapping run.
     */
    public record Mapper(
            int excerptWindow,
            int maxExcerpts,
            double minConfidence,
            double embeddingWeight,
            Duration embeddingTimeout,
            Duration embeddingBudget
    ) {
        public static final Mapper DEFAULT = new Mapper(240, 3, 0.0, 0.5, Duration.ofSeconds(2),
                Duration.ofSeconds(10));

        public Mapper {
            if (excerptWindow < 20) throw new ValidationException("mapper.excerpt_window must be at least 20");
            if (maxExcerpts < 1) throw new ValidationException("mapper.max_excerpts must be at least 1");
            requireUnit("mapper.min_confidence", minConfidence);
            requireUnit("mapper.embedding_weight", embeddingWeight);
            requirePositive("mapper.embedding_timeout", embeddingTimeout);
            requirePositive("mapper.embedding_budget", embeddingBudget);
        }
    }

    /**
     * The factor weights are fixed, see {@link no.cantara.accreditation.engine.risk.RiskFactor#weight()}.
     *
     * @param mappingTarget  Mapping count at which the density penalty reaches zero.
     * @param recencyFloor   Evidence age at which the recency factor starts to rise.
     * @param recencyCeiling Evidence age at which the recency factor saturates.
     * @param parallelism    Worker threads for bulk scoring.
     */
    public record Risk(
            int mappingTarget,
            Duration recencyFloor,
            Duration recencyCeiling,
            int parallelism
    ) {
        public static final Risk DEFAULT = new Risk(3, Duration.ofDays(365),
                Duration.ofDays(1095), Runtime.getRuntime().availableProcessors());

        public Risk {
            if (mappingTarget < 1) throw new ValidationException("risk.mapping_target must be at least 1");
            requirePositive("risk.recency_floor", recencyFloor);
            requirePositive("risk.recency_ceiling", recencyCeiling);
            if (recencyCeiling.compareTo(recencyFloor) <= 0) {
                throw new ValidationException("risk.recency_ceiling must exceed risk.recency_floor");
            }
            if (parallelism < 1) throw new ValidationException("risk.parallelism must be at least 1");
        }
    }

    public record Crosswalk(double threshold, int topK, Duration budget) {
        public static final Crosswalk DEFAULT = new Crosswalk(0.3, 10, Duration.ofSeconds(30));

        public Crosswalk {
            requireUnit("crosswalk.threshold", threshold);
            if (topK < 1) throw new ValidationException("crosswalk.top_k must be at least 1");
            requirePositive("crosswalk.budget", budget);
        }
    }

    public static final EngineSettings DEFAULT = new EngineSettings(
            Mapper.DEFAULT, TrustWeights.EQUAL, Risk.DEFAULT, Crosswalk.DEFAULT, Duration.ofSeconds(60));

    public EngineSettings {
        if (mapper == null || trust == null || risk == null || crosswalk == null) {
            throw new ValidationException("every settings section is required");
        }
        requirePositive("loader.budget", loaderBudget);
    }
}
