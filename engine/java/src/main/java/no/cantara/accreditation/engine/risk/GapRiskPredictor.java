package no.cantara.accreditation.engine.risk;

import no.cantara.accreditation.CorpusSnapshot;
import no.cantara.accreditation.engine.EngineSettings;
import no.cantara.accreditation.engine.ExplainedValue;
import no.cantara.accreditation.engine.Scores;
import no.cantara.accreditation.engine.ValidationException;
import no.cantara.accreditation.engine.evidence.EvidenceLedger;
import no.cantara.accreditation.engine.evidence.StandardEvidence;
import no.cantara.accreditation.model.StandardNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Predicts per-standard gap risk from four factors:
 * <pre>
 * coverage_gap     = 1 when the standard has no mapping, else 0
 * evidence_quality = 1 - standard trust (1 without trust data)
 * mapping_density  = 1 - min(mappings / target, 1)
 * recency          = mean over evidence of (age - floor) / (ceiling - floor), clamped; 1 without evidence
 * final_risk       = 0.40 coverage_gap + 0.25 evidence_quality + 0.20 mapping_density + 0.15 recency
 * </pre>
 * Scores are computed against the snapshot current at call time and never cached.
 */
public class GapRiskPredictor {

    private static final Logger log = LoggerFactory.getLogger(GapRiskPredictor.class);
    private static final int MAX_ISSUES = 3;
    private static final int MAX_TOP_ISSUES = 5;
    private static final double ELEVATED = 0.5;

    private final Supplier<CorpusSnapshot> snapshots;
    private final EvidenceLedger ledger;
    private final EngineSettings.Risk settings;
    private final Executor executor;

    public GapRiskPredictor(Supplier<CorpusSnapshot> snapshots, EvidenceLedger ledger,
                            EngineSettings.Risk settings, Executor executor) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * @throws ValidationException if no loaded standard has this id
     */
    public RiskScore scoreStandard(String standardId) {
        StandardNode standard = snapshots.get().standard(standardId)
                .orElseThrow(() -> new ValidationException("unknown standard: " + standardId));
        return score(standard.id());
    }

    /**
     * Scores the given standards in parallel. Ids that are not loaded, or whose
     * scoring fails, are skipped. Results keep the order of the input.
     */
    public List<RiskScore> scoreBulk(Collection<String> standardIds) {
        CorpusSnapshot snapshot = snapshots.get();
        List<CompletableFuture<Optional<RiskScore>>> futures = new ArrayList<>(standardIds.size());
        for (String id : standardIds) {
            if (snapshot.standard(id).isEmpty()) {
                log.debug("Skipping risk for unknown standard {}", id);
                continue;
            }
            futures.add(CompletableFuture.supplyAsync(() -> Optional.of(score(id)), executor)
                    .exceptionally(e -> {
                        log.warn("Risk scoring of {} failed: {}", id, e.toString());
                        return Optional.empty();
                    }));
        }
        List<RiskScore> scores = new ArrayList<>(futures.size());
        for (CompletableFuture<Optional<RiskScore>> future : futures) {
            future.join().ifPresent(scores::add);
        }
        return scores;
    }

    /** Scores every standard of the current snapshot, or of one accreditor when given. */
    public List<RiskScore> scoreAll(String accreditor) {
        CorpusSnapshot snapshot = snapshots.get();
        List<StandardNode> standards = accreditor == null ? snapshot.standards() : snapshot.standards(accreditor);
        return scoreBulk(standards.stream().map(StandardNode::id).toList());
    }

    RiskScore score(String standardId) {
        StandardEvidence evidence = ledger.evidenceFor(standardId);

        double coverageGap = evidence.hasEvidence() ? 0.0 : 1.0;
        double evidenceQuality = 1.0 - evidence.standardTrust().orElse(0.0);
        double mappingDensity = 1.0 - Math.min((double) evidence.mappingCount() / settings.mappingTarget(), 1.0);
        double recency = recency(evidence.evidenceAgesDays());

        Map<RiskFactor, Double> contributions = new EnumMap<>(RiskFactor.class);
        contributions.put(RiskFactor.COVERAGE_GAP, RiskFactor.COVERAGE_GAP.weight() * coverageGap);
        contributions.put(RiskFactor.EVIDENCE_QUALITY, RiskFactor.EVIDENCE_QUALITY.weight() * Scores.clamp(evidenceQuality));
        contributions.put(RiskFactor.MAPPING_DENSITY, RiskFactor.MAPPING_DENSITY.weight() * Scores.clamp(mappingDensity));
        contributions.put(RiskFactor.RECENCY, RiskFactor.RECENCY.weight() * recency);

        double finalRisk = Scores.clamp(contributions.values().stream().mapToDouble(Double::doubleValue).sum());
        RiskBucket bucket = RiskBucket.of(finalRisk);
        Map<RiskFactor, Double> components = Map.of(
                RiskFactor.COVERAGE_GAP, coverageGap,
                RiskFactor.EVIDENCE_QUALITY, Scores.clamp(evidenceQuality),
                RiskFactor.MAPPING_DENSITY, Scores.clamp(mappingDensity),
                RiskFactor.RECENCY, recency);

        return new RiskScore(standardId, coverageGap, evidenceQuality, mappingDensity, recency, finalRisk, bucket,
                contributions, predictIssues(components, contributions, finalRisk),
                explain(finalRisk, bucket, contributions, evidence));
    }

    double recency(List<Long> agesDays) {
        if (agesDays.isEmpty()) return 1.0;
        double floor = settings.recencyFloor().toDays();
        double span = settings.recencyCeiling().toDays() - floor;
        return Scores.clamp(agesDays.stream()
                .mapToDouble(age -> Scores.clamp(Scores.ratio(age - floor, span, 1.0)))
                .average()
                .orElse(1.0));
    }

    private static List<String> predictIssues(Map<RiskFactor, Double> components,
                                              Map<RiskFactor, Double> contributions, double finalRisk) {
        List<String> issues = components.entrySet().stream()
                .filter(e -> e.getValue() > ELEVATED)
                .sorted(Comparator.comparingDouble((Map.Entry<RiskFactor, Double> e) -> contributions.get(e.getKey()))
                        .reversed()
                        .thenComparing(e -> e.getKey().ordinal()))
                .limit(MAX_ISSUES)
                .map(e -> e.getKey().issue())
                .toList();
        if (issues.isEmpty() && finalRisk >= RiskBucket.HIGH.floor()) {
            return List.of("Multiple risk factors elevated: comprehensive review needed");
        }
        return issues;
    }

    private static String explain(double finalRisk, RiskBucket bucket, Map<RiskFactor, Double> contributions,
                                  StandardEvidence evidence) {
        Map.Entry<RiskFactor, Double> largest = contributions.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .orElseThrow();
        return String.format(Locale.ROOT, "Risk %s (%s) from %d mapping(s). Largest factor: %s contributes %.2f.",
                Scores.percent(finalRisk), bucket.name().toLowerCase(Locale.ROOT), evidence.mappingCount(),
                largest.getKey().label(), largest.getValue());
    }

    /**
     * Bucket distribution, average risk and the dominant factors of {@code scores}.
     * With nothing scored the average is 0.0 with an explanation.
     */
    public RiskSummary aggregate(Collection<RiskScore> scores) {
        Map<RiskBucket, Integer> buckets = new EnumMap<>(RiskBucket.class);
        Map<RiskFactor, Double> totals = new EnumMap<>(RiskFactor.class);
        Map<String, Integer> issueCounts = new HashMap<>();
        double sum = 0.0;
        for (RiskScore score : scores) {
            buckets.merge(score.bucket(), 1, Integer::sum);
            score.contributions().forEach((factor, c) -> totals.merge(factor, c, Double::sum));
            score.predictedIssues().forEach(issue -> issueCounts.merge(issue, 1, Integer::sum));
            sum += score.finalRisk();
        }

        ExplainedValue average;
        if (scores.isEmpty()) {
            average = ExplainedValue.of(0.0, "No standards were scored, so there is no risk to average.");
        } else {
            double mean = Scores.clamp(sum / scores.size());
            average = ExplainedValue.of(mean, String.format(Locale.ROOT,
                    "Average risk %s over %d scored standard(s); %d critical, %d high.",
                    Scores.percent(mean), scores.size(),
                    buckets.getOrDefault(RiskBucket.CRITICAL, 0), buckets.getOrDefault(RiskBucket.HIGH, 0)));
        }

        double grandTotal = totals.values().stream().mapToDouble(Double::doubleValue).sum();
        List<RiskSummary.FactorShare> factors = totals.entrySet().stream()
                .filter(e -> e.getValue() > 0.0)
                .sorted(Map.Entry.<RiskFactor, Double>comparingByValue().reversed())
                .map(e -> new RiskSummary.FactorShare(e.getKey(), e.getValue(),
                        Scores.ratio(e.getValue(), grandTotal, 0.0)))
                .toList();

        List<String> topIssues = issueCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(MAX_TOP_ISSUES)
                .map(Map.Entry::getKey)
                .toList();

        return new RiskSummary(scores.size(), buckets, average, factors, topIssues);
    }
}
