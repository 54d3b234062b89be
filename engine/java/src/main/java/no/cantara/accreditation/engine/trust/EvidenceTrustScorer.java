package no.cantara.accreditation.engine.trust;

import no.cantara.accreditation.engine.ExplainedValue;
import no.cantara.accreditation.engine.Scores;
import no.cantara.accreditation.engine.ValidationException;
import no.cantara.accreditation.engine.mapping.EvidenceDocument;
import no.cantara.accreditation.engine.mapping.EvidenceMapping;
import no.cantara.accreditation.engine.mapping.Excerpt;
import no.cantara.accreditation.engine.text.Headings;
import no.cantara.accreditation.engine.text.PagedText;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Scores how far a mapped document can be trusted as evidence for its standard.
 *
 * <ul>
 *   <li>quality: half the mean excerpt score, half the distinct matched keywords
 *       (saturating at five)</li>
 *   <li>reliability: the score of the document's {@link no.cantara.accreditation.engine.mapping.EvidenceSource}</li>
 *   <li>confidence: the mapping confidence</li>
 *   <li>freshness: steps down with document age, from 1.0 within a quarter to 0.1 past two years</li>
 *   <li>completeness: text length (0.4), page structure (0.3) and section headings (0.3)</li>
 * </ul>
 */
public class EvidenceTrustScorer {

    static final int KEYWORD_SATURATION = 5;
    private static final int MAX_RECOMMENDATIONS = 3;

    private final TrustWeights weights;
    private final Clock clock;

    public EvidenceTrustScorer(TrustWeights weights, Clock clock) {
        this.weights = Objects.requireNonNull(weights, "weights");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public EvidenceTrustScorer() {
        this(TrustWeights.EQUAL, Clock.systemUTC());
    }

    public TrustScore score(EvidenceDocument document, EvidenceMapping mapping) {
        if (document == null) throw new ValidationException("document is required");
        if (mapping == null) throw new ValidationException("mapping is required");
        if (!document.id().equals(mapping.documentId())) {
            throw new ValidationException("mapping " + mapping.key() + " does not belong to document " + document.id());
        }

        double quality = quality(mapping);
        double reliability = document.source().reliability();
        double confidence = mapping.confidenceScore();
        double freshness = freshness(ageInDays(document));
        double completeness = completeness(document);

        double overall = Scores.clamp(Scores.ratio(
                weights.quality() * quality
                        + weights.reliability() * reliability
                        + weights.confidence() * confidence
                        + weights.freshness() * freshness
                        + weights.completeness() * completeness,
                weights.sum(), 0.0));

        return new TrustScore(document.id(), mapping.standardId(), quality, reliability, confidence, freshness,
                completeness, overall, TrustLevel.of(overall),
                recommendations(quality, reliability, confidence, freshness, completeness, overall));
    }

    public long ageInDays(EvidenceDocument document) {
        return Math.max(0, Duration.between(document.uploadedAt(), clock.instant()).toDays());
    }

    static double quality(EvidenceMapping mapping) {
        List<Excerpt> excerpts = mapping.excerpts();
        double meanScore = excerpts.isEmpty()
                ? mapping.confidenceScore()
                : excerpts.stream().mapToDouble(Excerpt::score).average().orElse(0.0);
        long keywords = excerpts.stream().flatMap(e -> e.matchedKeywords().stream()).distinct().count();
        return Scores.clamp(0.5 * meanScore + 0.5 * Math.min(1.0, (double) keywords / KEYWORD_SATURATION));
    }

    static double freshness(long ageDays) {
        if (ageDays <= 91) return 1.0;
        if (ageDays <= 182) return 0.9;
        if (ageDays <= 365) return 0.7;
        if (ageDays <= 547) return 0.5;
        if (ageDays <= 730) return 0.3;
        return 0.1;
    }

    static double completeness(EvidenceDocument document) {
        int length = document.text().length();
        double lengthScore = length >= 2000 ? 1.0 : length >= 1000 ? 0.8 : length >= 500 ? 0.5 : 0.3;
        boolean pages = document.pageCount() > 0 || new PagedText(document.text()).hasPageMarkers();
        boolean headings = Headings.present(document.text());
        return Scores.clamp(0.4 * lengthScore + (pages ? 0.3 : 0.0) + (headings ? 0.3 : 0.0));
    }

    private static List<String> recommendations(double quality, double reliability, double confidence,
                                                double freshness, double completeness, double overall) {
        List<String> out = new ArrayList<>();
        if (freshness < 0.5) {
            out.add(String.format(Locale.ROOT, "Update this evidence: it is %d%% stale",
                    (int) Math.round((1.0 - freshness) * 100)));
        }
        if (completeness < 0.6) {
            out.add("Add missing content, page structure or section headings");
        }
        if (reliability < 0.6) {
            out.add("Consider sourcing from an authoritative system");
        }
        if (confidence < 0.55) {
            out.add("Confirm the document addresses this standard; the match is weak");
        }
        if (quality < 0.5) {
            out.add("Add passages that address the standard's indicators directly");
        }
        if (out.isEmpty() && overall < 0.7) {
            out.add("Consider replacing with higher-quality evidence");
        }
        return out.size() > MAX_RECOMMENDATIONS ? out.subList(0, MAX_RECOMMENDATIONS) : out;
    }

    /**
     * Mean overall trust of one standard's evidence; empty when it has none.
     */
    public static OptionalDouble standardTrust(Collection<TrustScore> scores) {
        return scores.stream().mapToDouble(TrustScore::overall).average();
    }

    /**
     * Mean of the per-standard trust over the standards that have evidence. Standards
     * without evidence are left out; with none at all the result is 0.0.
     */
    public static ExplainedValue averageTrust(Map<String, ? extends Collection<TrustScore>> byStandard) {
        double sum = 0.0;
        int counted = 0;
        for (Collection<TrustScore> scores : byStandard.values()) {
            OptionalDouble trust = standardTrust(scores);
            if (trust.isPresent()) {
                sum += trust.getAsDouble();
                counted++;
            }
        }
        if (counted == 0) {
            return ExplainedValue.of(0.0, "No evidence is mapped yet, so there is no trust to average.");
        }
        double average = Scores.clamp(sum / counted);
        return ExplainedValue.of(average, String.format(Locale.ROOT,
                "Average trust %s over %d standard(s) with mapped evidence; %d standard(s) without evidence are excluded.",
                Scores.percent(average), counted, byStandard.size() - counted));
    }
}
