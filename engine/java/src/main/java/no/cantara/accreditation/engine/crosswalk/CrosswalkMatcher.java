package no.cantara.accreditation.engine.crosswalk;

import no.cantara.accreditation.CorpusSnapshot;
import no.cantara.accreditation.Keywords;
import no.cantara.accreditation.TimeBudget;
import no.cantara.accreditation.engine.EngineSettings;
import no.cantara.accreditation.engine.ExplainedValue;
import no.cantara.accreditation.engine.Scores;
import no.cantara.accreditation.engine.ValidationException;
import no.cantara.accreditation.model.StandardNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Finds equivalent standards across two accreditors by Jaccard similarity of the
 * keywords of their descriptions (the title stands in for a missing description).
 */
public class CrosswalkMatcher {

    private static final Logger log = LoggerFactory.getLogger(CrosswalkMatcher.class);

    private record Target(StandardNode standard, Set<String> keywords) {}

    private final Supplier<CorpusSnapshot> snapshots;
    private final EngineSettings.Crosswalk settings;

    public CrosswalkMatcher(Supplier<CorpusSnapshot> snapshots, EngineSettings.Crosswalk settings) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public CrosswalkResult crosswalk(String source, String target) {
        return crosswalk(source, target, settings.threshold(), settings.topK());
    }

    /**
     * @throws ValidationException when source and target are the same, either is not
     *                             loaded, the threshold is outside [0,1] or topK is below 1
     */
    public CrosswalkResult crosswalk(String source, String target, double threshold, int topK) {
        String src = code(source, "source");
        String tgt = code(target, "target");
        if (src.equals(tgt)) {
            throw new ValidationException("cannot crosswalk " + src + " with itself");
        }
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new ValidationException("threshold must be within [0,1], got " + threshold);
        }
        if (topK < 1) {
            throw new ValidationException("top_k must be at least 1, got " + topK);
        }
        CorpusSnapshot snapshot = snapshots.get();
        for (String code : List.of(src, tgt)) {
            if (!snapshot.isLoaded(code)) {
                throw new ValidationException("accreditor not loaded: " + code);
            }
        }

        List<StandardNode> sources = snapshot.standards(src);
        List<Target> targets = snapshot.standards(tgt).stream()
                .map(t -> new Target(t, keywords(t)))
                .toList();

        TimeBudget budget = new TimeBudget(settings.budget());
        Map<String, List<CrosswalkMatch>> grouped = new LinkedHashMap<>();
        boolean timedOut = false;
        for (StandardNode s : sources) {
            if (budget.exhausted()) {
                timedOut = true;
                log.warn("Crosswalk {} -> {} exceeded its {} budget after {} of {} standard(s)",
                        src, tgt, budget.total(), grouped.size(), sources.size());
                break;
            }
            Set<String> a = keywords(s);
            List<CrosswalkMatch> matches = new ArrayList<>();
            for (Target t : targets) {
                Set<String> overlap = new TreeSet<>(a);
                overlap.retainAll(t.keywords());
                if (overlap.isEmpty()) continue;
                double similarity = jaccard(a, t.keywords(), overlap.size());
                if (similarity >= threshold) {
                    matches.add(new CrosswalkMatch(s.id(), t.standard().id(), similarity, List.copyOf(overlap)));
                }
            }
            if (matches.isEmpty()) continue;
            matches.sort(Comparator.comparingDouble(CrosswalkMatch::similarity).reversed()
                    .thenComparing(CrosswalkMatch::targetStandardId));
            grouped.put(s.id(), matches.size() > topK ? matches.subList(0, topK) : matches);
        }

        return new CrosswalkResult(src, tgt, grouped, timedOut, coverageEstimate(src, tgt, grouped.size(), sources.size()));
    }

    static double jaccard(Set<String> a, Set<String> b, int intersection) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return Scores.clamp(Scores.ratio(intersection, union.size(), 0.0));
    }

    static Set<String> keywords(StandardNode standard) {
        String text = standard.description().isBlank() ? standard.title() : standard.description();
        return Keywords.of(text);
    }

    private static String code(String accreditor, String role) {
        if (accreditor == null || accreditor.isBlank()) {
            throw new ValidationException(role + " accreditor is required");
        }
        return accreditor.trim().toUpperCase(Locale.ROOT);
    }

    private static ExplainedValue coverageEstimate(String src, String tgt, int matched, int total) {
        if (total == 0) {
            return ExplainedValue.of(0.0, src + " has no standards to crosswalk.");
        }
        double value = Scores.ratio(matched, total, 0.0);
        return ExplainedValue.of(value, String.format(Locale.ROOT,
                "%d of %d %s standard(s) (%s) can potentially share evidence with %s.",
                matched, total, src, Scores.percent(value), tgt));
    }
}
