package no.cantara.accreditation.engine.mapping;

import no.cantara.accreditation.Keywords;
import no.cantara.accreditation.TimeBudget;
import no.cantara.accreditation.engine.EngineSettings;
import no.cantara.accreditation.engine.Scores;
import no.cantara.accreditation.engine.text.PagedText;
import no.cantara.accreditation.model.StandardNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps an evidence document onto candidate standards.
 *
 * <p>For every candidate the mapper finds the document's occurrences of the standard's
 * keywords, cuts a text window around each occurrence, scores the windows with the
 * configured {@link RelevanceScorer} and keeps the best ones as excerpts. The mapping
 * confidence is the highest excerpt score.
 *
 * <p>Each run shares one embedding budget ({@code mapper.embedding_budget}) across all
 * candidates; once it is spent the remaining excerpts are scored by keywords only.
 */
public class EvidenceMapper {

    private static final Logger log = LoggerFactory.getLogger(EvidenceMapper.class);
    private static final Pattern WORD = Pattern.compile("[a-z]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Windows scored per standard, chosen by distinct keyword hits. */
    static final int MAX_CANDIDATE_WINDOWS = 25;

    private record Hit(String word, int offset) {}

    private record Window(int start, int end, int page, List<String> matched) {}

    private record Scored(Excerpt excerpt, MappingMethod method) {}

    private final RelevanceScorer scorer;
    private final EngineSettings.Mapper settings;
    private final Clock clock;

    public EvidenceMapper(RelevanceScorer scorer, EngineSettings.Mapper settings, Clock clock) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public EvidenceMapper() {
        this(new KeywordRelevanceScorer(), EngineSettings.Mapper.DEFAULT, Clock.systemUTC());
    }

    /**
     * @return one mapping per matching candidate, highest confidence first; empty for
     *         a document without text
     */
    public List<EvidenceMapping> map(EvidenceDocument document, Collection<StandardNode> candidates) {
        return run(document, candidates).mappings();
    }

    /**
     * Like {@link #map} but also reports whether the embedding budget ran out.
     */
    public MappingRun run(EvidenceDocument document, Collection<StandardNode> candidates) {
        if (document.text().isBlank() || candidates.isEmpty()) {
            return MappingRun.empty();
        }
        PagedText paged = new PagedText(document.text());
        List<Hit> hits = keywordHits(document.text());
        Instant now = clock.instant();
        RelevanceScorer.Run scoring = scorer.startRun(new TimeBudget(settings.embeddingBudget()));

        List<EvidenceMapping> mappings = new ArrayList<>();
        for (StandardNode standard : candidates) {
            StandardProfile profile = StandardProfile.of(standard);
            if (profile.isEmpty()) {
                log.debug("Skipping {}: no keywords to match", standard.id());
                continue;
            }
            List<Scored> best = excerpts(document.text(), paged, hits, profile, scoring);
            if (best.isEmpty()) continue;

            double confidence = best.get(0).excerpt().score();
            if (confidence <= 0.0 || confidence < settings.minConfidence()) continue;

            List<Excerpt> excerpts = best.stream().map(Scored::excerpt).toList();
            mappings.add(new EvidenceMapping(document.id(), standard.id(), standard.accreditor(), confidence,
                    excerpts, best.get(0).method(), explain(document, standard, excerpts, confidence), now, now));
        }
        mappings.sort(Comparator.comparingDouble(EvidenceMapping::confidenceScore).reversed()
                .thenComparing(EvidenceMapping::standardId));
        log.debug("Document {} mapped to {} of {} candidate standard(s)",
                document.id(), mappings.size(), candidates.size());
        return new MappingRun(mappings, scoring.timedOut());
    }

    private List<Scored> excerpts(String text, PagedText paged, List<Hit> hits, StandardProfile profile,
                                  RelevanceScorer.Run scoring) {
        Set<String> keywords = profile.allKeywords();
        int half = settings.excerptWindow() / 2;

        // one window per keyword hit not already inside the previous window
        List<Window> windows = new ArrayList<>();
        int coveredUntil = -1;
        for (Hit hit : hits) {
            if (!keywords.contains(hit.word()) || hit.offset() < coveredUntil) continue;
            int start = Math.min(text.length(), Math.max(0, hit.offset() - half));
            int end = Math.min(text.length(), start + settings.excerptWindow());
            coveredUntil = end;
            windows.add(new Window(start, end, paged.pageAt(hit.offset()), matched(text, start, end, keywords)));
        }

        List<Scored> scored = new ArrayList<>();
        windows.stream()
                .sorted(Comparator.comparingInt((Window w) -> w.matched().size()).reversed()
                        .thenComparingInt(Window::start))
                .limit(MAX_CANDIDATE_WINDOWS)
                .forEach(w -> {
                    String excerpt = WHITESPACE.matcher(text.substring(w.start(), w.end())).replaceAll(" ").strip();
                    Relevance relevance = scoring.score(excerpt, profile);
                    scored.add(new Scored(new Excerpt(excerpt, w.page(), w.matched(), relevance.score()),
                            relevance.method()));
                });
        return scored.stream()
                .sorted(Comparator.comparingDouble((Scored s) -> s.excerpt().score()).reversed())
                .limit(settings.maxExcerpts())
                .toList();
    }

    private static List<String> matched(String text, int start, int end, Set<String> keywords) {
        Set<String> found = new LinkedHashSet<>(Keywords.of(text.substring(start, end)));
        found.retainAll(keywords);
        return List.copyOf(found);
    }

    private static List<Hit> keywordHits(String text) {
        List<Hit> hits = new ArrayList<>();
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            if (Keywords.isKeyword(m.group())) {
                hits.add(new Hit(m.group(), m.start()));
            }
        }
        return hits;
    }

    private static String explain(EvidenceDocument document, StandardNode standard, List<Excerpt> excerpts,
                                  double confidence) {
        String pages = excerpts.stream().map(Excerpt::pageNumber).distinct().sorted()
                .map(String::valueOf).collect(Collectors.joining(", "));
        return String.format(Locale.ROOT, "'%s' %s matches %s %s: %s. %d supporting excerpt(s) on page(s) %s. Confidence: %s.",
                document.displayName(), ConfidenceBand.of(confidence).adverb(), standard.accreditor(),
                standard.originalId(), standard.title(), excerpts.size(), pages, Scores.percent(confidence));
    }
}
