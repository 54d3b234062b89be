package no.cantara.accreditation;

import no.cantara.accreditation.model.ClauseNode;
import no.cantara.accreditation.model.CorpusMetadata;
import no.cantara.accreditation.model.ParsedCorpus;
import no.cantara.accreditation.model.Rejection;
import no.cantara.accreditation.model.StandardNode;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable, fully built graph of every loaded corpus.
 *
 * <p>Snapshots are never modified after {@link Builder#build}; a reload produces a
 * new snapshot with a higher {@link #generation()}.
 */
public final class CorpusSnapshot {

    /**
     * A keyword search hit.
     *
     * @param score Matched query keywords divided by the number of query keywords.
     */
    public record KeywordHit(StandardNode standard, double score) {}

    private final long generation;
    private final Instant loadedAt;
    private final Path source;
    private final boolean timedOut;
    private final Map<String, CorpusMetadata> corpora;
    private final Map<String, StandardNode> standardsById;
    private final Map<String, List<StandardNode>> standardsByAccreditor;
    private final Map<String, StandardNode> standardByClauseId;
    private final Map<String, Set<String>> keywordIndex;
    private final List<Rejection> rejections;
    private final List<String> issues;

    private CorpusSnapshot(Builder b, long generation, Instant loadedAt, Path source, boolean timedOut) {
        this.generation = generation;
        this.loadedAt = loadedAt;
        this.source = source;
        this.timedOut = timedOut;

        Map<String, CorpusMetadata> corpora = new LinkedHashMap<>();
        Map<String, List<StandardNode>> byAccreditor = new LinkedHashMap<>();
        b.corpora.keySet().stream().sorted().forEach(acc -> {
            corpora.put(acc, b.corpora.get(acc));
            byAccreditor.put(acc, List.copyOf(b.standards.get(acc)));
        });
        this.corpora = Collections.unmodifiableMap(corpora);
        this.standardsByAccreditor = Collections.unmodifiableMap(byAccreditor);

        Map<String, StandardNode> byId = new LinkedHashMap<>();
        Map<String, StandardNode> byClause = new HashMap<>();
        Map<String, Set<String>> index = new HashMap<>();
        for (List<StandardNode> list : byAccreditor.values()) {
            for (StandardNode node : list) {
                byId.put(node.id(), node);
                for (ClauseNode clause : node.clauses()) {
                    byClause.putIfAbsent(clause.id(), node);
                }
                for (String keyword : Keywords.of(node.searchableText())) {
                    index.computeIfAbsent(keyword, k -> new LinkedHashSet<>()).add(node.id());
                }
            }
        }
        this.standardsById = Collections.unmodifiableMap(byId);
        this.standardByClauseId = Collections.unmodifiableMap(byClause);
        index.replaceAll((k, ids) -> Collections.unmodifiableSet(ids));
        this.keywordIndex = Collections.unmodifiableMap(index);
        this.rejections = List.copyOf(b.rejections);
        this.issues = List.copyOf(b.issues);
    }

    public static CorpusSnapshot empty() {
        return new Builder().build(0, null, false);
    }

    public static Builder builder() {
        return new Builder();
    }

    public long generation() { return generation; }
    public Instant loadedAt() { return loadedAt; }
    public Optional<Path> source() { return Optional.ofNullable(source); }

    /** True when the load ran out of time; the snapshot then holds only the files read so far. */
    public boolean timedOut() { return timedOut; }

    public List<Rejection> rejections() { return rejections; }

    /** File-level problems: unparsable files, duplicate accreditor files, id collisions. */
    public List<String> issues() { return issues; }

    public Set<String> accreditors() { return corpora.keySet(); }

    public boolean isLoaded(String accreditor) {
        return accreditor != null && corpora.containsKey(accreditor);
    }

    public List<CorpusMetadata> metadata() {
        return List.copyOf(corpora.values());
    }

    public Optional<CorpusMetadata> metadata(String accreditor) {
        return Optional.ofNullable(corpora.get(accreditor));
    }

    public Optional<StandardNode> standard(String id) {
        return Optional.ofNullable(standardsById.get(id));
    }

    public List<StandardNode> standards() {
        return List.copyOf(standardsById.values());
    }

    public List<StandardNode> standards(String accreditor) {
        return standardsByAccreditor.getOrDefault(accreditor, List.of());
    }

    public int standardCount() {
        return standardsById.size();
    }

    public Optional<ClauseNode> clause(String clauseId) {
        return standardOf(clauseId).flatMap(s -> s.clause(clauseId));
    }

    /** The standard owning the given clause. */
    public Optional<StandardNode> standardOf(String clauseId) {
        return Optional.ofNullable(standardByClauseId.get(clauseId));
    }

    /**
     * Ranks standards by the share of {@code keywords} found in their text.
     */
    public List<KeywordHit> searchByKeywords(Set<String> keywords, int limit) {
        if (keywords == null || keywords.isEmpty() || limit <= 0) return List.of();
        Map<String, Integer> counts = new HashMap<>();
        for (String keyword : keywords) {
            for (String id : keywordIndex.getOrDefault(keyword, Set.of())) {
                counts.merge(id, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .map(e -> new KeywordHit(standardsById.get(e.getKey()), (double) e.getValue() / keywords.size()))
                .sorted(Comparator.comparingDouble(KeywordHit::score).reversed()
                        .thenComparing(h -> h.standard().id()))
                .limit(limit)
                .toList();
    }

    /**
     * Collects parsed corpora and enforces snapshot-wide uniqueness: one corpus per
     * accreditor (first wins) and one standard per id across all accreditors.
     */
    public static final class Builder {

        private final Map<String, CorpusMetadata> corpora = new HashMap<>();
        private final Map<String, List<StandardNode>> standards = new HashMap<>();
        private final Set<String> ids = new HashSet<>();
        private final List<Rejection> rejections = new ArrayList<>();
        private final List<String> issues = new ArrayList<>();

        private Builder() {}

        /**
         * @return false when the corpus was refused because its accreditor is already present.
         */
        public boolean add(ParsedCorpus corpus) {
            String accreditor = corpus.accreditor();
            if (corpora.containsKey(accreditor)) {
                issue(corpus.metadata().sourceFile() + ": accreditor " + accreditor + " already loaded from "
                        + corpora.get(accreditor).sourceFile() + "; file ignored");
                return false;
            }
            rejections.addAll(corpus.rejections());
            List<StandardNode> accepted = new ArrayList<>();
            for (StandardNode node : corpus.standards()) {
                if (!ids.add(node.id())) {
                    rejections.add(new Rejection(corpus.metadata().sourceFile(), node.id(),
                            "standard id already loaded by another corpus"));
                    continue;
                }
                accepted.add(node);
            }
            corpora.put(accreditor, corpus.metadata().withLoadedNodeCount(accepted.size()));
            standards.put(accreditor, accepted);
            return true;
        }

        public Builder issue(String issue) {
            issues.add(issue);
            return this;
        }

        public CorpusSnapshot build(long generation, Path source, boolean timedOut) {
            return new CorpusSnapshot(this, generation, Instant.now(), source, timedOut);
        }
    }
}
