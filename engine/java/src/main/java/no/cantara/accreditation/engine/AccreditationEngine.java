package no.cantara.accreditation.engine;

import no.cantara.accreditation.CorpusLoader;
import no.cantara.accreditation.CorpusSnapshot;
import no.cantara.accreditation.CorpusStore;
import no.cantara.accreditation.engine.compliance.ComplianceAggregator;
import no.cantara.accreditation.engine.compliance.ComplianceReport;
import no.cantara.accreditation.engine.crosswalk.CrosswalkMatcher;
import no.cantara.accreditation.engine.crosswalk.CrosswalkResult;
import no.cantara.accreditation.engine.evidence.DocumentRegistry;
import no.cantara.accreditation.engine.evidence.RepositoryEvidenceLedger;
import no.cantara.accreditation.engine.mapping.EmbeddingModel;
import no.cantara.accreditation.engine.mapping.EmbeddingRelevanceScorer;
import no.cantara.accreditation.engine.mapping.EvidenceDocument;
import no.cantara.accreditation.engine.mapping.EvidenceMapper;
import no.cantara.accreditation.engine.mapping.EvidenceMapping;
import no.cantara.accreditation.engine.mapping.HybridRelevanceScorer;
import no.cantara.accreditation.engine.mapping.InMemoryMappingRepository;
import no.cantara.accreditation.engine.mapping.KeywordRelevanceScorer;
import no.cantara.accreditation.engine.mapping.MappingRepository;
import no.cantara.accreditation.engine.mapping.MappingRun;
import no.cantara.accreditation.engine.mapping.MappingStatistics;
import no.cantara.accreditation.engine.mapping.RelevanceScorer;
import no.cantara.accreditation.engine.risk.GapRiskPredictor;
import no.cantara.accreditation.engine.risk.RiskScore;
import no.cantara.accreditation.engine.risk.RiskSummary;
import no.cantara.accreditation.engine.trust.EvidenceTrustScorer;
import no.cantara.accreditation.engine.trust.TrustScore;
import no.cantara.accreditation.model.CorpusMetadata;
import no.cantara.accreditation.model.StandardNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for hosts: corpus loading, evidence mapping, trust, risk, compliance
 * and crosswalks over one {@link CorpusStore} and one {@link MappingRepository}.
 *
 * <p>Thread-safe. Close the engine to stop its worker threads.
 */
public class AccreditationEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AccreditationEngine.class);
    private static final int EMBEDDING_THREADS = 4;
    private static final int EMBEDDING_QUEUE = 16;

    private final EngineSettings settings;
    private final CorpusStore store;
    private final MappingRepository mappings;
    private final DocumentRegistry documents;
    private final Clock clock;
    private final ExecutorService workers;
    private final ExecutorService embeddingCalls;
    private final EvidenceMapper mapper;
    private final EvidenceTrustScorer trustScorer;
    private final GapRiskPredictor riskPredictor;
    private final ComplianceAggregator compliance;
    private final CrosswalkMatcher crosswalk;

    private AccreditationEngine(Builder b) {
        this.settings = b.settings;
        this.store = b.store != null ? b.store : new CorpusStore(new CorpusLoader(b.settings.loaderBudget()));
        this.mappings = b.mappings != null ? b.mappings : new InMemoryMappingRepository();
        this.documents = new DocumentRegistry();
        this.clock = b.clock;
        this.workers = Executors.newFixedThreadPool(settings.risk().parallelism(), daemonThreads("accreditation-risk"));

        RelevanceScorer scorer = new KeywordRelevanceScorer();
        if (b.embeddingModel != null) {
            ThreadPoolExecutor pool = new ThreadPoolExecutor(EMBEDDING_THREADS, EMBEDDING_THREADS,
                    30, TimeUnit.SECONDS, new ArrayBlockingQueue<>(EMBEDDING_QUEUE),
                    daemonThreads("accreditation-embedding"), new ThreadPoolExecutor.AbortPolicy());
            pool.allowCoreThreadTimeOut(true);
            this.embeddingCalls = pool;
            scorer = new HybridRelevanceScorer(scorer, new EmbeddingRelevanceScorer(b.embeddingModel),
                    settings.mapper().embeddingWeight(), settings.mapper().embeddingTimeout(), embeddingCalls);
        } else {
            this.embeddingCalls = null;
        }
        this.mapper = new EvidenceMapper(scorer, settings.mapper(), clock);
        this.trustScorer = new EvidenceTrustScorer(settings.trust(), clock);
        RepositoryEvidenceLedger ledger = new RepositoryEvidenceLedger(mappings, documents, trustScorer);
        this.riskPredictor = new GapRiskPredictor(store::current, ledger, settings.risk(), workers);
        this.compliance = new ComplianceAggregator(store::current, ledger);
        this.crosswalk = new CrosswalkMatcher(store::current, settings.crosswalk());
    }

    public static Builder builder() {
        return new Builder();
    }

    // -- corpus -------------------------------------------------------------

    public CorpusSnapshot loadCorpus(Path directory) throws IOException {
        return store.load(directory);
    }

    /** Rebuilds from {@code directory}; unchanged input yields the same counts. */
    public CorpusSnapshot reloadCorpus(Path directory) throws IOException {
        return store.load(directory);
    }

    public CorpusSnapshot reloadCorpus() throws IOException {
        return store.reload();
    }

    public CorpusSnapshot corpus() {
        return store.current();
    }

    public List<CorpusMetadata> corpusMetadata() {
        return store.metadata();
    }

    // -- evidence -----------------------------------------------------------

    /**
     * Maps raw text, identified by its fingerprint, and stores the mappings.
     *
     * @param scope accreditor code, or null for every loaded corpus
     */
    public List<EvidenceMapping> mapEvidence(String documentText, String scope) {
        return mapEvidence(EvidenceDocument.of(documentText, clock.instant()), scope);
    }

    public List<EvidenceMapping> mapEvidence(EvidenceDocument document, String scope) {
        return mapEvidenceRun(document, scope).mappings();
    }

    /**
     * Maps and stores like {@link #mapEvidence(EvidenceDocument, String)}, and reports
     * whether the embedding budget ran out during the run.
     */
    public MappingRun mapEvidenceRun(EvidenceDocument document, String scope) {
        if (document == null) throw new ValidationException("document is required");
        List<StandardNode> candidates = candidates(store.current(), scope);
        documents.register(document);
        MappingRun run = mapper.run(document, candidates);
        List<EvidenceMapping> stored = run.mappings().stream().map(mappings::upsert).toList();
        if (run.timedOut()) {
            log.warn("Mapped document {} to {} standard(s); embedding budget ran out, keyword scores used",
                    document.id(), stored.size());
        } else {
            log.info("Mapped document {} to {} standard(s)", document.id(), stored.size());
        }
        return new MappingRun(stored, run.timedOut());
    }

    public EvidenceDocument registerDocument(EvidenceDocument document) {
        if (document == null) throw new ValidationException("document is required");
        return documents.register(document);
    }

    /**
     * Stores the mapping under the accreditor of its loaded standard, whatever the
     * caller put in {@link EvidenceMapping#accreditor()}.
     *
     * @throws ValidationException if the mapping's standard is not loaded
     */
    public EvidenceMapping upsertMapping(EvidenceMapping mapping) {
        if (mapping == null) throw new ValidationException("mapping is required");
        String standardId = mapping.standardId();
        StandardNode standard = store.current().standard(standardId)
                .orElseThrow(() -> new ValidationException("unknown standard: " + standardId));
        if (standard.accreditor().equals(mapping.accreditor())) {
            return mappings.upsert(mapping);
        }
        log.debug("Mapping {} -> {} claims accreditor {}; storing under {}", mapping.documentId(),
                standard.id(), mapping.accreditor(), standard.accreditor());
        return mappings.upsert(mapping.withAccreditor(standard.accreditor()));
    }

    public List<EvidenceMapping> mappingsForStandard(String standardId) {
        return mappings.findByStandard(standardId);
    }

    public List<EvidenceMapping> mappingsForDocument(String documentId) {
        return mappings.findByDocument(documentId);
    }

    public MappingStatistics mappingStatistics() {
        return MappingStatistics.of(mappings.findAll());
    }

    public TrustScore scoreTrust(EvidenceDocument document, EvidenceMapping mapping) {
        return trustScorer.score(document, mapping);
    }

    // -- scoring ------------------------------------------------------------

    public RiskScore scoreRisk(String standardId) {
        return riskPredictor.scoreStandard(standardId);
    }

    public List<RiskScore> scoreRiskBulk(Collection<String> standardIds) {
        return riskPredictor.scoreBulk(standardIds);
    }

    /** Risk of every standard in scope ({@code null} for all). */
    public List<RiskScore> scoreRiskAll(String scope) {
        return riskPredictor.scoreAll(scope == null ? null : validScope(store.current(), scope));
    }

    public RiskSummary aggregateRisk(Collection<RiskScore> scores) {
        return riskPredictor.aggregate(scores);
    }

    public ComplianceReport computeCompliance(String scope) {
        return compliance.compute(scope);
    }

    public CrosswalkResult crosswalk(String source, String target) {
        return crosswalk.crosswalk(source, target);
    }

    public CrosswalkResult crosswalk(String source, String target, double threshold, int topK) {
        return crosswalk.crosswalk(source, target, threshold, topK);
    }

    public EngineSettings settings() {
        return settings;
    }

    @Override
    public void close() {
        workers.shutdown();
        if (embeddingCalls != null) embeddingCalls.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static List<StandardNode> candidates(CorpusSnapshot snapshot, String scope) {
        return scope == null ? snapshot.standards() : snapshot.standards(validScope(snapshot, scope));
    }

    private static String validScope(CorpusSnapshot snapshot, String scope) {
        if (scope.isBlank()) throw new ValidationException("scope must not be blank");
        String code = scope.trim().toUpperCase(Locale.ROOT);
        if (!snapshot.isLoaded(code)) {
            throw new ValidationException("accreditor not loaded: " + code);
        }
        return code;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static final class Builder {

        private EngineSettings settings = EngineSettings.DEFAULT;
        private CorpusStore store;
        private MappingRepository mappings;
        private EmbeddingModel embeddingModel;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder settings(EngineSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder corpusStore(CorpusStore store) {
            this.store = store;
            return this;
        }

        public Builder mappingRepository(MappingRepository mappings) {
            this.mappings = mappings;
            return this;
        }

        /** Enables hybrid keyword and embedding relevance. */
        public Builder embeddingModel(EmbeddingModel embeddingModel) {
            this.embeddingModel = embeddingModel;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public AccreditationEngine build() {
            if (settings == null) throw new ValidationException("settings are required");
            if (clock == null) throw new ValidationException("clock is required");
            return new AccreditationEngine(this);
        }
    }
}
