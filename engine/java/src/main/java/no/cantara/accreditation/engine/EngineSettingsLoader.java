package no.cantara.accreditation.engine;

import no.cantara.accreditation.engine.trust.TrustWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Reads engine settings from YAML. Every key is optional and falls back to
 * {@link EngineSettings#DEFAULT}:
 * <pre>
 * mapper:    { excerpt_window, max_excerpts, min_confidence, embedding_weight,
 *              embedding_timeout_ms, embedding_budget_ms }
 * trust:     { quality, reliability, confidence, freshness, completeness }
 * risk:      { mapping_target, recency_floor_days, recency_ceiling_days, parallelism }
 * crosswalk: { threshold, top_k, budget_ms }
 * loader:    { budget_ms }
 * </pre>
 * Unknown keys are logged and ignored; values of the wrong type or out of range
 * raise {@link ValidationException}.
 */
public final class EngineSettingsLoader {

    private static final Logger log = LoggerFactory.getLogger(EngineSettingsLoader.class);

    private EngineSettingsLoader() {}

    public static EngineSettings load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.getFileName().toString());
        }
    }

    public static EngineSettings load(InputStream in, String sourceName) {
        Object data;
        try {
            data = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        } catch (YAMLException e) {
            throw new ValidationException(sourceName + ": unparsable settings: " + e.getMessage());
        }
        if (data == null) {
            return EngineSettings.DEFAULT;
        }
        if (!(data instanceof Map<?, ?> map)) {
            throw new ValidationException(sourceName + ": top level must be a mapping");
        }
        return fromMap(new Section(sourceName, "", map));
    }

    static EngineSettings fromMap(Section root) {
        EngineSettings d = EngineSettings.DEFAULT;

        Section m = root.section("mapper");
        EngineSettings.Mapper mapper = new EngineSettings.Mapper(
                m.integer("excerpt_window", d.mapper().excerptWindow()),
                m.integer("max_excerpts", d.mapper().maxExcerpts()),
                m.decimal("min_confidence", d.mapper().minConfidence()),
                m.decimal("embedding_weight", d.mapper().embeddingWeight()),
                m.millis("embedding_timeout_ms", d.mapper().embeddingTimeout()),
                m.millis("embedding_budget_ms", d.mapper().embeddingBudget()));
        m.warnUnknown();

        Section t = root.section("trust");
        TrustWeights trust = new TrustWeights(
                t.decimal("quality", d.trust().quality()),
                t.decimal("reliability", d.trust().reliability()),
                t.decimal("confidence", d.trust().confidence()),
                t.decimal("freshness", d.trust().freshness()),
                t.decimal("completeness", d.trust().completeness()));
        t.warnUnknown();

        Section r = root.section("risk");
        EngineSettings.Risk risk = new EngineSettings.Risk(
                r.integer("mapping_target", d.risk().mappingTarget()),
                r.days("recency_floor_days", d.risk().recencyFloor()),
                r.days("recency_ceiling_days", d.risk().recencyCeiling()),
                r.integer("parallelism", d.risk().parallelism()));
        r.warnUnknown();

        Section c = root.section("crosswalk");
        EngineSettings.Crosswalk crosswalk = new EngineSettings.Crosswalk(
                c.decimal("threshold", d.crosswalk().threshold()),
                c.integer("top_k", d.crosswalk().topK()),
                c.millis("budget_ms", d.crosswalk().budget()));
        c.warnUnknown();

        Section l = root.section("loader");
        Duration loaderBudget = l.millis("budget_ms", d.loaderBudget());
        l.warnUnknown();

        root.warnUnknown();
        return new EngineSettings(mapper, trust, risk, crosswalk, loaderBudget);
    }

    /** One mapping of the settings file, remembering which keys were read. */
    static final class Section {

        private final String source;
        private final String path;
        private final Map<?, ?> values;
        private final Set<String> read = new HashSet<>();

        Section(String source, String path, Map<?, ?> values) {
            this.source = source;
            this.path = path;
            this.values = values != null ? values : Map.of();
        }

        Section section(String key) {
            Object v = take(key);
            if (v == null) return new Section(source, qualify(key), Map.of());
            if (!(v instanceof Map<?, ?> map)) {
                throw new ValidationException(source + ": '" + qualify(key) + "' must be a mapping");
            }
            return new Section(source, qualify(key), map);
        }

        int integer(String key, int fallback) {
            Object v = take(key);
            if (v == null) return fallback;
            if (v instanceof Integer || v instanceof Long) return ((Number) v).intValue();
            throw new ValidationException(source + ": '" + qualify(key) + "' must be an integer, got " + v);
        }

        double decimal(String key, double fallback) {
            Object v = take(key);
            if (v == null) return fallback;
            if (v instanceof Number n) return n.doubleValue();
            throw new ValidationException(source + ": '" + qualify(key) + "' must be a number, got " + v);
        }

        Duration millis(String key, Duration fallback) {
            Object v = take(key);
            if (v == null) return fallback;
            if (v instanceof Integer || v instanceof Long) return Duration.ofMillis(((Number) v).longValue());
            throw new ValidationException(source + ": '" + qualify(key) + "' must be whole milliseconds, got " + v);
        }

        Duration days(String key, Duration fallback) {
            Object v = take(key);
            if (v == null) return fallback;
            if (v instanceof Integer || v instanceof Long) return Duration.ofDays(((Number) v).longValue());
            throw new ValidationException(source + ": '" + qualify(key) + "' must be whole days, got " + v);
        }

        void warnUnknown() {
            for (Object key : values.keySet()) {
                if (!read.contains(String.valueOf(key))) {
                    log.warn("{}: ignoring unknown setting '{}'", source, qualify(String.valueOf(key)));
                }
            }
        }

        private Object take(String key) {
            read.add(key);
            return values.get(key);
        }

        private String qualify(String key) {
            return path.isEmpty() ? key : path + "." + key;
        }
    }
}
