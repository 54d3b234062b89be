package no.cantara.accreditation;

import no.cantara.accreditation.model.ClauseNode;
import no.cantara.accreditation.model.CorpusMetadata;
import no.cantara.accreditation.model.ParsedCorpus;
import no.cantara.accreditation.model.Rejection;
import no.cantara.accreditation.model.StandardNode;
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
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parses one accreditor's corpus file (YAML or JSON) into a {@link ParsedCorpus}.
 *
 * <p>Expected layout:
 * <pre>
 * accreditor: SACSCOC
 * metadata: { name, version, effective_date, last_updated, source_url, license,
 *             disclaimer, coverage_notes, standard_count }
 * standards:
 *   - id: "8.1"
 *     title: Faculty Qualifications
 *     description: ...
 *     category: Faculty
 *     clauses:
 *       - id: "8.1.a"
 *         title: ...
 *         indicators: [ ... ]
 * </pre>
 * Standards and clauses missing {@code id} or {@code title} are rejected one by one;
 * only a file that is not a corpus at all fails with {@link CorpusParseException}.
 */
public class CorpusParser {

    private static final Logger log = LoggerFactory.getLogger(CorpusParser.class);

    private CorpusParser() {}

    // SafeConstructor disables arbitrary Java type instantiation via YAML tags.
    // Yaml instances are not thread-safe, so each parse gets its own.
    private static Yaml yaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    public static ParsedCorpus parse(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.getFileName().toString());
        }
    }

    /**
     * JSON is read through the YAML parser, which accepts it as a subset.
     */
    @SuppressWarnings("unchecked")
    public static ParsedCorpus parse(InputStream is, String sourceName) {
        Object data;
        try {
            data = yaml().load(is);
        } catch (YAMLException e) {
            throw new CorpusParseException(sourceName, "unparsable corpus file: " + e.getMessage(), e);
        }
        if (!(data instanceof Map<?, ?>)) {
            throw new CorpusParseException(sourceName, "top level must be a mapping");
        }
        return fromMap((Map<String, Object>) data, sourceName);
    }

    @SuppressWarnings("unchecked")
    public static ParsedCorpus fromMap(Map<String, Object> data, String sourceName) {
        String accreditor = accreditorCode(data.get("accreditor"), sourceName);

        Object metaObj = data.getOrDefault("metadata", Map.of());
        if (metaObj == null) metaObj = Map.of();
        if (!(metaObj instanceof Map<?, ?>)) {
            throw new CorpusParseException(sourceName, "'metadata' must be a mapping");
        }
        Map<String, Object> meta = (Map<String, Object>) metaObj;

        Object stdObj = data.getOrDefault("standards", List.of());
        if (stdObj == null) stdObj = List.of();
        if (!(stdObj instanceof List<?>)) {
            throw new CorpusParseException(sourceName, "'standards' must be a list");
        }
        List<Object> entries = (List<Object>) stdObj;

        List<StandardNode> standards = new ArrayList<>();
        List<Rejection> rejections = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            Object entry = entries.get(i);
            String position = "standards[" + i + "]";
            try {
                if (!(entry instanceof Map<?, ?>)) {
                    throw new SchemaException(position, "standard must be a mapping");
                }
                StandardNode node = parseStandard(accreditor, (Map<String, Object>) entry, position,
                        sourceName, rejections);
                if (!seen.add(node.id())) {
                    throw new SchemaException(node.id(), "duplicate standard id");
                }
                standards.add(node);
            } catch (SchemaException e) {
                log.warn("Rejected {} in {}: {}", e.nodeRef(), sourceName, e.getMessage());
                rejections.add(new Rejection(sourceName, e.nodeRef(), e.getMessage()));
            }
        }

        int declared = meta.get("standard_count") instanceof Number n ? n.intValue() : entries.size();
        CorpusMetadata metadata = new CorpusMetadata(
                accreditor,
                text(meta.get("name")),
                text(firstNonNull(meta.get("version"), data.get("version"))),
                parseDate(firstNonNull(meta.get("effective_date"), data.get("effective_date")), sourceName),
                parseDate(meta.get("last_updated"), sourceName),
                text(meta.get("source_url")),
                text(meta.get("license")),
                text(meta.get("disclaimer")),
                text(meta.get("coverage_notes")),
                declared,
                standards.size(),
                sourceName
        );
        return new ParsedCorpus(metadata, standards, rejections);
    }

    /**
     * Namespaces a raw id with the accreditor code. Ids that already carry the
     * prefix are kept; spaces become underscores and slashes become dots.
     */
    static String ensurePrefix(String accreditor, String rawId) {
        String up = accreditor.toUpperCase(Locale.ROOT);
        if (rawId.toUpperCase(Locale.ROOT).startsWith(up + "_")) {
            return rawId;
        }
        String safe = rawId.replace(" ", "_").replace("/", ".");
        return up + "_" + safe;
    }

    @SuppressWarnings("unchecked")
    private static StandardNode parseStandard(String accreditor, Map<String, Object> s, String position,
                                              String sourceName, List<Rejection> rejections) {
        String rawId = text(s.get("id"));
        if (rawId == null || rawId.isBlank()) {
            throw new SchemaException(position, "'id' is required");
        }
        String id = ensurePrefix(accreditor, rawId.trim());
        String title = text(s.get("title"));
        if (title == null || title.isBlank()) {
            throw new SchemaException(id, "'title' is required");
        }

        List<ClauseNode> clauses = new ArrayList<>();
        Object clauseObj = s.getOrDefault("clauses", List.of());
        if (clauseObj instanceof List<?> clauseList) {
            for (int i = 0; i < clauseList.size(); i++) {
                Object c = clauseList.get(i);
                String clausePos = id + ".clauses[" + i + "]";
                try {
                    if (!(c instanceof Map<?, ?>)) {
                        throw new SchemaException(clausePos, "clause must be a mapping");
                    }
                    clauses.add(parseClause(accreditor, (Map<String, Object>) c, clausePos));
                } catch (SchemaException e) {
                    log.warn("Rejected clause {} in {}: {}", e.nodeRef(), sourceName, e.getMessage());
                    rejections.add(new Rejection(sourceName, e.nodeRef(), e.getMessage()));
                }
            }
        } else if (clauseObj != null) {
            throw new SchemaException(id, "'clauses' must be a list");
        }

        return new StandardNode(
                id,
                accreditor,
                rawId.trim(),
                title.trim(),
                text(s.get("description")),
                text(s.get("category")),
                clauses
        );
    }

    private static ClauseNode parseClause(String accreditor, Map<String, Object> c, String position) {
        String rawId = text(c.get("id"));
        if (rawId == null || rawId.isBlank()) {
            throw new SchemaException(position, "'id' is required");
        }
        String id = ensurePrefix(accreditor, rawId.trim());
        String title = text(c.get("title"));
        if (title == null || title.isBlank()) {
            throw new SchemaException(id, "'title' is required");
        }
        List<String> indicators = new ArrayList<>();
        if (c.get("indicators") instanceof List<?> list) {
            list.stream().filter(Objects::nonNull).map(Object::toString)
                    .filter(ind -> !ind.isBlank())
                    .forEach(indicators::add);
        }
        return new ClauseNode(id, title.trim(), text(c.get("description")), indicators);
    }

    private static String accreditorCode(Object declared, String sourceName) {
        String code = text(declared);
        if (code == null || code.isBlank()) {
            if (sourceName == null || sourceName.isBlank()) {
                throw new CorpusParseException(String.valueOf(sourceName), "no 'accreditor' declared");
            }
            code = sourceName.split("\\.")[0];
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }

    // YAML reads unquoted ids such as 10 or 8.1 as numbers.
    private static String text(Object value) {
        return value == null ? null : value.toString();
    }

    private static Object firstNonNull(Object a, Object b) {
        return a != null ? a : b;
    }

    private static LocalDate parseDate(Object value, String sourceName) {
        if (value == null) return null;
        if (value instanceof Date d) return d.toInstant().atZone(ZoneOffset.UTC).toLocalDate();
        try {
            return LocalDate.parse(value.toString());
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparsable date '{}' in {}", value, sourceName);
            return null;
        }
    }
}
