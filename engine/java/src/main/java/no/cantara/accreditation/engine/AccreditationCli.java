package no.cantara.accreditation.engine;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import no.cantara.accreditation.CorpusSnapshot;
import no.cantara.accreditation.engine.compliance.ComplianceAggregator;
import no.cantara.accreditation.engine.mapping.EvidenceDocument;
import no.cantara.accreditation.engine.mapping.EvidenceMapping;
import no.cantara.accreditation.engine.mapping.EvidenceSource;
import no.cantara.accreditation.engine.risk.RiskScore;
import no.cantara.accreditation.engine.text.Fingerprint;
import no.cantara.accreditation.engine.text.PagedText;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line quality report.
 *
 * <pre>
 * Usage: accreditation-engine &lt;corpus-dir&gt; [--evidence file]... [--scope CODE]
 *                             [--crosswalk SRC:TGT] [--config settings.yaml]
 * </pre>
 * Prints corpus metadata, mappings, compliance and risk as JSON on stdout.
 */
public class AccreditationCli {

    static final String USAGE = "Usage: accreditation-engine <corpus-dir> [--evidence file]... [--scope CODE]"
            + " [--crosswalk SRC:TGT] [--config settings.yaml]";

    record Options(Path corpus, List<Path> evidence, String scope, String crosswalk, Path config) {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Options options;
        try {
            options = parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return 1;
        }

        EngineSettings settings;
        try {
            settings = options.config() != null ? EngineSettingsLoader.load(options.config()) : EngineSettings.DEFAULT;
        } catch (IOException e) {
            err.println("Error: cannot read " + options.config() + ": " + e.getMessage());
            return 1;
        } catch (ValidationException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        try (AccreditationEngine engine = AccreditationEngine.builder().settings(settings).build()) {
            CorpusSnapshot snapshot = engine.loadCorpus(options.corpus());
            if (snapshot.timedOut()) {
                err.println("Error: corpus load timed out after " + settings.loaderBudget());
                return 1;
            }
            snapshot.issues().forEach(issue -> err.println("  ⚠ " + issue));
            snapshot.rejections().forEach(r -> err.println("  • rejected " + r));

            ObjectNode report = JsonReport.corpus(engine.corpusMetadata());

            List<EvidenceMapping> mapped = new ArrayList<>();
            for (Path file : options.evidence()) {
                mapped.addAll(engine.mapEvidence(readDocument(file), options.scope()));
            }
            ArrayNode mappings = JsonReport.mappings(mapped);
            report.set("mappings", mappings);
            report.set("mapping_statistics", JsonReport.statistics(engine.mappingStatistics()));

            String scope = options.scope() != null ? options.scope() : ComplianceAggregator.ALL;
            report.set("compliance", JsonReport.compliance(engine.computeCompliance(scope)));

            List<RiskScore> risks = engine.scoreRiskAll(options.scope());
            report.set("risk", JsonReport.risk(risks, engine.aggregateRisk(risks)));

            if (options.crosswalk() != null) {
                String[] pair = options.crosswalk().split(":", 2);
                report.set("crosswalk", JsonReport.crosswalk(engine.crosswalk(pair[0], pair[1])));
            }
            out.println(JsonReport.write(report));
            return 0;
        } catch (ValidationException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static Options parse(String[] args) {
        Path corpus = null;
        List<Path> evidence = new ArrayList<>();
        String scope = null;
        String crosswalk = null;
        Path config = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--evidence" -> evidence.add(Path.of(value(args, ++i, "--evidence")));
                case "--scope" -> scope = value(args, ++i, "--scope");
                case "--crosswalk" -> {
                    crosswalk = value(args, ++i, "--crosswalk");
                    if (!crosswalk.matches("[^:]+:[^:]+")) {
                        throw new IllegalArgumentException("--crosswalk expects SRC:TGT, got " + crosswalk);
                    }
                }
                case "--config" -> config = Path.of(value(args, ++i, "--config"));
                default -> {
                    if (args[i].startsWith("-")) {
                        throw new IllegalArgumentException("unknown option " + args[i]);
                    }
                    if (corpus != null) {
                        throw new IllegalArgumentException("only one corpus directory may be given");
                    }
                    corpus = Path.of(args[i]);
                }
            }
        }
        if (corpus == null) {
            throw new IllegalArgumentException("corpus directory is required");
        }
        return new Options(corpus, evidence, scope, crosswalk, config);
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length) {
            throw new IllegalArgumentException(option + " needs a value");
        }
        return args[i];
    }

    private static EvidenceDocument readDocument(Path file) throws IOException {
        String text = Files.readString(file);
        PagedText paged = new PagedText(text);
        return new EvidenceDocument(
                Fingerprint.of(text),
                file.getFileName().toString(),
                text,
                paged.hasPageMarkers() ? paged.pageCount() : 0,
                Files.getLastModifiedTime(file).toInstant(),
                EvidenceSource.MANUAL);
    }
}
