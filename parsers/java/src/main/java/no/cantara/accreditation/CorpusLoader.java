package no.cantara.accreditation;

import no.cantara.accreditation.model.CorpusMetadata;
import no.cantara.accreditation.model.ParsedCorpus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Builds a {@link CorpusSnapshot} from a directory holding one corpus file per accreditor.
 *
 * <p>A file that cannot be parsed is logged and skipped; the remaining files still
 * load. Files are read in name order so repeated loads of the same directory yield
 * the same snapshot content.
 */
public class CorpusLoader {

    private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);
    private static final Set<String> EXTENSIONS = Set.of(".yaml", ".yml", ".json");
    public static final Duration DEFAULT_BUDGET = Duration.ofSeconds(60);

    private final Duration budget;

    public CorpusLoader() {
        this(DEFAULT_BUDGET);
    }

    public CorpusLoader(Duration budget) {
        this.budget = budget;
    }

    /**
     * @throws IOException if the directory itself cannot be listed
     */
    public CorpusSnapshot load(Path directory, long generation) throws IOException {
        TimeBudget timer = new TimeBudget(budget);
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(Files::isRegularFile)
                    .filter(CorpusLoader::isCorpusFile)
                    .sorted()
                    .toList();
        }

        CorpusSnapshot.Builder builder = CorpusSnapshot.builder();
        boolean timedOut = false;
        for (Path file : files) {
            if (timer.exhausted()) {
                timedOut = true;
                log.warn("Corpus load of {} exceeded its {} budget; {} file(s) not read",
                        directory, budget, files.size() - files.indexOf(file));
                break;
            }
            String name = file.getFileName().toString();
            ParsedCorpus corpus;
            try {
                corpus = CorpusParser.parse(file);
            } catch (CorpusParseException e) {
                log.warn("Skipping corpus file {}: {}", name, e.getMessage());
                builder.issue(e.getMessage());
                continue;
            } catch (IOException e) {
                log.warn("Skipping unreadable corpus file {}: {}", name, e.toString());
                builder.issue(name + ": " + e);
                continue;
            }

            CorpusValidator.ValidationResult result = CorpusValidator.validate(corpus);
            result.warnings().forEach(w -> log.debug("{}: {}", name, w));

            if (!builder.add(corpus)) {
                log.warn("Skipping {}: accreditor {} is already loaded", name, corpus.accreditor());
                continue;
            }
            CorpusMetadata meta = corpus.metadata();
            log.info("Loaded {} of {} declared standards for {} from {}",
                    meta.loadedNodeCount(), meta.standardCount(), meta.accreditor(), name);
        }

        CorpusSnapshot snapshot = builder.build(generation, directory, timedOut);
        snapshot.metadata().stream()
                .filter(CorpusMetadata::hasDataLoss)
                .forEach(m -> log.warn("{} declares {} standards but {} were loaded",
                        m.accreditor(), m.standardCount(), m.loadedNodeCount()));
        return snapshot;
    }

    static boolean isCorpusFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot > 0 && EXTENSIONS.contains(name.substring(dot));
    }
}
