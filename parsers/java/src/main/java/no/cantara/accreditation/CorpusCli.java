package no.cantara.accreditation;

import no.cantara.accreditation.model.CorpusMetadata;
import no.cantara.accreditation.model.ParsedCorpus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Command-line interface for corpus validation.
 * Usage: java -jar accreditation-corpus.jar &lt;corpus-dir-or-file&gt;
 */
public class CorpusCli {

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: java -jar accreditation-corpus.jar <corpus-dir-or-file>");
            System.exit(1);
        }

        Path path = Path.of(args[0]);
        if (!Files.exists(path)) {
            System.err.println("Error: not found: " + path);
            System.exit(1);
        }

        List<Path> files;
        try {
            files = Files.isDirectory(path) ? listCorpusFiles(path) : List.of(path);
        } catch (Exception e) {
            System.err.println("Error: cannot list " + path + ": " + e.getMessage());
            System.exit(1);
            return;
        }
        if (files.isEmpty()) {
            System.err.println("Error: no .yaml, .yml or .json corpus files in " + path);
            System.exit(1);
        }

        int failed = 0;
        for (Path file : files) {
            if (!check(file)) failed++;
        }
        if (failed > 0) {
            System.err.printf("%d of %d corpus file(s) failed validation%n", failed, files.size());
            System.exit(1);
        }
    }

    private static boolean check(Path file) {
        ParsedCorpus corpus;
        try {
            corpus = CorpusParser.parse(file);
        } catch (Exception e) {
            System.err.println("Parse error: " + e.getMessage());
            return false;
        }

        CorpusValidator.ValidationResult result = CorpusValidator.validate(corpus);
        if (result.hasWarnings()) {
            result.warnings().forEach(w -> System.err.println("  ⚠ " + w));
        }
        if (!result.isValid()) {
            System.err.println(file.getFileName() + ": validation failed, " + result.errors().size() + " error(s):");
            result.errors().forEach(e -> System.err.println("  • " + e));
            return false;
        }

        CorpusMetadata meta = corpus.metadata();
        System.out.printf("✓ %s is valid: %s v%s, %d/%d standard(s) loaded%n",
                file.getFileName(),
                meta.accreditor(),
                meta.version(),
                meta.loadedNodeCount(),
                meta.standardCount());
        return true;
    }

    private static List<Path> listCorpusFiles(Path dir) throws IOException {
        try (Stream<Path> listing = Files.list(dir)) {
            return listing.filter(Files::isRegularFile).filter(CorpusLoader::isCorpusFile).sorted().toList();
        }
    }
}
