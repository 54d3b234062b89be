package no.cantara.accreditation.model;

import java.time.LocalDate;

/**
 * Provenance of one accreditor's corpus.
 *
 * @param accreditor      Upper-case accreditor code, unique per snapshot.
 * @param standardCount   Number of standards the file declares.
 * @param loadedNodeCount Number of standards that survived validation and were loaded.
 * @param sourceFile      File name the corpus was read from.
 */
public record CorpusMetadata(
        String accreditor,
        String name,
        String version,
        LocalDate effectiveDate,
        LocalDate lastUpdated,
        String sourceUrl,
        String license,
        String disclaimer,
        String coverageNotes,
        int standardCount,
        int loadedNodeCount,
        String sourceFile
) {
    /** True when fewer standards were loaded than the file declares. */
    public boolean hasDataLoss() {
        return loadedNodeCount < standardCount;
    }

    public CorpusMetadata withLoadedNodeCount(int count) {
        return new CorpusMetadata(accreditor, name, version, effectiveDate, lastUpdated, sourceUrl,
                license, disclaimer, coverageNotes, standardCount, count, sourceFile);
    }
}
