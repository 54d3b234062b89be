package no.cantara.accreditation.engine.mapping;

import no.cantara.accreditation.engine.text.Fingerprint;
import no.cantara.accreditation.engine.text.PagedText;

import java.time.Instant;
import java.util.Objects;

/**
 * An evidence document handed in by the host. Read-only to the engine.
 *
 * @param id         Caller id, or a fingerprint of the text when the caller has none.
 * @param title      Display title; may be null.
 * @param text       Extracted text with embedded page markers.
 * @param pageCount  Pages in the original document.
 * @param uploadedAt Upload time; document age for freshness is measured from it.
 * @param source     Origin of the document.
 */
public record EvidenceDocument(
        String id,
        String title,
        String text,
        int pageCount,
        Instant uploadedAt,
        EvidenceSource source
) {
    public EvidenceDocument {
        Objects.requireNonNull(id, "id");
        text = text != null ? text : "";
        pageCount = Math.max(pageCount, 0);
        uploadedAt = uploadedAt != null ? uploadedAt : Instant.now();
        source = source != null ? source : EvidenceSource.MANUAL;
    }

    /**
     * A manually supplied document identified by the fingerprint of its text, with
     * the page count taken from its page markers (0 when it has none).
     */
    public static EvidenceDocument of(String text, Instant uploadedAt) {
        PagedText paged = new PagedText(text);
        return new EvidenceDocument(Fingerprint.of(text), null, text,
                paged.hasPageMarkers() ? paged.pageCount() : 0, uploadedAt, EvidenceSource.MANUAL);
    }

    public String displayName() {
        return title != null && !title.isBlank() ? title : id;
    }
}
