package no.cantara.accreditation;

/**
 * Thrown when a corpus file cannot be read as a corpus at all: invalid YAML/JSON,
 * or a document whose top-level structure is not a corpus.
 */
public class CorpusParseException extends RuntimeException {

    private final String source;

    public CorpusParseException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public CorpusParseException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public String source() {
        return source;
    }
}
