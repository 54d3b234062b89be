package no.cantara.accreditation;

/**
 * Thrown while building a single standard or clause that lacks a required field.
 * The parser catches it per node, so one bad entry never rejects its whole file.
 */
public class SchemaException extends IllegalArgumentException {

    private final String nodeRef;

    public SchemaException(String nodeRef, String message) {
        super(message);
        this.nodeRef = nodeRef;
    }

    public String nodeRef() {
        return nodeRef;
    }
}
