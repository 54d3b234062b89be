package no.cantara.accreditation.model;

/**
 * A standard or clause excluded from a corpus while loading.
 *
 * @param source  File (or other source name) the node came from.
 * @param nodeRef Id of the rejected node, or its position when it has no id.
 * @param reason  Why the node was rejected.
 */
public record Rejection(String source, String nodeRef, String reason) {

    @Override
    public String toString() {
        return source + ": " + nodeRef + ": " + reason;
    }
}
