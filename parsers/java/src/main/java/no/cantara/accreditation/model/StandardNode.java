package no.cantara.accreditation.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A single accreditation standard. The {@code id} is namespaced as
 * {@code {ACCREDITOR}_{originalId}} and is unique across every loaded corpus.
 */
public record StandardNode(
        String id,
        String accreditor,
        String originalId,
        String title,
        String description,
        String category,
        List<ClauseNode> clauses
) {
    public StandardNode {
        description = description != null ? description : "";
        category = category != null ? category : "";
        clauses = clauses != null ? List.copyOf(clauses) : List.of();
    }

    /** All indicators of all clauses, in declaration order. */
    public List<String> indicators() {
        return clauses.stream().flatMap(c -> c.indicators().stream()).toList();
    }

    public Optional<ClauseNode> clause(String clauseId) {
        return clauses.stream().filter(c -> c.id().equals(clauseId)).findFirst();
    }

    /**
     * Title, description, clause text and indicators joined with spaces; the text
     * evidence is matched against.
     */
    public String searchableText() {
        Stream<String> clauseText = clauses.stream()
                .flatMap(c -> Stream.concat(Stream.of(c.title(), c.description()), c.indicators().stream()));
        return Stream.concat(Stream.of(title, description), clauseText)
                .filter(s -> s != null && !s.isBlank())
                .reduce((a, b) -> a + " " + b)
                .orElse("");
    }
}
