package no.cantara.accreditation.engine.mapping;

import no.cantara.accreditation.Keywords;
import no.cantara.accreditation.model.StandardNode;

import java.util.List;
import java.util.Set;

/**
 * The keyword sets of one standard that evidence is scored against.
 *
 * @param allKeywords Keywords of title, description, clauses and indicators together.
 */
public record StandardProfile(
        StandardNode standard,
        Set<String> titleKeywords,
        Set<String> descriptionKeywords,
        Set<String> allKeywords,
        List<Set<String>> indicatorKeywords
) {
    public static StandardProfile of(StandardNode standard) {
        List<Set<String>> indicators = standard.indicators().stream()
                .map(Keywords::of)
                .filter(k -> !k.isEmpty())
                .toList();
        return new StandardProfile(
                standard,
                Keywords.of(standard.title()),
                Keywords.of(standard.description()),
                Keywords.of(standard.searchableText()),
                indicators);
    }

    public StandardProfile {
        titleKeywords = Set.copyOf(titleKeywords);
        descriptionKeywords = Set.copyOf(descriptionKeywords);
        allKeywords = Set.copyOf(allKeywords);
        indicatorKeywords = List.copyOf(indicatorKeywords);
    }

    /** A standard without any keyword cannot be matched and is skipped. */
    public boolean isEmpty() {
        return allKeywords.isEmpty();
    }

    /** Text compared by embedding similarity: the description, or the title when there is none. */
    public String referenceText() {
        return standard.description().isBlank() ? standard.title() : standard.description();
    }
}
