package com.logx.analyzer.mitre;

import java.util.List;

/**
 * A sub-technique observed under a parent {@link Technique}.
 *
 * @param id         sub-technique id, always the parent id plus a {@code .NNN} suffix
 * @param name       display name
 * @param confidence highest confidence of the matches that referenced it
 * @param matchCount number of references
 * @param evidence   de-duplicated evidence lines
 *
 * @author Naveed Gung
 */
public record SubTechnique(
        String id,
        String name,
        double confidence,
        int matchCount,
        List<String> evidence) {

    public SubTechnique {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
