package com.logx.analyzer.mitre;

import java.util.List;

/**
 * A technique observed during one analysis.
 *
 * @param id            parent technique id, e.g. {@code T1059}
 * @param name          display name
 * @param tactics       names of the tactics the technique serves
 * @param confidence    highest confidence of the matches that referenced it
 * @param matchCount    number of references, sub-technique references included
 * @param evidence      de-duplicated evidence lines
 * @param subTechniques sub-techniques seen under this technique
 *
 * @author Naveed Gung
 */
public record Technique(
        String id,
        String name,
        List<String> tactics,
        double confidence,
        int matchCount,
        List<String> evidence,
        List<SubTechnique> subTechniques) {

    public Technique {
        tactics = tactics == null ? List.of() : List.copyOf(tactics);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        subTechniques = subTechniques == null ? List.of() : List.copyOf(subTechniques);
    }
}
