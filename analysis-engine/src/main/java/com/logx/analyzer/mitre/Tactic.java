package com.logx.analyzer.mitre;

import java.util.List;

/**
 * A tactic reached by at least one observed technique.
 *
 * @param id             ATT&amp;CK tactic id
 * @param name           display name
 * @param techniqueIds   distinct parent technique ids, in discovery order
 * @param techniqueCount number of distinct techniques
 * @param coverage       share of the tactic's known techniques that were observed, in [0.0, 1.0]
 *
 * @author Naveed Gung
 */
public record Tactic(
        String id,
        String name,
        List<String> techniqueIds,
        int techniqueCount,
        double coverage) {

    public Tactic {
        techniqueIds = techniqueIds == null ? List.of() : List.copyOf(techniqueIds);
    }
}
