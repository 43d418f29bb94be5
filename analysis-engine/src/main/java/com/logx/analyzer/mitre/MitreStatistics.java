package com.logx.analyzer.mitre;

import java.util.List;
import java.util.Map;

/**
 * Summary figures over a {@link MitreMappingResult}.
 *
 * @param totalTechniques          distinct parent techniques
 * @param totalTactics             distinct tactics
 * @param totalSubTechniques       distinct sub-techniques
 * @param techniquesByTactic       tactic name to technique count
 * @param confidenceByTactic       tactic name to mean technique confidence
 * @param mostCommonTechniques     up to 5 ids by descending frequency
 * @param highConfidenceTechniques up to 5 ids with confidence {@code >= 0.8}
 * @param overallThreatScore       weighted tactic severity in [0, 100]
 *
 * @author Naveed Gung
 */
public record MitreStatistics(
        int totalTechniques,
        int totalTactics,
        int totalSubTechniques,
        Map<String, Integer> techniquesByTactic,
        Map<String, Double> confidenceByTactic,
        List<String> mostCommonTechniques,
        List<String> highConfidenceTechniques,
        double overallThreatScore) {

    public MitreStatistics {
        techniquesByTactic = techniquesByTactic == null ? Map.of() : techniquesByTactic;
        confidenceByTactic = confidenceByTactic == null ? Map.of() : confidenceByTactic;
        mostCommonTechniques = mostCommonTechniques == null ? List.of() : List.copyOf(mostCommonTechniques);
        highConfidenceTechniques = highConfidenceTechniques == null
                ? List.of()
                : List.copyOf(highConfidenceTechniques);
    }

    public static MitreStatistics empty() {
        return new MitreStatistics(0, 0, 0, Map.of(), Map.of(), List.of(), List.of(), 0.0);
    }
}
