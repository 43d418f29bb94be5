package com.logx.analyzer.mitre;

import java.util.List;
import java.util.Map;

/**
 * ATT&amp;CK view of one analysis.
 *
 * @param techniques         observed techniques in discovery order
 * @param tactics            reached tactics in discovery order
 * @param killChainPhases    reached tactic names in kill-chain order
 * @param techniqueFrequency technique or sub-technique id to reference count
 * @param tacticFrequency    tactic name to reference count
 * @param statistics         summary figures
 *
 * @author Naveed Gung
 */
public record MitreMappingResult(
        List<Technique> techniques,
        List<Tactic> tactics,
        List<String> killChainPhases,
        Map<String, Integer> techniqueFrequency,
        Map<String, Integer> tacticFrequency,
        MitreStatistics statistics) {

    public MitreMappingResult {
        techniques = techniques == null ? List.of() : List.copyOf(techniques);
        tactics = tactics == null ? List.of() : List.copyOf(tactics);
        killChainPhases = killChainPhases == null ? List.of() : List.copyOf(killChainPhases);
        techniqueFrequency = techniqueFrequency == null ? Map.of() : techniqueFrequency;
        tacticFrequency = tacticFrequency == null ? Map.of() : tacticFrequency;
        statistics = statistics == null ? MitreStatistics.empty() : statistics;
    }

    public static MitreMappingResult empty() {
        return new MitreMappingResult(List.of(), List.of(), List.of(), Map.of(), Map.of(),
                MitreStatistics.empty());
    }
}
