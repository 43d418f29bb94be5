package com.logx.analyzer.mitre;

import com.logx.analyzer.analysis.CancellationToken;
import com.logx.analyzer.detection.MatchDetail;
import com.logx.analyzer.detection.RuleMatchResult;
import com.logx.analyzer.event.FieldValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps the rule matches of one analysis onto MITRE ATT&amp;CK techniques and
 * tactics.
 *
 * <p>
 * Technique ids are collected from three places on every match:
 * </p>
 * <ul>
 * <li>the ids the rule declares (Sigma tags such as {@code attack.t1059.001}
 * included)</li>
 * <li>string values of the rule metadata</li>
 * <li>matched content and context of every hit</li>
 * </ul>
 *
 * <p>
 * Every occurrence counts: an id found both in the declared ids and in the
 * matched content is counted twice. Sub-technique occurrences also count
 * towards their parent. Evidence lines are de-duplicated per technique.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class MitreMapper {

    private static final Logger log = LoggerFactory.getLogger(MitreMapper.class);

    static final Pattern TECHNIQUE_ID = Pattern.compile("T\\d{4}(?:\\.\\d{3})?", Pattern.CASE_INSENSITIVE);

    static final int TOP_TECHNIQUES = 5;
    static final double HIGH_CONFIDENCE = 0.8;

    private final ReferenceData referenceData;

    public MitreMapper(ReferenceData referenceData) {
        this.referenceData = referenceData;
    }

    /**
     * Map rule matches to ATT&amp;CK.
     *
     * @param matches all rule matches of one analysis
     * @param token   cancellation signal, checked once per match
     * @return the mapping (empty when no technique id was found)
     * @throws com.logx.analyzer.analysis.AnalysisCancelledException if cancelled mid-way
     */
    public MitreMappingResult map(List<RuleMatchResult> matches, CancellationToken token) {
        if (matches == null || matches.isEmpty()) {
            return MitreMappingResult.empty();
        }

        MappingRun run = new MappingRun();
        for (RuleMatchResult match : matches) {
            token.throwIfCancellationRequested();

            for (String declared : match.mitreAttackIds()) {
                run.scan(declared, match);
            }
            for (FieldValue value : match.metadata().values()) {
                value.text().ifPresent(text -> run.scan(text, match));
            }
            for (MatchDetail detail : match.matches()) {
                run.scan(detail.matchedContent(), match);
                run.scan(detail.context(), match);
            }
        }

        MitreMappingResult result = run.finish();
        log.info("Mapped {} rule matches to {} techniques and {} tactics",
                matches.size(), result.techniques().size(), result.tactics().size());
        return result;
    }

    /** Mutable state of one {@link #map} call. */
    private final class MappingRun {

        private final Map<String, TechniqueAccumulator> techniques = new LinkedHashMap<>();
        private final Map<String, TacticAccumulator> tactics = new LinkedHashMap<>();
        private final Map<String, Integer> techniqueFrequency = new LinkedHashMap<>();
        private final Map<String, Integer> tacticFrequency = new LinkedHashMap<>();

        void scan(String text, RuleMatchResult match) {
            if (text == null || text.isEmpty()) {
                return;
            }
            Matcher matcher = TECHNIQUE_ID.matcher(text);
            while (matcher.find()) {
                record(matcher.group().toUpperCase(Locale.ROOT), match);
            }
        }

        private void record(String techniqueId, RuleMatchResult match) {
            int dot = techniqueId.indexOf('.');
            String parentId = dot < 0 ? techniqueId : techniqueId.substring(0, dot);

            techniqueFrequency.merge(techniqueId, 1, Integer::sum);

            TechniqueAccumulator technique = techniques.computeIfAbsent(parentId, this::newTechnique);
            String evidence = evidenceOf(match);
            technique.add(match.confidence(), evidence);

            if (dot >= 0) {
                technique.subTechniques
                        .computeIfAbsent(techniqueId, id -> new SubTechniqueAccumulator(id, nameOf(id)))
                        .add(match.confidence(), evidence);
            }

            for (String tacticName : technique.tactics) {
                tacticFrequency.merge(tacticName, 1, Integer::sum);
                tactics.computeIfAbsent(tacticName, this::newTactic).techniqueIds.add(parentId);
            }
        }

        private TechniqueAccumulator newTechnique(String id) {
            List<String> tacticNames = new ArrayList<>();
            for (String tactic : referenceData.tacticsOf(id)) {
                tacticNames.add(referenceData.tactic(tactic).map(ReferenceData.TacticReference::name).orElse(tactic));
            }
            return new TechniqueAccumulator(id, nameOf(id), tacticNames);
        }

        private TacticAccumulator newTactic(String name) {
            String id = referenceData.tactic(name)
                    .map(ReferenceData.TacticReference::id)
                    .orElse(name.toLowerCase(Locale.ROOT).replace(' ', '_'));
            return new TacticAccumulator(id, name);
        }

        private String nameOf(String techniqueId) {
            return referenceData.technique(techniqueId)
                    .map(ReferenceData.TechniqueReference::name)
                    .orElse("Unknown technique " + techniqueId);
        }

        MitreMappingResult finish() {
            List<Technique> techniqueList = new ArrayList<>(techniques.size());
            for (TechniqueAccumulator acc : techniques.values()) {
                techniqueList.add(acc.toTechnique());
            }

            List<Tactic> tacticList = new ArrayList<>(tactics.size());
            for (TacticAccumulator acc : tactics.values()) {
                tacticList.add(acc.toTactic(referenceData.techniqueCount(acc.name)));
            }

            List<String> killChain = new ArrayList<>();
            for (ReferenceData.TacticReference known : referenceData.tactics()) {
                if (tactics.containsKey(known.name())) {
                    killChain.add(known.name());
                }
            }
            for (String name : tactics.keySet()) {
                if (!killChain.contains(name)) {
                    killChain.add(name);
                }
            }

            MitreStatistics statistics = statistics(techniqueList, tacticList);
            return new MitreMappingResult(
                    techniqueList,
                    tacticList,
                    killChain,
                    Collections.unmodifiableMap(new LinkedHashMap<>(techniqueFrequency)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(tacticFrequency)),
                    statistics);
        }

        private MitreStatistics statistics(List<Technique> techniqueList, List<Tactic> tacticList) {
            Map<String, Technique> byId = new LinkedHashMap<>();
            int subTechniques = 0;
            for (Technique technique : techniqueList) {
                byId.put(technique.id(), technique);
                subTechniques += technique.subTechniques().size();
            }

            Map<String, Integer> techniquesByTactic = new LinkedHashMap<>();
            Map<String, Double> confidenceByTactic = new LinkedHashMap<>();
            for (Tactic tactic : tacticList) {
                techniquesByTactic.put(tactic.name(), tactic.techniqueCount());
                double total = 0.0;
                int counted = 0;
                for (String id : tactic.techniqueIds()) {
                    Technique technique = byId.get(id);
                    if (technique != null) {
                        total += technique.confidence();
                        counted++;
                    }
                }
                confidenceByTactic.put(tactic.name(), counted > 0 ? total / counted : 0.0);
            }

            // List.sort is stable, so ties keep discovery order
            List<Map.Entry<String, Integer>> byFrequency = new ArrayList<>(techniqueFrequency.entrySet());
            byFrequency.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
            List<String> mostCommon = byFrequency.stream()
                    .limit(TOP_TECHNIQUES)
                    .map(Map.Entry::getKey)
                    .toList();

            List<String> highConfidence = techniqueList.stream()
                    .filter(t -> t.confidence() >= HIGH_CONFIDENCE)
                    .sorted(Comparator.comparingDouble(Technique::confidence).reversed())
                    .limit(TOP_TECHNIQUES)
                    .map(Technique::id)
                    .toList();

            return new MitreStatistics(
                    techniqueList.size(),
                    tacticList.size(),
                    subTechniques,
                    Collections.unmodifiableMap(techniquesByTactic),
                    Collections.unmodifiableMap(confidenceByTactic),
                    mostCommon,
                    highConfidence,
                    overallScore(techniqueList));
        }

        private double overallScore(List<Technique> techniqueList) {
            double totalWeight = 0.0;
            double weightedScore = 0.0;
            for (Technique technique : techniqueList) {
                double weight = technique.matchCount() * technique.confidence();
                double severity;
                if (technique.tactics().isEmpty()) {
                    severity = ReferenceData.DEFAULT_TACTIC_SEVERITY;
                } else {
                    double sum = 0.0;
                    for (String tactic : technique.tactics()) {
                        sum += referenceData.tacticSeverity(tactic);
                    }
                    severity = sum / technique.tactics().size();
                }
                totalWeight += weight;
                weightedScore += weight * severity;
            }
            if (totalWeight <= 0.0) {
                return 0.0;
            }
            return Math.min(100.0, Math.max(0.0, weightedScore / totalWeight));
        }
    }

    private static String evidenceOf(RuleMatchResult match) {
        if (match.matches().isEmpty()) {
            return null;
        }
        return "Rule '" + match.ruleName() + "' matched: " + match.matches().get(0).matchedContent();
    }

    private static final class TechniqueAccumulator {
        private final String id;
        private final String name;
        private final List<String> tactics;
        private final Set<String> evidence = new LinkedHashSet<>();
        private final Map<String, SubTechniqueAccumulator> subTechniques = new LinkedHashMap<>();
        private double confidence;
        private int matchCount;

        TechniqueAccumulator(String id, String name, List<String> tactics) {
            this.id = id;
            this.name = name;
            this.tactics = tactics;
        }

        void add(double matchConfidence, String evidenceLine) {
            matchCount++;
            confidence = Math.max(confidence, matchConfidence);
            if (evidenceLine != null) {
                evidence.add(evidenceLine);
            }
        }

        Technique toTechnique() {
            List<SubTechnique> subs = new ArrayList<>(subTechniques.size());
            for (SubTechniqueAccumulator sub : subTechniques.values()) {
                subs.add(sub.toSubTechnique());
            }
            return new Technique(id, name, tactics, confidence, matchCount, new ArrayList<>(evidence), subs);
        }
    }

    private static final class SubTechniqueAccumulator {
        private final String id;
        private final String name;
        private final Set<String> evidence = new LinkedHashSet<>();
        private double confidence;
        private int matchCount;

        SubTechniqueAccumulator(String id, String name) {
            this.id = id;
            this.name = name;
        }

        void add(double matchConfidence, String evidenceLine) {
            matchCount++;
            confidence = Math.max(confidence, matchConfidence);
            if (evidenceLine != null) {
                evidence.add(evidenceLine);
            }
        }

        SubTechnique toSubTechnique() {
            return new SubTechnique(id, name, confidence, matchCount, new ArrayList<>(evidence));
        }
    }

    private static final class TacticAccumulator {
        private final String id;
        private final String name;
        private final Set<String> techniqueIds = new LinkedHashSet<>();

        TacticAccumulator(String id, String name) {
            this.id = id;
            this.name = name;
        }

        Tactic toTactic(int knownTechniques) {
            int count = techniqueIds.size();
            double coverage = knownTechniques > 0
                    ? Math.min(1.0, (double) count / knownTechniques)
                    : (count > 0 ? 1.0 : 0.0);
            return new Tactic(id, name, new ArrayList<>(techniqueIds), count, coverage);
        }
    }
}
