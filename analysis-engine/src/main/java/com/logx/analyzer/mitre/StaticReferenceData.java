package com.logx.analyzer.mitre;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable {@link ReferenceData} backed by a JSON document.
 *
 * <p>
 * Document layout:
 * </p>
 *
 * <pre>
 * {
 *   "tactics":    [ { "id": "TA0002", "name": "Execution", "severity": 80 }, ... ],
 *   "techniques": [ { "id": "T1059", "name": "...", "tactics": ["Execution"] }, ... ]
 * }
 * </pre>
 *
 * <p>
 * Tactics are listed in kill-chain order. Sub-techniques are listed as their
 * own entries.
 * </p>
 *
 * @author Naveed Gung
 */
public final class StaticReferenceData implements ReferenceData {

    private static final Logger log = LoggerFactory.getLogger(StaticReferenceData.class);

    private final Map<String, TechniqueReference> techniques;
    private final Map<String, TacticReference> tacticsByKey;
    private final List<TacticReference> tactics;
    private final Map<String, Integer> techniqueCounts;

    public StaticReferenceData(List<TacticReference> tactics, List<TechniqueReference> techniques) {
        Map<String, TacticReference> byKey = new HashMap<>();
        for (TacticReference tactic : tactics) {
            byKey.put(tacticKey(tactic.name()), tactic);
        }

        Map<String, TechniqueReference> byId = new HashMap<>();
        Map<String, Integer> counts = new HashMap<>();
        for (TechniqueReference technique : techniques) {
            String id = technique.id().toUpperCase(Locale.ROOT);
            byId.put(id, technique);
            if (id.indexOf('.') < 0) {
                for (String tactic : technique.tactics()) {
                    counts.merge(tacticKey(tactic), 1, Integer::sum);
                }
            }
        }

        this.tactics = List.copyOf(tactics);
        this.tacticsByKey = Collections.unmodifiableMap(byKey);
        this.techniques = Collections.unmodifiableMap(byId);
        this.techniqueCounts = Collections.unmodifiableMap(counts);
    }

    /**
     * Load the reference tables from a JSON stream.
     *
     * @throws IOException if the stream cannot be read or is malformed
     */
    public static StaticReferenceData load(InputStream in, ObjectMapper objectMapper) throws IOException {
        Document document = objectMapper.readValue(in, Document.class);
        List<TacticReference> tactics = document.tactics() == null ? List.of() : document.tactics();
        List<TechniqueReference> techniques = document.techniques() == null
                ? List.of()
                : new ArrayList<>(document.techniques());

        StaticReferenceData data = new StaticReferenceData(tactics, techniques);
        log.info("Loaded MITRE ATT&CK reference data: {} tactics, {} techniques",
                tactics.size(), techniques.size());
        return data;
    }

    @Override
    public Optional<TechniqueReference> technique(String techniqueId) {
        if (techniqueId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(techniques.get(techniqueId.toUpperCase(Locale.ROOT)));
    }

    @Override
    public Optional<TacticReference> tactic(String tacticName) {
        if (tacticName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tacticsByKey.get(tacticKey(tacticName)));
    }

    @Override
    public List<TacticReference> tactics() {
        return tactics;
    }

    @Override
    public int techniqueCount(String tacticName) {
        return tacticName == null ? 0 : techniqueCounts.getOrDefault(tacticKey(tacticName), 0);
    }

    /** "Command and Control", "command_and_control" and "CommandAndControl" share one key. */
    static String tacticKey(String name) {
        StringBuilder key = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            if (Character.isLetter(c)) {
                key.append(Character.toLowerCase(c));
            }
        }
        return key.toString();
    }

    record Document(List<TacticReference> tactics, List<TechniqueReference> techniques) {
    }
}
