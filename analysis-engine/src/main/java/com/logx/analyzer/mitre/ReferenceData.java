package com.logx.analyzer.mitre;

import java.util.List;
import java.util.Optional;

/**
 * Read-only MITRE ATT&amp;CK reference tables: technique names and tactics,
 * tactic identifiers and base severities.
 *
 * <p>
 * Loaded once at startup and shared by every analysis; implementations must
 * be immutable.
 * </p>
 *
 * @author Naveed Gung
 */
public interface ReferenceData {

    /** Severity used for tactics the table does not know. */
    double DEFAULT_TACTIC_SEVERITY = 50.0;

    /**
     * Look up a technique or sub-technique by id.
     *
     * @param techniqueId upper-case id such as {@code T1059} or {@code T1059.001}
     */
    Optional<TechniqueReference> technique(String techniqueId);

    /** Look up a tactic by display name (case and spacing insensitive). */
    Optional<TacticReference> tactic(String tacticName);

    /** All tactics in kill-chain order. */
    List<TacticReference> tactics();

    /** Number of parent techniques the table lists under a tactic. */
    int techniqueCount(String tacticName);

    /** Tactic names of a technique; empty when the technique is unknown. */
    default List<String> tacticsOf(String techniqueId) {
        return technique(techniqueId).map(TechniqueReference::tactics).orElse(List.of());
    }

    /** Base severity of a tactic in [0, 100]. */
    default double tacticSeverity(String tacticName) {
        return tactic(tacticName).map(TacticReference::severity).orElse(DEFAULT_TACTIC_SEVERITY);
    }

    /**
     * A technique or sub-technique entry.
     *
     * @param id      technique id
     * @param name    display name
     * @param tactics names of the tactics the technique serves
     */
    record TechniqueReference(String id, String name, List<String> tactics) {
        public TechniqueReference {
            tactics = tactics == null ? List.of() : List.copyOf(tactics);
        }
    }

    /**
     * A tactic entry.
     *
     * @param id       ATT&amp;CK tactic id, e.g. {@code TA0002}
     * @param name     display name, e.g. "Execution"
     * @param severity base severity in [0, 100]
     */
    record TacticReference(String id, String name, double severity) {
    }
}
