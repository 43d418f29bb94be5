package com.logx.analyzer.detection;

/**
 * Thrown by a {@link RuleEngine} that could not evaluate its rule set.
 *
 * @author Naveed Gung
 */
public class RuleEngineException extends RuntimeException {

    public RuleEngineException(String message) {
        super(message);
    }

    public RuleEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
