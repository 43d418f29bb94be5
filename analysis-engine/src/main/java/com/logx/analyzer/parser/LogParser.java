package com.logx.analyzer.parser;

import com.logx.analyzer.analysis.CancellationToken;

/**
 * A parser for one evidence format.
 *
 * <p>
 * Implementations are discovered as Spring beans and consulted by
 * {@link ParserRegistry} in ascending {@link #priority()} order. They must be
 * stateless: the same instance parses files of concurrent analyses.
 * </p>
 *
 * @author Naveed Gung
 */
public interface LogParser {

    /** Stable identifier, used as the preferred-parser option. */
    String id();

    /** Human readable name. */
    String name();

    /** Lower values are consulted first. */
    default int priority() {
        return 100;
    }

    /**
     * Capability check.
     *
     * @param filename original file name
     * @param content  file content
     * @return true if this parser can read the file
     */
    boolean matches(String filename, String content);

    /**
     * Extract log events.
     *
     * <p>
     * Format errors are reported through {@link ParseResult#failure}, not by
     * throwing.
     * </p>
     */
    ParseResult parse(String filename, String content, CancellationToken token);
}
