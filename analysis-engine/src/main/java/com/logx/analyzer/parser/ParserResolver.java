package com.logx.analyzer.parser;

import java.util.Optional;

/**
 * Chooses the parser for an evidence file.
 *
 * @author Naveed Gung
 */
public interface ParserResolver {

    /**
     * @param filename          original file name
     * @param content           file content
     * @param preferredParserId parser to try first, may be null
     * @return a parser that matches the file, or empty when none does
     */
    Optional<LogParser> resolve(String filename, String content, String preferredParserId);
}
