package com.logx.analyzer.parser;

import com.logx.analyzer.event.LogEvent;

import java.util.List;

/**
 * Outcome of one {@link LogParser#parse} call.
 *
 * @param events       extracted events, empty on failure
 * @param success      whether the parser could read the file
 * @param errorMessage failure reason, null on success
 * @param parserId     id of the parser that produced this result
 *
 * @author Naveed Gung
 */
public record ParseResult(List<LogEvent> events, boolean success, String errorMessage, String parserId) {

    public ParseResult {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static ParseResult success(String parserId, List<LogEvent> events) {
        return new ParseResult(events, true, null, parserId);
    }

    public static ParseResult failure(String parserId, String errorMessage) {
        return new ParseResult(List.of(), false,
                errorMessage == null || errorMessage.isBlank() ? "Parser reported an error" : errorMessage,
                parserId);
    }
}
