package com.logx.analyzer.parser;

import com.logx.analyzer.analysis.CancellationToken;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ParserRegistryTest {

    private final LogParser syslog = new StubParser("syslog", 10, ".log");
    private final LogParser generic = new StubParser("generic", 100, "");
    private final LogParser json = new StubParser("json", 20, ".json");

    @Test
    void shouldOrderParsersByPriority() {
        ParserRegistry registry = new ParserRegistry(List.of(generic, json, syslog));

        assertEquals(List.of("syslog", "json", "generic"),
                registry.getParsers().stream().map(LogParser::id).toList());
    }

    @Test
    void shouldPickFirstMatchingParserByPriority() {
        ParserRegistry registry = new ParserRegistry(List.of(generic, json, syslog));

        assertEquals("syslog", registry.resolve("auth.log", "x", null).orElseThrow().id());
        assertEquals("json", registry.resolve("events.json", "{}", null).orElseThrow().id());
        assertEquals("generic", registry.resolve("notes.txt", "x", null).orElseThrow().id());
    }

    @Test
    void shouldPreferRequestedParserWhenItMatches() {
        ParserRegistry registry = new ParserRegistry(List.of(generic, json, syslog));

        assertEquals("generic", registry.resolve("auth.log", "x", "generic").orElseThrow().id());
    }

    @Test
    void shouldFallBackWhenPreferredParserDoesNotMatch() {
        ParserRegistry registry = new ParserRegistry(List.of(generic, json, syslog));

        assertEquals("syslog", registry.resolve("auth.log", "x", "json").orElseThrow().id());
        assertEquals("syslog", registry.resolve("auth.log", "x", "missing").orElseThrow().id());
    }

    @Test
    void shouldReturnEmptyWhenNothingMatches() {
        ParserRegistry registry = new ParserRegistry(List.of(json, syslog));

        assertTrue(registry.resolve("image.png", "x", null).isEmpty());
        assertTrue(new ParserRegistry(List.of()).resolve("auth.log", "x", null).isEmpty());
    }

    @Test
    void shouldSkipParsersFailingTheCapabilityCheck() {
        LogParser broken = new StubParser("broken", 1, ".log") {
            @Override
            public boolean matches(String filename, String content) {
                throw new IllegalStateException("boom");
            }
        };
        ParserRegistry registry = new ParserRegistry(List.of(broken, syslog));

        Optional<LogParser> resolved = registry.resolve("auth.log", "x", null);

        assertEquals("syslog", resolved.orElseThrow().id());
    }

    @Test
    void shouldDefaultFailureMessage() {
        ParseResult result = ParseResult.failure("syslog", " ");

        assertFalse(result.success());
        assertEquals("Parser reported an error", result.errorMessage());
        assertTrue(result.events().isEmpty());
        assertEquals("syslog", result.parserId());
    }

    private static class StubParser implements LogParser {
        private final String id;
        private final int priority;
        private final String suffix;

        StubParser(String id, int priority, String suffix) {
            this.id = id;
            this.priority = priority;
            this.suffix = suffix;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public String name() {
            return id + " parser";
        }

        @Override
        public int priority() {
            return priority;
        }

        @Override
        public boolean matches(String filename, String content) {
            return filename.endsWith(suffix);
        }

        @Override
        public ParseResult parse(String filename, String content, CancellationToken token) {
            return ParseResult.success(id, List.of());
        }
    }
}
