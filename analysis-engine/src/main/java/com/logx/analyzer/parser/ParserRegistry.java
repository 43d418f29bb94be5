package com.logx.analyzer.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Priority-ordered registry of {@link LogParser} beans.
 *
 * <p>
 * A preferred parser is used only when it exists and accepts the file;
 * otherwise parsers are asked in ascending priority order and the first
 * match wins. Parsers that throw from {@code matches} are skipped.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class ParserRegistry implements ParserResolver {

    private static final Logger log = LoggerFactory.getLogger(ParserRegistry.class);

    private final List<LogParser> parsers;

    @Autowired
    public ParserRegistry(ObjectProvider<LogParser> parsers) {
        this(parsers.orderedStream().toList());
    }

    public ParserRegistry(List<LogParser> parsers) {
        List<LogParser> sorted = new ArrayList<>(parsers);
        sorted.sort(Comparator.comparingInt(LogParser::priority));
        this.parsers = List.copyOf(sorted);

        log.info("Parser registry initialized with {} parsers: {}",
                this.parsers.size(), this.parsers.stream().map(LogParser::id).toList());
    }

    @Override
    public Optional<LogParser> resolve(String filename, String content, String preferredParserId) {
        if (preferredParserId != null && !preferredParserId.isBlank()) {
            Optional<LogParser> preferred = find(preferredParserId);
            if (preferred.isPresent() && accepts(preferred.get(), filename, content)) {
                log.debug("Using preferred parser {} for {}", preferredParserId, filename);
                return preferred;
            }
            log.debug("Preferred parser {} not usable for {}, falling back", preferredParserId, filename);
        }

        for (LogParser parser : parsers) {
            if (accepts(parser, filename, content)) {
                log.debug("Parser {} selected for {}", parser.id(), filename);
                return Optional.of(parser);
            }
        }
        return Optional.empty();
    }

    /** Look up a parser by id. */
    public Optional<LogParser> find(String parserId) {
        return parsers.stream()
                .filter(p -> p.id().equalsIgnoreCase(parserId))
                .findFirst();
    }

    /** All registered parsers, lowest priority value first. */
    public List<LogParser> getParsers() {
        return parsers;
    }

    private static boolean accepts(LogParser parser, String filename, String content) {
        try {
            return parser.matches(filename, content);
        } catch (RuntimeException e) {
            log.warn("Parser {} failed capability check for {}: {}", parser.id(), filename, e.getMessage());
            return false;
        }
    }
}
