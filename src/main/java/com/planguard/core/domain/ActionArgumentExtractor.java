package com.planguard.core.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * ActionArgumentExtractor — reads an action line into name + arguments.
 *
 * Strategies are tried in order; the first match wins:
 *   1. parenthesized   "(stack a b)"
 *   2. call-syntax     "stack(a, b)"
 *   3. whitespace      "stack a b"
 * No match is an explicit empty result; nothing is guessed.
 */
public class ActionArgumentExtractor {

    /** One named way of reading an action line. */
    public static final class Strategy {
        private final String                                 name;
        private final Function<String, Optional<GroundAction>> reader;

        public Strategy(String name, Function<String, Optional<GroundAction>> reader) {
            this.name   = name;
            this.reader = reader;
        }

        public String getName() { return name; }

        public Optional<GroundAction> read(String line) {
            return reader.apply(line);
        }
    }

    private static final String TOKEN = "[A-Za-z0-9_][A-Za-z0-9_\\-]*";

    private static final Pattern PARENTHESIZED =
            Pattern.compile("^\\(\\s*(" + TOKEN + ")((?:\\s+" + TOKEN + ")*)\\s*\\)$");

    private static final Pattern CALL_SYNTAX =
            Pattern.compile("^(" + TOKEN + ")\\s*\\(\\s*((?:" + TOKEN + ")(?:\\s*,\\s*" + TOKEN + ")*)?\\s*\\)$");

    private static final Pattern WHITESPACE =
            Pattern.compile("^(" + TOKEN + ")((?:\\s+" + TOKEN + ")*)$");

    public static final Strategy PARENTHESIZED_STRATEGY = new Strategy("parenthesized",
            line -> match(PARENTHESIZED, line, ActionArgumentExtractor::splitSpaces));

    public static final Strategy CALL_SYNTAX_STRATEGY = new Strategy("call-syntax",
            line -> match(CALL_SYNTAX, line, ActionArgumentExtractor::splitCommas));

    public static final Strategy WHITESPACE_STRATEGY = new Strategy("whitespace",
            line -> match(WHITESPACE, line, ActionArgumentExtractor::splitSpaces));

    private final List<Strategy> strategies;

    public ActionArgumentExtractor() {
        this(List.of(PARENTHESIZED_STRATEGY, CALL_SYNTAX_STRATEGY, WHITESPACE_STRATEGY));
    }

    public ActionArgumentExtractor(List<Strategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public Optional<GroundAction> extract(String line) {
        if (line == null || line.isBlank()) return Optional.empty();
        String trimmed = line.trim();
        for (Strategy strategy : strategies) {
            Optional<GroundAction> result = strategy.read(trimmed);
            if (result.isPresent()) return result;
        }
        return Optional.empty();
    }

    public List<Strategy> getStrategies() {
        return strategies;
    }

    private static Optional<GroundAction> match(Pattern pattern, String line,
                                                Function<String, List<String>> splitter) {
        Matcher m = pattern.matcher(line);
        if (!m.matches()) return Optional.empty();

        String name = m.group(1).toLowerCase(Locale.ROOT);
        String rest = m.group(2);
        List<String> args = rest == null || rest.isBlank() ? List.of() : splitter.apply(rest);
        return Optional.of(new GroundAction(name, args));
    }

    private static List<String> splitSpaces(String s) {
        return Arrays.stream(s.trim().split("\\s+"))
                .map(a -> a.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static List<String> splitCommas(String s) {
        return Arrays.stream(s.split(","))
                .map(String::trim)
                .filter(a -> !a.isEmpty())
                .map(a -> a.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
