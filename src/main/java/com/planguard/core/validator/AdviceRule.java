package com.planguard.core.validator;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One named pattern rule that turns validator output into diagnostic messages.
 * Rules are evaluated in order, most specific first; a rule contributes
 * nothing when its pattern does not match.
 */
final class AdviceRule {

    private final String                    name;
    private final Pattern                   pattern;
    private final boolean                   allMatches;
    private final Function<Matcher, String> formatter;

    private AdviceRule(String name, Pattern pattern, boolean allMatches, Function<Matcher, String> formatter) {
        this.name       = name;
        this.pattern    = pattern;
        this.allMatches = allMatches;
        this.formatter  = formatter;
    }

    /** Contributes at most one message, from the first match. */
    static AdviceRule first(String name, Pattern pattern, Function<Matcher, String> formatter) {
        return new AdviceRule(name, pattern, false, formatter);
    }

    /** Contributes one message per match. */
    static AdviceRule each(String name, Pattern pattern, Function<Matcher, String> formatter) {
        return new AdviceRule(name, pattern, true, formatter);
    }

    String name() {
        return name;
    }

    List<String> apply(String output) {
        List<String> messages = new ArrayList<>();
        Matcher m = pattern.matcher(output);
        while (m.find()) {
            messages.add(formatter.apply(m));
            if (!allMatches) break;
        }
        return messages;
    }
}
