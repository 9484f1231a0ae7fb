package org.refactor.semantics.pattern;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Text constraint of an {@link AstPattern}: exact equality, substring, or regular expression
 * (found anywhere in the node text).
 */
public final class TextMatcher {

    public enum Mode { EXACT, CONTAINS, REGEX }

    private final Mode mode;
    private final String literal;
    private final Pattern regex;

    private TextMatcher(Mode mode, String literal, Pattern regex) {
        this.mode = mode;
        this.literal = literal;
        this.regex = regex;
    }

    public static TextMatcher exact(String text) {
        return new TextMatcher(Mode.EXACT, Objects.requireNonNull(text, "text"), null);
    }

    public static TextMatcher contains(String text) {
        return new TextMatcher(Mode.CONTAINS, Objects.requireNonNull(text, "text"), null);
    }

    public static TextMatcher regex(String regex) {
        return new TextMatcher(Mode.REGEX, null, Pattern.compile(regex));
    }

    public static TextMatcher regex(Pattern regex) {
        return new TextMatcher(Mode.REGEX, null, Objects.requireNonNull(regex, "regex"));
    }

    public Mode getMode() { return mode; }

    public boolean matches(String text) {
        String subject = text != null ? text : "";
        switch (mode) {
            case EXACT:
                return subject.equals(literal);
            case CONTAINS:
                return subject.contains(literal);
            default:
                return regex.matcher(subject).find();
        }
    }

    @Override
    public String toString() {
        return mode == Mode.REGEX ? "/" + regex.pattern() + "/" : mode.name().toLowerCase() + ":" + literal;
    }
}
