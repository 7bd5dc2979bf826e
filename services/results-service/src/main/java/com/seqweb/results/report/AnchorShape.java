package com.seqweb.results.report;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public enum AnchorShape {

    /** Database formatted with identifier parsing: {@code >ID<a name=ID></a> description}. */
    TRAILING_ANCHOR(Pattern.compile("^>([^<]+?)(<a [^>]*></a>)(.*)$", Pattern.DOTALL)) {
        @Override
        String strip(Matcher matcher) {
            return ">" + matcher.group(1) + matcher.group(3);
        }
    },

    /** Database formatted without identifier parsing: {@code ><a name=N></a>ID description}. */
    LEADING_ANCHOR(Pattern.compile("^>(<a [^>]*></a>)(.*)$", Pattern.DOTALL)) {
        @Override
        String strip(Matcher matcher) {
            return ">" + matcher.group(2);
        }
    };

    private final Pattern pattern;

    AnchorShape(Pattern pattern) {
        this.pattern = pattern;
    }

    abstract String strip(Matcher matcher);

    public boolean matches(String line) {
        return pattern.matcher(line).matches();
    }

    public String normalize(String line) {
        Matcher matcher = pattern.matcher(line);
        return matcher.matches() ? strip(matcher) : line;
    }
}
