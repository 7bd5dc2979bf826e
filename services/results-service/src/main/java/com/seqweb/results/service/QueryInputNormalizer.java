package com.seqweb.results.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Makes submitted query text safe to hand to the aligner: every entry gets a header and no two headers share an
 * identifier. Input that is empty or only whitespace is returned as an empty string, without a header.
 *
 * <pre>
 *   toFasta("acgt") -> "&gt;Submitted at 15:33, Monday, February 14, 2011\nacgt"
 * </pre>
 */
public class QueryInputNormalizer {

    private static final Pattern HEADER = Pattern.compile("^>(\\S+)", Pattern.MULTILINE);

    private final Clock clock;
    private final DateTimeFormatter labelFormat;

    public QueryInputNormalizer(Clock clock, String labelPattern) {
        this.clock = clock;
        this.labelFormat = DateTimeFormatter.ofPattern(labelPattern, Locale.ENGLISH);
    }

    public String toFasta(String submitted) {
        String sequence = submitted == null ? "" : submitted.stripLeading();
        if (sequence.isEmpty()) {
            return sequence;
        }
        if (!sequence.startsWith(">")) {
            sequence = ">" + generatedLabel() + "\n" + sequence;
        }

        Map<String, Integer> seen = new HashMap<>();
        Matcher matcher = HEADER.matcher(sequence);
        StringBuilder out = new StringBuilder(sequence.length() + 16);
        while (matcher.find()) {
            String header = matcher.group();
            int occurrences = seen.merge(header, 1, Integer::sum);
            String replacement = occurrences == 1 ? header : header + "_" + (occurrences - 1);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    String generatedLabel() {
        return LocalDateTime.now(clock).format(labelFormat);
    }
}
