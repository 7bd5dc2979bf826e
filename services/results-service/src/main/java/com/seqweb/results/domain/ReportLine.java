package com.seqweb.results.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record ReportLine(int ordinal, String text) {

    public ReportLine {
        if (ordinal < 1) {
            throw new IllegalArgumentException("ordinal must be >= 1: " + ordinal);
        }
        Objects.requireNonNull(text, "text");
    }

    public boolean startsWith(String prefix) {
        return text.startsWith(prefix);
    }

    public boolean contains(CharSequence fragment) {
        return text.contains(fragment);
    }

    public static List<ReportLine> number(List<String> lines) {
        List<ReportLine> numbered = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            numbered.add(new ReportLine(i + 1, lines.get(i)));
        }
        return List.copyOf(numbered);
    }
}
