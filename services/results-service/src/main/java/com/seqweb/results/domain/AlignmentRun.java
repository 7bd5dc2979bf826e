package com.seqweb.results.domain;

import java.util.List;

public record AlignmentRun(
    List<String> reportLines,
    boolean success,
    int status,
    String message
) {

    public AlignmentRun {
        reportLines = reportLines == null ? List.of() : List.copyOf(reportLines);
    }

    public static AlignmentRun succeeded(List<String> reportLines) {
        return new AlignmentRun(reportLines, true, 200, null);
    }

    public static AlignmentRun failed(int status, String message) {
        return new AlignmentRun(List.of(), false, status, message);
    }
}
