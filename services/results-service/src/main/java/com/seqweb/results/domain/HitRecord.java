package com.seqweb.results.domain;

import java.util.Objects;
import java.util.Optional;

public record HitRecord(
    String line,
    String sequenceId,
    Optional<CoordinateSpan> span,
    Optional<String> link
) {

    public HitRecord {
        Objects.requireNonNull(line, "line");
        Objects.requireNonNull(sequenceId, "sequenceId");
        span = span == null ? Optional.empty() : span;
        link = link == null ? Optional.empty() : link;
    }

    public String hitText() {
        return line.startsWith(">") ? line.substring(1).stripTrailing() : line.stripTrailing();
    }

    public HitRecord withLink(String resolvedLink) {
        return new HitRecord(line, sequenceId, span, Optional.ofNullable(resolvedLink));
    }

    public static HitRecord fromLine(String line, Optional<CoordinateSpan> span) {
        return new HitRecord(line, sequenceIdOf(line), span, Optional.empty());
    }

    public static String sequenceIdOf(String line) {
        String body = line.startsWith(">") ? line.substring(1) : line;
        if (body.isEmpty() || Character.isWhitespace(body.charAt(0))) {
            return "";
        }
        return body.split("\\s+", 2)[0];
    }
}
