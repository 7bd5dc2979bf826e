package com.seqweb.results.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record HyperlinkRequest(
    String sequenceId,
    String hitText,
    List<String> databases,
    Optional<CoordinateSpan> span
) {

    public HyperlinkRequest {
        Objects.requireNonNull(sequenceId, "sequenceId");
        Objects.requireNonNull(hitText, "hitText");
        databases = List.copyOf(databases);
        span = span == null ? Optional.empty() : span;
    }

    public static HyperlinkRequest of(HitRecord hit, List<String> databases) {
        return new HyperlinkRequest(hit.sequenceId(), hit.hitText(), databases, hit.span());
    }
}
