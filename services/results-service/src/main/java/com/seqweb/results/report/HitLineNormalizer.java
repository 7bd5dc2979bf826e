package com.seqweb.results.report;

import java.util.Optional;

public class HitLineNormalizer {

    public String normalize(String line) {
        return detect(line)
            .map(shape -> shape.normalize(line))
            .orElse(line);
    }

    public Optional<AnchorShape> detect(String line) {
        if (line == null || !line.startsWith(">")) {
            return Optional.empty();
        }
        if (AnchorShape.LEADING_ANCHOR.matches(line)) {
            return Optional.of(AnchorShape.LEADING_ANCHOR);
        }
        if (AnchorShape.TRAILING_ANCHOR.matches(line)) {
            return Optional.of(AnchorShape.TRAILING_ANCHOR);
        }
        return Optional.empty();
    }
}
