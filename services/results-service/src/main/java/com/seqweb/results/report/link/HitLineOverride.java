package com.seqweb.results.report.link;

import com.seqweb.results.domain.HyperlinkRequest;
import java.util.Optional;

/**
 * Installation-specific replacement for a whole hit line. When it yields a value, that value is emitted verbatim.
 */
@FunctionalInterface
public interface HitLineOverride {

    HitLineOverride NONE = request -> Optional.empty();

    Optional<String> hitLine(HyperlinkRequest request);
}
