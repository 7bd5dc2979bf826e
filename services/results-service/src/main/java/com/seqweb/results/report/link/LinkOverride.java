package com.seqweb.results.report.link;

import com.seqweb.results.domain.HyperlinkRequest;
import java.util.Optional;

/**
 * Installation-specific link target for a hit, consulted before the standard link.
 */
@FunctionalInterface
public interface LinkOverride {

    LinkOverride NONE = request -> Optional.empty();

    Optional<String> link(HyperlinkRequest request);
}
