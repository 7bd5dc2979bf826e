package com.seqweb.results.report.link;

import com.seqweb.results.domain.HyperlinkRequest;
import java.util.Optional;

@FunctionalInterface
public interface LinkStrategy {

    Optional<String> link(HyperlinkRequest request);
}
