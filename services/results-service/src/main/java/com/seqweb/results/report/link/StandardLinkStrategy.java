package com.seqweb.results.report.link;

import com.seqweb.results.domain.HyperlinkRequest;
import java.util.List;
import java.util.Optional;

public class StandardLinkStrategy implements LinkStrategy {

    public static final String RETRIEVAL_PATH = "/get_sequence/";

    @Override
    public Optional<String> link(HyperlinkRequest request) {
        if (request.sequenceId().isBlank() || request.databases().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(retrievalLink(List.of(request.sequenceId()), request.databases()));
    }

    public static String retrievalLink(Iterable<String> sequenceIds, Iterable<String> databases) {
        return RETRIEVAL_PATH + "?id=" + String.join(" ", sequenceIds) + "&db=" + String.join(" ", databases);
    }
}
