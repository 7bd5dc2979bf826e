package com.seqweb.results.client;

import java.util.List;

@FunctionalInterface
public interface SequenceFetcher {

    /**
     * @return FASTA text for the ids found in {@code database}, or an empty string when none were found
     */
    String fetch(List<String> sequenceIds, String database);
}
