package com.seqweb.results.client;

import com.seqweb.results.domain.AlignmentRun;

@FunctionalInterface
public interface AlignmentRunner {

    AlignmentRun run(String method, String queryFasta, String databasePaths, String options);
}
