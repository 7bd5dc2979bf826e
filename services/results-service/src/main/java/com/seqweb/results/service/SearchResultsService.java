package com.seqweb.results.service;

import com.seqweb.results.client.AlignmentRunner;
import com.seqweb.results.client.SequenceFetcher;
import com.seqweb.results.config.ResultsProperties;
import com.seqweb.results.domain.AlignmentRun;
import com.seqweb.results.domain.RetrievalRequest;
import com.seqweb.results.report.ReportRewriter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SearchResultsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SearchResultsService.class);

    private final QueryInputNormalizer queryInputNormalizer;
    private final ReportRewriter reportRewriter;
    private final RetrievalReconciler retrievalReconciler;
    private final ResultsProperties properties;

    public SearchResultsService(
        QueryInputNormalizer queryInputNormalizer,
        ReportRewriter reportRewriter,
        RetrievalReconciler retrievalReconciler,
        ResultsProperties properties
    ) {
        this.queryInputNormalizer = queryInputNormalizer;
        this.reportRewriter = reportRewriter;
        this.retrievalReconciler = retrievalReconciler;
        this.properties = properties;
    }

    public String prepareQuery(String submitted) {
        return queryInputNormalizer.toFasta(submitted);
    }

    /**
     * Normalizes the query, runs it through {@code runner} against {@code databases} and formats the report.
     * A plain {@code blastn} search gets {@code -task blastn} unless the options already name a task; every search
     * gets {@code -num_threads} from {@code results.num-threads}.
     */
    public String search(String method, String submitted, List<String> databases, String options, AlignmentRunner runner) {
        String advanced = options == null ? "" : options;
        if ("blastn".equals(method) && !advanced.contains("task")) {
            advanced = advanced + " -task blastn ";
        }
        advanced = advanced + " -num_threads " + properties.getNumThreads();
        AlignmentRun run = runner.run(method, prepareQuery(submitted), String.join(" ", databases), advanced);
        LOGGER.info("Ran {} against {}", method, databases);
        return formatResults(run, databases);
    }

    public String formatResults(AlignmentRun run, List<String> databases) {
        if (!run.success()) {
            LOGGER.warn("Alignment run failed with status {}: {}", run.status(), run.message());
            throw new AlignmentRunFailedException(run.status(), run.message());
        }
        LOGGER.info("Formatting {} report lines for databases {}", run.reportLines().size(), databases);
        return reportRewriter.rewrite(run.reportLines(), databases);
    }

    public String retrieveSequences(String idParam, String dbParam, SequenceFetcher fetcher) {
        RetrievalRequest request = RetrievalRequest.parse(idParam, dbParam);
        if (request.sequenceIds().isEmpty()) {
            throw new IllegalArgumentException("No sequence identifiers requested");
        }
        if (request.databases().isEmpty()) {
            throw new IllegalArgumentException("No retrieval database requested");
        }
        return retrievalReconciler.reconcile(request, fetcher);
    }
}
