package com.seqweb.results.service;

import com.seqweb.results.client.SequenceFetcher;
import com.seqweb.results.domain.RetrievalRequest;
import com.seqweb.results.domain.RetrievalResult;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.HtmlUtils;

public class RetrievalReconciler {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalReconciler.class);

    public RetrievalResult retrieve(RetrievalRequest request, SequenceFetcher fetcher) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(fetcher, "fetcher");
        LOGGER.info("Looking for: '{}' in '{}'",
            String.join(", ", request.sequenceIds()), String.join(", ", request.databases()));

        StringBuilder found = new StringBuilder();
        for (String database : request.databases()) {
            String sequences = fetcher.fetch(request.sequenceIds(), database);
            if (sequences == null || sequences.isEmpty()) {
                LOGGER.debug("'{}' not found in {}", String.join(", ", request.sequenceIds()), database);
                continue;
            }
            found.append(sequences);
        }
        return RetrievalResult.of(found.toString());
    }

    public String reconcile(RetrievalRequest request, SequenceFetcher fetcher) {
        RetrievalResult result = retrieve(request, fetcher);

        StringBuilder out = new StringBuilder();
        if (!result.matches(request)) {
            LOGGER.warn("Expected {} sequences but found {} in {}",
                request.sequenceIds().size(), result.foundCount(), request.databases());
            out.append(diagnostic(request, result));
        }
        out.append("<pre><code>").append(HtmlUtils.htmlEscape(result.sequences())).append("</code></pre>");
        return out.toString();
    }

    private String diagnostic(RetrievalRequest request, RetrievalResult result) {
        int requested = request.sequenceIds().size();
        int found = result.foundCount();
        return "<h1>ERROR: incorrect number of sequences found.</h1>\n"
            + "<p>Dear user,</p>\n\n"
            + "<p><strong>We have found\n"
            + "<em>" + (found > requested ? "more" : "less") + "</em>\n"
            + "sequences than expected.</strong></p>\n\n"
            + "<p>This is likely due to a problem with how databases are formatted.\n"
            + "<strong>Please share this text with the person managing this website so\n"
            + "they can resolve the issue.</strong></p>\n\n"
            + "<p> You requested " + requested + " " + sequences(requested) + "\n"
            + "with the following identifiers: <code>"
            + HtmlUtils.htmlEscape(String.join(", ", request.sequenceIds())) + "</code>,\n"
            + "from the following databases: <code>"
            + HtmlUtils.htmlEscape(String.join(", ", request.databases())) + "</code>.\n"
            + "But we found " + found + " " + sequences(found) + ".\n"
            + "</p>\n\n"
            + "<p>If sequences were retrieved, you can find them below (but some may be incorrect, so be careful!).</p>\n"
            + "<hr/>\n";
    }

    private static String sequences(int count) {
        return count == 1 ? "sequence" : "sequences";
    }
}
