package com.seqweb.results.report;

import com.seqweb.results.domain.CoordinateSpan;
import com.seqweb.results.domain.HitRecord;
import com.seqweb.results.domain.QueryBlock;
import com.seqweb.results.domain.ReportLine;
import com.seqweb.results.domain.ReportSection;
import com.seqweb.results.report.link.StandardLinkStrategy;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ReportRewriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportRewriter.class);

    private static final Pattern QUERY_MARKER = Pattern.compile("^<b>Query=</b> (.*)");
    private static final String DATABASE_MARKER = "  Database: ";
    private static final String SUMMARY_END = "total letters";
    private static final String SCRIPT_INCLUSION = "<script src=\"blastResult.js\"></script>";
    private static final List<String> DROPPED_LINES = List.of("</BODY>", "</HTML>", "</PRE>");

    private final HitLineNormalizer normalizer;
    private final CoordinateScanner scanner;
    private final HyperlinkResolver resolver;

    public ReportRewriter(HitLineNormalizer normalizer, CoordinateScanner scanner, HyperlinkResolver resolver) {
        this.normalizer = normalizer;
        this.scanner = scanner;
        this.resolver = resolver;
    }

    public String rewrite(List<String> reportLines, List<String> databases) {
        Objects.requireNonNull(reportLines, "reportLines");
        Objects.requireNonNull(databases, "databases");
        return new Pass(ReportLine.number(reportLines), List.copyOf(databases)).run();
    }

    private final class Pass {

        private final List<ReportLine> lines;
        private final List<String> databases;
        private final AllRetrievableIds retrievableIds = new AllRetrievableIds();
        private final StringBuilder body = new StringBuilder();
        private final StringJoiner reference = new StringJoiner("\n");
        private final StringJoiner databaseSummary = new StringJoiner("\n");

        private ReportSection section = ReportSection.BANNER;
        private QueryBlock lastQuery;
        private boolean queryOpen;
        private boolean summaryInjected;

        private Pass(List<ReportLine> lines, List<String> databases) {
            this.lines = lines;
            this.databases = databases;
        }

        private String run() {
            for (ReportLine line : lines) {
                switch (section) {
                    case BANNER:
                        section = banner(line);
                        break;
                    case REFERENCE:
                        section = reference(line);
                        break;
                    case DATABASE_SUMMARY:
                        section = databaseSummary(line);
                        break;
                    default:
                        body(line);
                }
            }
            body.append(queryOpen ? "</pre></div>" : "</pre>");
            queryOpen = false;

            LOGGER.info("Rewrote report of {} lines: {} queries, {} linked hits",
                lines.size(), lastQuery == null ? 0 : lastQuery.ordinal(), retrievableIds.size());
            return render();
        }

        private ReportSection banner(ReportLine line) {
            if (line.ordinal() <= ReportSection.LAST_BANNER_LINE) {
                return ReportSection.BANNER;
            }
            // the line between banner and reference is kept as ordinary report text
            body(line);
            return ReportSection.REFERENCE;
        }

        private ReportSection reference(ReportLine line) {
            reference.add(line.text());
            return line.ordinal() < ReportSection.LAST_REFERENCE_LINE
                ? ReportSection.REFERENCE
                : ReportSection.DATABASE_SUMMARY;
        }

        private ReportSection databaseSummary(ReportLine line) {
            databaseSummary.add(line.text());
            return line.contains(SUMMARY_END) ? ReportSection.BODY : ReportSection.DATABASE_SUMMARY;
        }

        private void body(ReportLine line) {
            if (isDropped(line)) {
                return;
            }
            String text = line.text().replace(SCRIPT_INCLUSION, "");

            if (text.startsWith(">")) {
                append(hitLine(line, text));
                return;
            }

            Matcher query = QUERY_MARKER.matcher(text);
            if (query.find()) {
                openQuery(query.group(1));
                return;
            }

            if (text.startsWith(DATABASE_MARKER) && !summaryInjected) {
                injectDatabaseSummary();
            }
            append(text);
        }

        private String hitLine(ReportLine line, String text) {
            String normalized = normalizer.normalize(text);
            Optional<CoordinateSpan> span = scanner.scan(lines, line.ordinal());
            return resolver.resolve(HitRecord.fromLine(normalized, span), databases, retrievableIds);
        }

        private void openQuery(String label) {
            if (queryOpen) {
                body.append("</pre></div>\n");
            }
            lastQuery = lastQuery == null ? new QueryBlock(1, label) : lastQuery.next(label);
            queryOpen = true;
            append("<div class=\"resultn\" id=\"" + label + "\">\n<h3>Query= " + label + "</h3><pre>");
        }

        private void injectDatabaseSummary() {
            if (queryOpen) {
                body.append("</pre></div>\n");
                queryOpen = false;
            }
            body.append("<pre>").append(databaseSummary).append("\n\n");
            summaryInjected = true;
        }

        private void append(String text) {
            body.append(text).append('\n');
        }

        private boolean isDropped(ReportLine line) {
            for (String closingTag : DROPPED_LINES) {
                if (line.startsWith(closingTag)) {
                    return true;
                }
            }
            return false;
        }

        private String render() {
            StringBuilder out = new StringBuilder("<h2>Results</h2>");
            if (!retrievableIds.isEmpty()) {
                String fetchAll = StandardLinkStrategy.retrievalLink(retrievableIds.asList(), databases);
                out.append("<a href='").append(resolver.url(fetchAll)).append("'>FASTA of ")
                    .append(retrievableIds.size()).append(" retrievable hit(s)</a>");
            }
            return out.append("<br/><br/>")
                .append(body)
                .append("<br/>")
                .append("<pre>").append(reference.toString().strip()).append("</pre>")
                .toString();
        }
    }
}
