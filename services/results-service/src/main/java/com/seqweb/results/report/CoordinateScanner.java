package com.seqweb.results.report;

import com.seqweb.results.domain.CoordinateSpan;
import com.seqweb.results.domain.ReportLine;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CoordinateScanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(CoordinateScanner.class);

    private static final Pattern HIT_BOUNDARY = Pattern.compile(">lcl|Lambda");
    private static final String SUBJECT_ROW = "Sbjct";

    public Optional<CoordinateSpan> scan(List<ReportLine> lines, int headerOrdinal) {
        int from = Math.min(headerOrdinal, lines.size());
        int to = boundaryIndex(lines, from);

        CoordinateSpan span = null;
        for (ReportLine line : lines.subList(from, to)) {
            if (!line.contains(SUBJECT_ROW)) {
                continue;
            }
            int[] ends = rowEnds(line);
            if (ends.length == 0) {
                continue;
            }
            span = span == null ? CoordinateSpan.of(ends[0], ends[1]) : span.include(ends[0]).include(ends[1]);
        }
        return Optional.ofNullable(span);
    }

    private int boundaryIndex(List<ReportLine> lines, int from) {
        for (int i = from; i < lines.size(); i++) {
            if (HIT_BOUNDARY.matcher(lines.get(i).text()).find()) {
                return i;
            }
        }
        LOGGER.warn("No hit boundary after line {}; scanning to end of report", from);
        return lines.size();
    }

    private int[] rowEnds(ReportLine line) {
        String[] fields = line.text().trim().split("\\s+");
        if (fields.length < 2) {
            return new int[0];
        }
        try {
            return new int[] {Integer.parseInt(fields[1]), Integer.parseInt(fields[fields.length - 1])};
        } catch (NumberFormatException ex) {
            LOGGER.debug("Skipping subject row {} without numeric coordinates: {}", line.ordinal(), ex.getMessage());
            return new int[0];
        }
    }
}
