package com.seqweb.results.report;

import static org.assertj.core.api.Assertions.assertThat;

import com.seqweb.results.domain.CoordinateSpan;
import com.seqweb.results.domain.ReportLine;
import java.util.List;
import org.junit.jupiter.api.Test;

class CoordinateScannerTest {

    private final CoordinateScanner scanner = new CoordinateScanner();

    @Test
    void spanCoversEverySubjectRowRegardlessOfOrder() {
        List<ReportLine> lines = ReportLine.number(List.of(
            ">SI2.2.0_06267 locus=Si_gnF.scaffold02592",
            "Length=200",
            "Query  1   ACGTACGT  41",
            "Sbjct  10  ACGTACGT  50",
            "Query  42  ACGTACGT  77",
            "Sbjct  5   ACGTACGT  40",
            "Lambda     K      H"
        ));

        assertThat(scanner.scan(lines, 1)).contains(new CoordinateSpan(5, 50));
    }

    @Test
    void reverseStrandRowsStillGiveOrderedSpan() {
        List<ReportLine> lines = ReportLine.number(List.of(
            ">hit",
            "Sbjct  300  ACGT  250",
            ">lcl|next"
        ));

        assertThat(scanner.scan(lines, 1)).contains(new CoordinateSpan(250, 300));
    }

    @Test
    void stopsAtNextLocalSequenceHeader() {
        List<ReportLine> lines = ReportLine.number(List.of(
            ">first",
            "Sbjct  1  ACGT  4",
            ">lcl|second",
            "Sbjct  900  ACGT  990",
            "Lambda     K      H"
        ));

        assertThat(scanner.scan(lines, 1)).contains(new CoordinateSpan(1, 4));
    }

    @Test
    void scansToEndOfReportWhenNoBoundaryFollows() {
        List<ReportLine> lines = ReportLine.number(List.of(
            ">hit",
            "Sbjct  20  ACGT  23",
            "Sbjct  24  ACGT  27"
        ));

        assertThat(scanner.scan(lines, 1)).contains(new CoordinateSpan(20, 27));
    }

    @Test
    void spanIsAbsentWithoutSubjectRows() {
        List<ReportLine> lines = ReportLine.number(List.of(
            ">hit",
            "Length=200",
            "Lambda     K      H"
        ));

        assertThat(scanner.scan(lines, 1)).isEmpty();
    }

    @Test
    void rowsWithoutNumericCoordinatesAreSkipped() {
        List<ReportLine> lines = ReportLine.number(List.of(
            ">hit",
            "Sbjct",
            "Sbjct  start  ACGT  end",
            "Sbjct  7  ACGT  9",
            "Lambda     K      H"
        ));

        assertThat(scanner.scan(lines, 1)).contains(new CoordinateSpan(7, 9));
    }

    @Test
    void headerOnLastLineHasNoSpan() {
        List<ReportLine> lines = ReportLine.number(List.of("Length=1", ">hit"));

        assertThat(scanner.scan(lines, 2)).isEmpty();
    }
}
