package com.seqweb.results.domain;

public enum ReportSection {
    BANNER,
    REFERENCE,
    DATABASE_SUMMARY,
    BODY;

    public static final int LAST_BANNER_LINE = 5;
    public static final int LAST_REFERENCE_LINE = 15;
}
