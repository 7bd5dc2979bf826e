package com.seqweb.results.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "results")
public class ResultsProperties {

    /** Prefix for every generated link, e.g. the externally visible host. */
    @NotNull
    private String linkBaseUrl = "";

    /** Label of the header given to a submitted query that has none. */
    @NotBlank
    private String submittedLabelPattern = "'Submitted at' HH:mm, EEEE, MMMM dd, yyyy";

    /** Threads the aligner may use for one search. */
    @Min(1)
    private int numThreads = 1;

    public String getLinkBaseUrl() {
        return linkBaseUrl;
    }

    public void setLinkBaseUrl(String linkBaseUrl) {
        this.linkBaseUrl = linkBaseUrl;
    }

    public String getSubmittedLabelPattern() {
        return submittedLabelPattern;
    }

    public void setSubmittedLabelPattern(String submittedLabelPattern) {
        this.submittedLabelPattern = submittedLabelPattern;
    }

    public int getNumThreads() {
        return numThreads;
    }

    public void setNumThreads(int numThreads) {
        this.numThreads = numThreads;
    }
}
