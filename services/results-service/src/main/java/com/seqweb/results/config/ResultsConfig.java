package com.seqweb.results.config;

import com.seqweb.results.report.CoordinateScanner;
import com.seqweb.results.report.HitLineNormalizer;
import com.seqweb.results.report.HyperlinkResolver;
import com.seqweb.results.report.ReportRewriter;
import com.seqweb.results.report.link.HitLineOverride;
import com.seqweb.results.report.link.LinkOverride;
import com.seqweb.results.report.link.StandardLinkStrategy;
import com.seqweb.results.service.QueryInputNormalizer;
import com.seqweb.results.service.RetrievalReconciler;
import java.time.Clock;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ResultsConfig {

    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    HyperlinkResolver hyperlinkResolver(
        ObjectProvider<HitLineOverride> hitLineOverride,
        ObjectProvider<LinkOverride> linkOverride,
        ResultsProperties properties
    ) {
        return new HyperlinkResolver(
            hitLineOverride.getIfAvailable(() -> HitLineOverride.NONE),
            linkOverride.getIfAvailable(() -> LinkOverride.NONE),
            new StandardLinkStrategy(),
            properties.getLinkBaseUrl()
        );
    }

    @Bean
    ReportRewriter reportRewriter(HyperlinkResolver hyperlinkResolver) {
        return new ReportRewriter(new HitLineNormalizer(), new CoordinateScanner(), hyperlinkResolver);
    }

    @Bean
    QueryInputNormalizer queryInputNormalizer(Clock clock, ResultsProperties properties) {
        return new QueryInputNormalizer(clock, properties.getSubmittedLabelPattern());
    }

    @Bean
    RetrievalReconciler retrievalReconciler() {
        return new RetrievalReconciler();
    }
}
