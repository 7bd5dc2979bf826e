package com.seqweb.results.report;

import com.seqweb.results.domain.HitRecord;
import com.seqweb.results.domain.HyperlinkRequest;
import com.seqweb.results.report.link.HitLineOverride;
import com.seqweb.results.report.link.LinkOverride;
import com.seqweb.results.report.link.LinkStrategy;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HyperlinkResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(HyperlinkResolver.class);

    private final HitLineOverride hitLineOverride;
    private final LinkOverride linkOverride;
    private final LinkStrategy standardLink;
    private final String linkBaseUrl;

    public HyperlinkResolver(
        HitLineOverride hitLineOverride,
        LinkOverride linkOverride,
        LinkStrategy standardLink,
        String linkBaseUrl
    ) {
        this.hitLineOverride = Objects.requireNonNull(hitLineOverride, "hitLineOverride");
        this.linkOverride = Objects.requireNonNull(linkOverride, "linkOverride");
        this.standardLink = Objects.requireNonNull(standardLink, "standardLink");
        this.linkBaseUrl = linkBaseUrl == null ? "" : linkBaseUrl;
    }

    public String resolve(HitRecord hit, List<String> databases, AllRetrievableIds retrievableIds) {
        HyperlinkRequest request = HyperlinkRequest.of(hit, databases);

        Optional<String> customLine = hitLineOverride.hitLine(request);
        if (customLine.isPresent()) {
            LOGGER.debug("Custom hit line used for {}", hit.sequenceId());
            return customLine.get();
        }

        Optional<String> link = linkOverride.link(request).or(() -> standardLink.link(request));
        if (link.isEmpty()) {
            LOGGER.debug("No link added for {}", hit.sequenceId());
            return hit.line();
        }

        HitRecord linked = hit.withLink(url(link.get()));
        retrievableIds.add(linked.sequenceId());
        LOGGER.debug("Added link for {}: {}", linked.sequenceId(), linked.link().get());
        return "><a href='" + linked.link().get() + "' target='_blank'>" + linked.hitText() + "</a> ";
    }

    public String url(String path) {
        return linkBaseUrl + path;
    }
}
