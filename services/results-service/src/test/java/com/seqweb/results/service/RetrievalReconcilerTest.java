package com.seqweb.results.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.seqweb.results.client.SequenceFetcher;
import com.seqweb.results.domain.RetrievalRequest;
import com.seqweb.results.domain.RetrievalResult;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RetrievalReconcilerTest {

    private final RetrievalReconciler reconciler = new RetrievalReconciler();
    private SequenceFetcher fetcher;

    @BeforeEach
    void setUp() {
        fetcher = mock(SequenceFetcher.class);
    }

    @Test
    void missingSequenceIsReportedAsLess() {
        when(fetcher.fetch(anyList(), eq("genome.fa"))).thenReturn(">x\nACGT\n>z\nGGCC\n");
        RetrievalRequest request = new RetrievalRequest(List.of("x", "y", "z"), List.of("genome.fa"));

        RetrievalResult result = reconciler.retrieve(request, fetcher);
        String html = reconciler.reconcile(request, fetcher);

        assertThat(result.foundCount()).isEqualTo(2);
        assertThat(request.sequenceIds()).hasSize(3);
        assertThat(html).startsWith("<h1>ERROR: incorrect number of sequences found.</h1>");
        assertThat(html).contains("<em>less</em>");
        assertThat(html).contains("You requested 3 sequences\n");
        assertThat(html).contains("<code>x, y, z</code>");
        assertThat(html).contains("<code>genome.fa</code>");
        assertThat(html).contains("But we found 2 sequences.");
        assertThat(html).endsWith("<pre><code>&gt;x\nACGT\n&gt;z\nGGCC\n</code></pre>");
    }

    @Test
    void extraSequencesAreReportedAsMoreWithSingularWording() {
        when(fetcher.fetch(anyList(), eq("genome.fa"))).thenReturn(">x\nACGT\n");
        when(fetcher.fetch(anyList(), eq("proteins.fa"))).thenReturn(">x\nMKV\n");
        RetrievalRequest request = new RetrievalRequest(List.of("x"), List.of("genome.fa", "proteins.fa"));

        String html = reconciler.reconcile(request, fetcher);

        assertThat(html).contains("<em>more</em>");
        assertThat(html).contains("You requested 1 sequence\n");
        assertThat(html).contains("But we found 2 sequences.");
        assertThat(html).contains("<code>genome.fa, proteins.fa</code>");
    }

    @Test
    void matchingCountRendersSequencesOnly() {
        when(fetcher.fetch(anyList(), eq("genome.fa"))).thenReturn("");
        when(fetcher.fetch(anyList(), eq("proteins.fa"))).thenReturn(">x\nMKV\n>y\nMLL\n");
        RetrievalRequest request = new RetrievalRequest(List.of("x", "y"), List.of("genome.fa", "proteins.fa"));

        String html = reconciler.reconcile(request, fetcher);

        assertThat(html).isEqualTo("<pre><code>&gt;x\nMKV\n&gt;y\nMLL\n</code></pre>");
    }

    @Test
    void everyDatabaseIsSearchedWithAllIds() {
        when(fetcher.fetch(anyList(), eq("a.fa"))).thenReturn(null);
        when(fetcher.fetch(anyList(), eq("b.fa"))).thenReturn("");
        RetrievalRequest request = new RetrievalRequest(List.of("x", "y"), List.of("a.fa", "b.fa"));

        String html = reconciler.reconcile(request, fetcher);

        verify(fetcher).fetch(List.of("x", "y"), "a.fa");
        verify(fetcher).fetch(List.of("x", "y"), "b.fa");
        assertThat(html).contains("But we found 0 sequences.");
        assertThat(html).endsWith("<pre><code></code></pre>");
    }

    @Test
    void requestedIdsAreEscaped() {
        when(fetcher.fetch(anyList(), eq("db"))).thenReturn("");
        RetrievalRequest request = new RetrievalRequest(List.of("<x>"), List.of("db"));

        assertThat(reconciler.reconcile(request, fetcher)).contains("<code>&lt;x&gt;</code>");
    }
}
