package com.acme.strmatch.adapters.ranking;

import com.acme.strmatch.config.MatchingProperties;
import com.acme.strmatch.domain.model.MatchResult;
import com.acme.strmatch.domain.model.Profile;
import com.acme.strmatch.domain.ports.CandidateSource;
import com.acme.strmatch.domain.ports.MatchRankingPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Parallel variant of {@link FullScanMatchRanker}.  The candidate range is
 * cut into contiguous shards, each shard is scanned on the scan executor
 * into its own {@link TopK}, and the local results are merged.  Because
 * {@link TopK} breaks ties on scan index, the merged list is identical to
 * the sequential one.
 *
 * <p>Becomes the primary {@link MatchRankingPort} when
 * {@code strmatch.matching.parallel-enabled=true}; built directly with the
 * switch off, it scans on the calling thread.
 */
@Primary
@Component
@ConditionalOnProperty(prefix = "strmatch.matching", name = "parallel-enabled", havingValue = "true")
public class ShardedMatchRanker implements MatchRankingPort {
    private static final Logger log = LoggerFactory.getLogger(ShardedMatchRanker.class);

    private final FullScanMatchRanker delegate;
    private final ExecutorService scanExecutor;
    private final boolean parallelEnabled;
    private final int maxShards;
    private final int minShardSize;

    public ShardedMatchRanker(FullScanMatchRanker delegate,
                              @Qualifier("scanExecutor") ExecutorService scanExecutor,
                              MatchingProperties props) {
        this.delegate = delegate;
        this.scanExecutor = scanExecutor;
        this.parallelEnabled = props.isParallelEnabled();
        this.maxShards = props.resolvedScanThreads();
        this.minShardSize = Math.max(1, props.getMinShardSize());
    }

    @Override
    public List<MatchResult> rank(Profile query, CandidateSource source) {
        int n = source.size();
        int shards = parallelEnabled ? Math.min(maxShards, n / minShardSize) : 1;
        if (shards <= 1) {
            return delegate.rank(query, source);
        }
        BitSet evidence = delegate.evidenceFor(query, source);

        List<Future<TopK>> futures = new ArrayList<>(shards);
        for (int s = 0; s < shards; s++) {
            int from = (int) ((long) n * s / shards);
            int to = (int) ((long) n * (s + 1) / shards);
            futures.add(scanExecutor.submit(() -> delegate.scanRange(query, source, from, to, evidence)));
        }

        TopK merged = new TopK(TOP_K);
        try {
            for (Future<TopK> f : futures) {
                merged.mergeFrom(f.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while ranking query " + query.id(), e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Scan shard failed for query " + query.id(), cause);
        }
        log.debug("[SCAN] query={} merged {} shards over {} candidates", query.id(), shards, n);
        return merged.toListSortedDesc();
    }
}
