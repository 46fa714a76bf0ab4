package com.acme.strmatch.adapters.index;

import com.acme.strmatch.domain.ports.CandidateSource;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds one {@link LocusAlleleIndex} per candidate source and keeps it for as
 * long as the source itself is reachable.  Sources are compared by identity.
 */
public class LocusAlleleIndexCache {
    private static final Logger log = LoggerFactory.getLogger(LocusAlleleIndexCache.class);

    private final Cache<CandidateSource, LocusAlleleIndex> indexes = Caffeine.newBuilder()
            .weakKeys()
            .recordStats()
            .build();

    public LocusAlleleIndex indexFor(CandidateSource source) {
        return indexes.get(source, s -> {
            long t0 = System.nanoTime();
            LocusAlleleIndex index = LocusAlleleIndex.build(s);
            log.info("[PREFILTER] indexed {} candidates over {} loci in {} ms ({})",
                    index.size(), index.schema().size(), (System.nanoTime() - t0) / 1_000_000L,
                    indexes.stats());
            return index;
        });
    }

    long hitCount() {
        return indexes.stats().hitCount();
    }
}
