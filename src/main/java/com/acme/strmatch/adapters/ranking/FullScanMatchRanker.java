package com.acme.strmatch.adapters.ranking;

import com.acme.strmatch.adapters.index.LocusAlleleIndexCache;
import com.acme.strmatch.config.MatchingProperties;
import com.acme.strmatch.domain.model.LocusSchema;
import com.acme.strmatch.domain.model.MatchResult;
import com.acme.strmatch.domain.model.Profile;
import com.acme.strmatch.domain.ports.CandidateSource;
import com.acme.strmatch.domain.ports.MatchRankingPort;
import com.acme.strmatch.domain.scoring.ProfileScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.BitSet;
import java.util.List;

/**
 * Scores every candidate of the source against the query on the calling
 * thread and keeps the best {@link #TOP_K} in a bounded {@link TopK}.
 *
 * <p>With the prefilter enabled, candidates that share no allele and no
 * adjacent allele with the query at any locus are only scored while the
 * top-K still has room: their score is the floor value and a full top-K
 * already holds results at least as good with lower scan indices.
 */
@Component
public class FullScanMatchRanker implements MatchRankingPort {
    private static final Logger log = LoggerFactory.getLogger(FullScanMatchRanker.class);

    private final LocusAlleleIndexCache indexCache;
    private final boolean prefilterEnabled;

    public FullScanMatchRanker(LocusAlleleIndexCache indexCache, MatchingProperties props) {
        this.indexCache = indexCache;
        this.prefilterEnabled = props.isPrefilterEnabled();
    }

    @Override
    public List<MatchResult> rank(Profile query, CandidateSource source) {
        if (source.isEmpty()) {
            return List.of();
        }
        TopK top = scanRange(query, source, 0, source.size(), evidenceFor(query, source));
        return top.toListSortedDesc();
    }

    /**
     * Candidates of {@code source} that can score above the floor, or
     * {@code null} when the prefilter is disabled.
     */
    @Nullable
    BitSet evidenceFor(Profile query, CandidateSource source) {
        if (!prefilterEnabled) {
            return null;
        }
        return indexCache.indexFor(source).evidence(query);
    }

    /** Scans {@code [from, to)} into a fresh {@link TopK}. */
    TopK scanRange(Profile query, CandidateSource source, int from, int to, @Nullable BitSet evidence) {
        LocusSchema schema = source.schema();
        String queryId = query.id();
        TopK top = new TopK(TOP_K);
        int scored = 0;
        int skipped = 0;
        for (int i = from; i < to; i++) {
            Profile candidate = source.candidateAt(i);
            if (queryId.equals(candidate.id())) {
                continue;
            }
            if (evidence != null && !evidence.get(i) && top.isFull()) {
                skipped++;
                continue;
            }
            top.add(i, ProfileScorer.score(query, candidate, schema));
            scored++;
        }
        if (log.isDebugEnabled()) {
            log.debug("[SCAN] query={} range=[{},{}) scored={} skipped={}", queryId, from, to, scored, skipped);
        }
        return top;
    }
}
