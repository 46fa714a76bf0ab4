package com.acme.strmatch.domain.ports;

import com.acme.strmatch.domain.model.MatchResult;
import com.acme.strmatch.domain.model.Profile;

import java.util.List;

/**
 * Ranks every candidate of a {@link CandidateSource} against a query and
 * returns the {@link #TOP_K} best, highest {@code clr} first.  The query's
 * own identifier is never part of the result.  On equal {@code clr} the
 * candidate with the lower scan index ranks first.
 */
public interface MatchRankingPort {
    int TOP_K = 10;

    List<MatchResult> rank(Profile query, CandidateSource source);
}
