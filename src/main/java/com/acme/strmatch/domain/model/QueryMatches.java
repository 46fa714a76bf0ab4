package com.acme.strmatch.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Ranked candidates for one query of a batch.  A query that could not be
 * processed carries an empty list and the reason in {@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryMatches(
        @JsonProperty("query_id")       String queryId,
        @JsonProperty("top_candidates") List<MatchResult> topCandidates,
        @JsonProperty("error")          String error
) {
    public QueryMatches {
        topCandidates = topCandidates == null ? List.of() : List.copyOf(topCandidates);
    }

    public static QueryMatches of(String queryId, List<MatchResult> topCandidates) {
        return new QueryMatches(queryId, topCandidates, null);
    }

    public static QueryMatches failed(String queryId, String error) {
        return new QueryMatches(queryId, List.of(), error);
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
