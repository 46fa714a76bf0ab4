package com.acme.strmatch.app;

import com.acme.strmatch.common.ProfileSchemaException;
import com.acme.strmatch.config.MatchingProperties;
import com.acme.strmatch.domain.model.LocusVerdict;
import com.acme.strmatch.domain.model.MatchResult;
import com.acme.strmatch.domain.model.Profile;
import com.acme.strmatch.domain.model.QueryMatches;
import com.acme.strmatch.domain.ports.CandidateSource;
import com.acme.strmatch.domain.ports.MatchRankingPort;
import com.acme.strmatch.domain.scoring.ProfileAssembler;
import com.acme.strmatch.domain.scoring.ProfileScorer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a batch of query rows against one database snapshot.  Queries are
 * independent, so up to {@code query-concurrency} of them are ranked at the
 * same time; results come back in input order.  A query row without an
 * identifier fails on its own and the rest of the batch carries on.
 */
@Slf4j
@Service
public class BatchMatchService {

    static final String MDC_QUERY_ID = "queryId";

    private final MatchRankingPort ranker;
    private final ProfileAssembler assembler;
    private final Scheduler queryScheduler;
    private final int queryConcurrency;

    public BatchMatchService(MatchRankingPort ranker,
                             ProfileAssembler assembler,
                             @Qualifier("queryExecutor") ExecutorService queryExecutor,
                             MatchingProperties props) {
        this.ranker = ranker;
        this.assembler = assembler;
        this.queryScheduler = Schedulers.fromExecutorService(queryExecutor, "strmatch-query");
        this.queryConcurrency = Math.max(1, props.getQueryConcurrency());
    }

    /**
     * Ranks the database against a single query row.
     *
     * @throws ProfileSchemaException when the row has no identifier
     */
    public QueryMatches matchOne(Map<String, ?> queryRow, CandidateSource source) {
        Profile query = assembler.toProfile(queryRow);
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_QUERY_ID, query.id())) {
            long t0 = System.nanoTime();
            log.debug("Matching query {}...", query.id());
            List<MatchResult> hits = ranker.rank(query, source);
            if (log.isInfoEnabled()) {
                log.info("[BATCH] query={} hits={} best={} took={}ms", query.id(), hits.size(),
                        hits.isEmpty() ? "-" : hits.get(0).candidateId(),
                        (System.nanoTime() - t0) / 1_000_000L);
            }
            return QueryMatches.of(query.id(), hits);
        }
    }

    /** Ranks every query row; the returned list follows the order of {@code queryRows}. */
    public Mono<List<QueryMatches>> matchAll(List<? extends Map<String, ?>> queryRows, CandidateSource source) {
        AtomicInteger failed = new AtomicInteger();
        return Flux.range(0, queryRows.size())
                .flatMapSequential(i -> Mono.fromCallable(() -> matchIsolated(i, queryRows.get(i), source, failed))
                        .subscribeOn(queryScheduler), queryConcurrency)
                .collectList()
                .doOnSubscribe(s -> log.info("[BATCH] processing {} queries against {} candidates",
                        queryRows.size(), source.size()))
                .doOnSuccess(list -> log.info("[BATCH] all queries processed: total={} failed={}",
                        list == null ? 0 : list.size(), failed.get()));
    }

    /**
     * Per-locus verdicts of one candidate against a query row, for inspecting
     * why a candidate ranked where it did.
     *
     * @throws IllegalArgumentException when the candidate is not in the source
     */
    public Map<String, LocusVerdict> explain(Map<String, ?> queryRow, String candidateId, CandidateSource source) {
        Profile query = assembler.toProfile(queryRow);
        for (int i = 0; i < source.size(); i++) {
            Profile candidate = source.candidateAt(i);
            if (candidate.id().equals(candidateId)) {
                return ProfileScorer.compareLoci(query, candidate, source.schema());
            }
        }
        throw new IllegalArgumentException("Unknown candidate: " + candidateId);
    }

    private QueryMatches matchIsolated(int index, Map<String, ?> row, CandidateSource source, AtomicInteger failed) {
        try {
            return matchOne(row, source);
        } catch (ProfileSchemaException e) {
            failed.incrementAndGet();
            log.warn("[BATCH] query #{} rejected: {}", index, e.getMessage());
            return QueryMatches.failed(labelOf(index, row), e.getMessage());
        }
    }

    private String labelOf(int index, Map<String, ?> row) {
        Object raw = row == null ? null : row.get(assembler.idColumn());
        return raw == null || raw.toString().isBlank() ? "#" + index : raw.toString();
    }
}
