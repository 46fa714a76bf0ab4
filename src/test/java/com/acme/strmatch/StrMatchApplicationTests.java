package com.acme.strmatch;

import com.acme.strmatch.adapters.ranking.ShardedMatchRanker;
import com.acme.strmatch.adapters.source.InMemoryCandidateSource;
import com.acme.strmatch.app.BatchMatchService;
import com.acme.strmatch.app.MatchReportWriter;
import com.acme.strmatch.config.MatchingProperties;
import com.acme.strmatch.domain.model.QueryMatches;
import com.acme.strmatch.domain.ports.MatchRankingPort;
import com.acme.strmatch.domain.scoring.ProfileAssembler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static com.acme.strmatch.MatchFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "strmatch.matching.parallel-enabled=true",
        "strmatch.matching.scan-threads=2",
        "strmatch.matching.min-shard-size=1"
})
class StrMatchApplicationTests {

    @Autowired
    MatchRankingPort ranker;

    @Autowired
    MatchingProperties props;

    @Autowired
    ProfileAssembler assembler;

    @Autowired
    BatchMatchService batch;

    @Autowired
    MatchReportWriter reportWriter;

    @Test
    void wiresShardedRankerWhenParallelEnabled() {
        assertThat(ranker).isInstanceOf(ShardedMatchRanker.class);
        assertThat(props.getIdColumn()).isEqualTo("PersonID");
        assertThat(props.getMinShardSize()).isEqualTo(1);
    }

    @Test
    void runsBatchThroughContext() {
        InMemoryCandidateSource db = InMemoryCandidateSource.builder(assembler)
                .add(row("A", "L1", "10,11", "L2", "5"))
                .add(row("B", "L1", "20", "L2", "-"))
                .add(row("C", "L1", "8", "L2", "6"))
                .build();

        List<QueryMatches> out = batch.matchAll(List.of(row("Q1", "L1", "9,10", "L2", "-")), db).block();

        assertThat(out).hasSize(1);
        assertThat(out.get(0).topCandidates()).extracting(c -> c.candidateId()).containsExactly("A", "C", "B");
        assertThat(reportWriter.toJson(out)).contains("\"person_id\" : \"A\"");
    }
}
