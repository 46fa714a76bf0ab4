package com.acme.strmatch.app;

import com.acme.strmatch.domain.model.MatchResult;
import com.acme.strmatch.domain.model.QueryMatches;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * The report keeps the field names downstream consumers already parse.
 */
public class MatchReportWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final MatchReportWriter writer = new MatchReportWriter(mapper);

    @Test
    void usesReportFieldNames() throws Exception {
        List<QueryMatches> results = List.of(
                QueryMatches.of("Q1", List.of(new MatchResult("A", 2.000001, 0.6666667, 1, 0, 1))),
                QueryMatches.failed("#1", "Missing identifier"));

        JsonNode root = mapper.readTree(writer.toJson(results));

        assertThat(root.isArray()).isTrue();
        JsonNode first = root.get(0);
        assertThat(first.get("query_id").asText()).isEqualTo("Q1");
        assertThat(first.has("error")).isFalse();
        JsonNode hit = first.get("top_candidates").get(0);
        assertThat(hit.get("person_id").asText()).isEqualTo("A");
        assertThat(hit.get("clr").asDouble()).isEqualTo(2.000001);
        assertThat(hit.get("posterior").asDouble()).isEqualTo(0.6666667);
        assertThat(hit.get("consistent_loci").asInt()).isEqualTo(1);
        assertThat(hit.get("mutated_loci").asInt()).isZero();
        assertThat(hit.get("inconclusive_loci").asInt()).isEqualTo(1);

        JsonNode failed = root.get(1);
        assertThat(failed.get("error").asText()).isEqualTo("Missing identifier");
        assertThat(failed.get("top_candidates").size()).isZero();
    }

    @Test
    void writesToWriter() {
        StringWriter out = new StringWriter();
        writer.write(List.of(QueryMatches.of("Q1", List.of())), out);
        assertThat(out.toString()).contains("\"query_id\" : \"Q1\"");
    }
}
