package com.acme.strmatch.adapters.ranking;

import com.acme.strmatch.domain.model.MatchResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TopKTest {

    private static MatchResult r(String id, double clr) {
        return new MatchResult(id, clr, clr / (clr + 1), 0, 0, 0);
    }

    private static List<String> ids(TopK top) {
        return top.toListSortedDesc().stream().map(MatchResult::candidateId).toList();
    }

    @Test
    void keepsBestK() {
        TopK top = new TopK(3);
        double[] scores = {1, 5, 3, 9, 2, 7};
        for (int i = 0; i < scores.length; i++) {
            top.add(i, r("c" + i, scores[i]));
        }
        assertThat(top.isFull()).isTrue();
        assertThat(ids(top)).containsExactly("c3", "c5", "c1");
    }

    @Test
    void tiesKeepLowerScanIndex() {
        TopK top = new TopK(2);
        top.add(5, r("late", 4.0));
        top.add(1, r("early", 4.0));
        top.add(3, r("middle", 4.0));
        assertThat(ids(top)).containsExactly("early", "middle");
    }

    @Test
    void mergeIsOrderIndependent() {
        TopK left = new TopK(3);
        left.add(0, r("a", 2.0));
        left.add(1, r("b", 6.0));
        TopK right = new TopK(3);
        right.add(2, r("c", 6.0));
        right.add(3, r("d", 1.0));
        right.add(4, r("e", 2.0));

        TopK m1 = new TopK(3);
        m1.mergeFrom(left);
        m1.mergeFrom(right);
        TopK m2 = new TopK(3);
        m2.mergeFrom(right);
        m2.mergeFrom(left);

        assertThat(ids(m1)).containsExactly("b", "c", "a");
        assertThat(ids(m2)).isEqualTo(ids(m1));
    }

    @Test
    void underfilledReturnsWhatItHas() {
        TopK top = new TopK(10);
        top.add(0, r("only", 1.0));
        assertThat(top.isFull()).isFalse();
        assertThat(top.size()).isEqualTo(1);
        assertThat(ids(top)).containsExactly("only");
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new TopK(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
