package com.acme.strmatch.domain.scoring;

import com.acme.strmatch.domain.model.AlleleSet;
import com.acme.strmatch.domain.model.LocusVerdict;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class LocusEvaluatorTest {

    @Test
    void sharedAlleleWinsOverAdjacentPair() {
        // 9 and 11 are not adjacent, but 10 is shared and 11/10, 9/10 are one apart
        LocusVerdict v = LocusEvaluator.evaluate(AlleleSet.of(9, 10), AlleleSet.of(10, 11));
        assertThat(v).isEqualTo(LocusVerdict.CONSISTENT);
        assertThat(v.penalty()).isZero();
    }

    @Test
    void singleStepIsMutation() {
        LocusVerdict v = LocusEvaluator.evaluate(AlleleSet.of(9), AlleleSet.of(10));
        assertThat(v).isEqualTo(LocusVerdict.MUTATED);
        assertThat(v.penalty()).isEqualTo(0.5);
    }

    @Test
    void anyCrossPairQualifiesForMutation() {
        assertThat(LocusEvaluator.evaluate(AlleleSet.of(5, 20), AlleleSet.of(14, 21)))
                .isEqualTo(LocusVerdict.MUTATED);
    }

    @Test
    void microvariantsOneRepeatApartAreMutated() {
        assertThat(LocusEvaluator.evaluate(AlleleSet.of(9.3), AlleleSet.of(10.3)))
                .isEqualTo(LocusVerdict.MUTATED);
        assertThat(LocusEvaluator.evaluate(AlleleSet.of(7.3), AlleleSet.of(8.3)))
                .isEqualTo(LocusVerdict.MUTATED);
    }

    @Test
    void partialRepeatIsNotMutation() {
        assertThat(LocusEvaluator.evaluate(AlleleSet.of(9), AlleleSet.of(9.3)))
                .isEqualTo(LocusVerdict.MISMATCH);
    }

    @Test
    void distantAllelesMismatch() {
        LocusVerdict v = LocusEvaluator.evaluate(AlleleSet.of(9), AlleleSet.of(12));
        assertThat(v).isEqualTo(LocusVerdict.MISMATCH);
        assertThat(v.penalty()).isEqualTo(1.0);
    }

    @Test
    void missingDataIsNeutral() {
        assertThat(LocusEvaluator.evaluate(null, AlleleSet.of(12))).isEqualTo(LocusVerdict.INCONCLUSIVE);
        assertThat(LocusEvaluator.evaluate(AlleleSet.of(9), null)).isEqualTo(LocusVerdict.INCONCLUSIVE);
        assertThat(LocusEvaluator.evaluate(null, null)).isEqualTo(LocusVerdict.INCONCLUSIVE);
        assertThat(LocusVerdict.INCONCLUSIVE.penalty()).isZero();
    }
}
