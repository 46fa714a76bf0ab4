package com.acme.strmatch.domain.scoring;

import com.acme.strmatch.domain.model.AlleleSet;
import com.acme.strmatch.domain.model.LocusVerdict;
import org.springframework.lang.Nullable;

/**
 * Classifies one locus of a query/candidate pair.
 *
 * <ol>
 *   <li>missing data on either side: {@link LocusVerdict#INCONCLUSIVE}</li>
 *   <li>a shared allele: {@link LocusVerdict#CONSISTENT}</li>
 *   <li>some pair exactly one repeat unit apart: {@link LocusVerdict#MUTATED}</li>
 *   <li>otherwise: {@link LocusVerdict#MISMATCH}</li>
 * </ol>
 * The checks run in that order and stop at the first hit.
 */
public final class LocusEvaluator {

    public static final double MUTATION_STEP = 1.0;
    /** Absorbs representation error of microvariants, e.g. 10.3 - 9.3. */
    public static final double MUTATION_TOLERANCE = 1e-9;

    private LocusEvaluator() {}

    public static LocusVerdict evaluate(@Nullable AlleleSet query, @Nullable AlleleSet candidate) {
        if (query == null || candidate == null) {
            return LocusVerdict.INCONCLUSIVE;
        }
        if (query.intersects(candidate)) {
            return LocusVerdict.CONSISTENT;
        }
        if (query.hasPairAtDistance(candidate, MUTATION_STEP, MUTATION_TOLERANCE)) {
            return LocusVerdict.MUTATED;
        }
        return LocusVerdict.MISMATCH;
    }
}
