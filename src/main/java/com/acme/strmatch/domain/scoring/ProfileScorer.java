package com.acme.strmatch.domain.scoring;

import com.acme.strmatch.domain.model.LocusSchema;
import com.acme.strmatch.domain.model.LocusVerdict;
import com.acme.strmatch.domain.model.MatchResult;
import com.acme.strmatch.domain.model.Profile;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregates per-locus verdicts of a query/candidate pair into a single
 * {@link MatchResult}.
 *
 * <pre>
 *   clr       = max(2 * consistent + mutated - penalty, 0) + EPSILON
 *   posterior = clr / (clr + 1)
 * </pre>
 *
 * Every locus of the schema is visited, whether or not the query supplied it.
 * The scorer keeps no state between calls and is safe to share across scan
 * threads.
 */
public final class ProfileScorer {

    public static final double EPSILON = 1e-6;

    private ProfileScorer() {}

    public static MatchResult score(Profile query, Profile candidate, LocusSchema schema) {
        int consistent = 0;
        int mutated = 0;
        int inconclusive = 0;
        double penalty = 0.0;

        for (String locus : schema.loci()) {
            LocusVerdict verdict = LocusEvaluator.evaluate(query.alleles(locus), candidate.alleles(locus));
            switch (verdict) {
                case CONSISTENT -> consistent++;
                case MUTATED -> mutated++;
                case INCONCLUSIVE -> inconclusive++;
                case MISMATCH -> { }
            }
            penalty += verdict.penalty();
        }

        double clr = Math.max(2.0 * consistent + mutated - penalty, 0.0) + EPSILON;
        return new MatchResult(candidate.id(), clr, posterior(clr), consistent, mutated, inconclusive);
    }

    /** Odds to probability under equal prior odds. */
    public static double posterior(double clr) {
        return clr / (clr + 1.0);
    }

    /** Per-locus verdicts in schema order, for diagnostics. */
    public static Map<String, LocusVerdict> compareLoci(Profile query, Profile candidate, LocusSchema schema) {
        Map<String, LocusVerdict> out = new LinkedHashMap<>();
        for (String locus : schema.loci()) {
            out.put(locus, LocusEvaluator.evaluate(query.alleles(locus), candidate.alleles(locus)));
        }
        return out;
    }
}
