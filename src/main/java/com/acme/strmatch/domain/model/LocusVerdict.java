package com.acme.strmatch.domain.model;

/**
 * Outcome of comparing one locus of a query against the same locus of a
 * candidate, with the penalty it contributes to the profile score.
 */
public enum LocusVerdict {
    /** At least one allele is shared. */
    CONSISTENT(0.0),
    /** No shared allele, but some pair is one repeat unit apart. */
    MUTATED(0.5),
    /** Data missing on either side. */
    INCONCLUSIVE(0.0),
    /** Exclusionary evidence. */
    MISMATCH(1.0);

    private final double penalty;

    LocusVerdict(double penalty) {
        this.penalty = penalty;
    }

    public double penalty() {
        return penalty;
    }
}
