package com.acme.strmatch.adapters.index;

import com.acme.strmatch.domain.model.AlleleSet;
import com.acme.strmatch.domain.model.LocusSchema;
import com.acme.strmatch.domain.model.Profile;
import com.acme.strmatch.domain.ports.CandidateSource;
import com.acme.strmatch.domain.scoring.LocusEvaluator;

import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Inverted index from (locus, allele value) to the scan indices of the
 * candidates carrying that allele.
 *
 * <p>{@link #evidence(Profile)} returns every candidate that shares an allele
 * with the query, or has one a single repeat unit away, at one locus or more.
 * Any candidate outside that set has no consistent and no mutated locus and
 * therefore scores exactly the floor value; rankers use this to skip such
 * candidates once their top-K is full.
 */
public final class LocusAlleleIndex {

    private static final double TOL = LocusEvaluator.MUTATION_TOLERANCE;

    private final LocusSchema schema;
    private final int size;
    private final Map<String, NavigableMap<Double, int[]>> byLocus;

    private LocusAlleleIndex(LocusSchema schema, int size, Map<String, NavigableMap<Double, int[]>> byLocus) {
        this.schema = schema;
        this.size = size;
        this.byLocus = byLocus;
    }

    public static LocusAlleleIndex build(CandidateSource source) {
        LocusSchema schema = source.schema();
        Map<String, TreeMap<Double, IntBuffer>> work = new HashMap<>();
        for (String locus : schema.loci()) {
            work.put(locus, new TreeMap<>());
        }
        int n = source.size();
        for (int i = 0; i < n; i++) {
            Profile candidate = source.candidateAt(i);
            for (Map.Entry<String, TreeMap<Double, IntBuffer>> e : work.entrySet()) {
                AlleleSet alleles = candidate.alleles(e.getKey());
                if (alleles == null) continue;
                for (double v : alleles.values()) {
                    e.getValue().computeIfAbsent(v, x -> new IntBuffer()).add(i);
                }
            }
        }
        Map<String, NavigableMap<Double, int[]>> byLocus = new HashMap<>();
        for (Map.Entry<String, TreeMap<Double, IntBuffer>> e : work.entrySet()) {
            TreeMap<Double, int[]> postings = new TreeMap<>();
            e.getValue().forEach((allele, buf) -> postings.put(allele, buf.toArray()));
            byLocus.put(e.getKey(), postings);
        }
        return new LocusAlleleIndex(schema, n, byLocus);
    }

    public int size() {
        return size;
    }

    public LocusSchema schema() {
        return schema;
    }

    /** Scan indices of candidates with at least one shared or adjacent allele. */
    public BitSet evidence(Profile query) {
        BitSet bits = new BitSet(size);
        for (String locus : schema.loci()) {
            AlleleSet q = query.alleles(locus);
            NavigableMap<Double, int[]> postings = byLocus.get(locus);
            if (q == null || postings == null || postings.isEmpty()) continue;
            if (!overlaps(q, postings)) continue;
            for (double v : q.values()) {
                mark(bits, postings, v);
                mark(bits, postings, v - LocusEvaluator.MUTATION_STEP);
                mark(bits, postings, v + LocusEvaluator.MUTATION_STEP);
            }
        }
        return bits;
    }

    /** False when every query allele is more than one step away from the locus' allele range. */
    private static boolean overlaps(AlleleSet q, NavigableMap<Double, int[]> postings) {
        double reach = LocusEvaluator.MUTATION_STEP + TOL;
        return q.max() + reach >= postings.firstKey() && q.min() - reach <= postings.lastKey();
    }

    private static void mark(BitSet bits, NavigableMap<Double, int[]> postings, double center) {
        for (int[] ids : postings.subMap(center - TOL, true, center + TOL, true).values()) {
            for (int id : ids) {
                bits.set(id);
            }
        }
    }

    private static final class IntBuffer {
        private int[] data = new int[4];
        private int n;

        void add(int v) {
            if (n == data.length) {
                data = Arrays.copyOf(data, n * 2);
            }
            data[n++] = v;
        }

        int[] toArray() {
            return Arrays.copyOf(data, n);
        }
    }
}
