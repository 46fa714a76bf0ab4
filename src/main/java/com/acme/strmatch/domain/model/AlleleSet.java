package com.acme.strmatch.domain.model;

import java.util.Arrays;

/**
 * Immutable set of allele values observed at one locus.  Values are kept
 * sorted and de-duplicated so that membership and intersection checks are
 * linear merges.  An instance is never empty; a locus without usable data is
 * represented by {@code null} instead.
 */
public final class AlleleSet {
    private final double[] values;

    private AlleleSet(double[] sortedDistinct) {
        this.values = sortedDistinct;
    }

    public static AlleleSet of(double... values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("AlleleSet requires at least one value");
        }
        double[] copy = values.clone();
        Arrays.sort(copy);
        int n = 1;
        for (int i = 1; i < copy.length; i++) {
            if (copy[i] != copy[n - 1]) {
                copy[n++] = copy[i];
            }
        }
        return new AlleleSet(n == copy.length ? copy : Arrays.copyOf(copy, n));
    }

    public int size() {
        return values.length;
    }

    public double[] values() {
        return values.clone();
    }

    public double min() {
        return values[0];
    }

    public double max() {
        return values[values.length - 1];
    }

    public boolean contains(double value) {
        return Arrays.binarySearch(values, value) >= 0;
    }

    /** True when both sets hold at least one identical value. */
    public boolean intersects(AlleleSet other) {
        double[] a = values;
        double[] b = other.values;
        int i = 0;
        int j = 0;
        while (i < a.length && j < b.length) {
            if (a[i] == b[j]) {
                return true;
            }
            if (a[i] < b[j]) {
                i++;
            } else {
                j++;
            }
        }
        return false;
    }

    /**
     * True when any cross pair differs by {@code step} within {@code tolerance}.
     * Sets are small (one or two alleles, rarely three), so every pair is checked.
     */
    public boolean hasPairAtDistance(AlleleSet other, double step, double tolerance) {
        for (double a : values) {
            for (double b : other.values) {
                if (Math.abs(Math.abs(a - b) - step) <= tolerance) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlleleSet)) return false;
        return Arrays.equals(values, ((AlleleSet) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) sb.append(',');
            double v = values[i];
            if (v == Math.rint(v)) {
                sb.append((long) v);
            } else {
                sb.append(v);
            }
        }
        return sb.toString();
    }
}
