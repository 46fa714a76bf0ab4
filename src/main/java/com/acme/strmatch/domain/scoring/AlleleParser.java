package com.acme.strmatch.domain.scoring;

import com.acme.strmatch.domain.model.AlleleSet;
import org.springframework.lang.Nullable;

import java.util.regex.Pattern;

/**
 * Converts a raw locus field into an {@link AlleleSet}.
 *
 * <p>Accepted text is a comma separated list of decimal allele values such as
 * {@code "9,9.3"}.  Empty fields, the placeholder {@code "-"} and fields in
 * which no token survives parsing yield {@code null}.  Tokens that are not
 * plain decimal numbers are dropped without error.
 */
public final class AlleleParser {

    public static final String PLACEHOLDER = "-";

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private AlleleParser() {}

    @Nullable
    public static AlleleSet parse(@Nullable Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number n) {
            double v = n.doubleValue();
            return Double.isFinite(v) ? AlleleSet.of(v) : null;
        }
        return parseText(raw.toString());
    }

    @Nullable
    public static AlleleSet parseText(@Nullable String raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.trim();
        if (text.isEmpty() || PLACEHOLDER.equals(text)) {
            return null;
        }
        String[] tokens = text.split(",");
        double[] parsed = new double[tokens.length];
        int n = 0;
        for (String token : tokens) {
            String t = token.trim();
            if (t.isEmpty() || !DECIMAL.matcher(t).matches()) {
                continue;
            }
            double v = Double.parseDouble(t);
            if (Double.isFinite(v)) {
                parsed[n++] = v;
            }
        }
        if (n == 0) {
            return null;
        }
        double[] values = new double[n];
        System.arraycopy(parsed, 0, values, 0, n);
        return AlleleSet.of(values);
    }
}
