package com.acme.strmatch.domain.scoring;

import com.acme.strmatch.common.ProfileSchemaException;
import com.acme.strmatch.domain.model.AlleleSet;
import com.acme.strmatch.domain.model.Profile;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a raw record (column name to field value) into a {@link Profile}.
 * The identifier column is mandatory; every other column is parsed as a
 * locus with {@link AlleleParser}.  Parsed text fields are memoized because a
 * database of STR profiles repeats the same allele strings many times.
 */
public class ProfileAssembler {

    private final String idColumn;
    private final Cache<String, Optional<AlleleSet>> parsed;

    public ProfileAssembler(String idColumn, long cacheSize) {
        this.idColumn = idColumn;
        this.parsed = Caffeine.newBuilder()
                .maximumSize(Math.max(0L, cacheSize))
                .build();
    }

    public String idColumn() {
        return idColumn;
    }

    public Profile toProfile(Map<String, ?> row) {
        String id = identifierOf(row);
        Map<String, AlleleSet> loci = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : row.entrySet()) {
            if (idColumn.equals(e.getKey())) {
                continue;
            }
            AlleleSet alleles = parseField(e.getValue());
            if (alleles != null) {
                loci.put(e.getKey(), alleles);
            }
        }
        return new Profile(id, loci);
    }

    /** The identifier of {@code row}; fails when it is missing or blank. */
    public String identifierOf(Map<String, ?> row) {
        if (row == null) {
            throw new ProfileSchemaException(idColumn, "null", "Record is null");
        }
        Object raw = row.get(idColumn);
        if (raw == null || (raw instanceof Double d && d.isNaN())) {
            throw new ProfileSchemaException(idColumn, describe(row), "Missing identifier");
        }
        String id = raw.toString().trim();
        if (id.isEmpty()) {
            throw new ProfileSchemaException(idColumn, describe(row), "Blank identifier");
        }
        return id;
    }

    private AlleleSet parseField(Object raw) {
        if (raw instanceof String text) {
            return parsed.get(text, t -> Optional.ofNullable(AlleleParser.parseText(t))).orElse(null);
        }
        return AlleleParser.parse(raw);
    }

    private static String describe(Map<String, ?> row) {
        String s = row.toString();
        return s.length() > 120 ? s.substring(0, 120) + "..." : s;
    }
}
