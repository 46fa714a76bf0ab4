package com.acme.strmatch.domain.model;

import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A genetic profile: an identifier plus the allele sets of the loci that
 * carried usable data.  Loci that were empty, {@code "-"} or unparseable are
 * simply not present in the map.
 */
public final class Profile {
    private final String id;
    private final Map<String, AlleleSet> loci;

    public Profile(String id, Map<String, AlleleSet> loci) {
        this.id = Objects.requireNonNull(id, "id");
        this.loci = loci == null || loci.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(loci));
    }

    public String id() {
        return id;
    }

    /** Alleles at {@code locus}, or {@code null} when the locus is absent. */
    @Nullable
    public AlleleSet alleles(String locus) {
        return loci.get(locus);
    }

    public Map<String, AlleleSet> loci() {
        return loci;
    }

    @Override
    public String toString() {
        return "Profile{" + id + ", loci=" + loci + '}';
    }
}
