package com.acme.strmatch.domain.model;

import java.util.List;

/**
 * Column layout shared by every profile of a database: the identifier
 * column and the ordered locus columns.
 */
public record LocusSchema(String idColumn, List<String> loci) {
    public LocusSchema {
        loci = List.copyOf(loci);
    }

    public int size() {
        return loci.size();
    }
}
