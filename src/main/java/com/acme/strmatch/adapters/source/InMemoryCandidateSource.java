package com.acme.strmatch.adapters.source;

import com.acme.strmatch.common.ProfileSchemaException;
import com.acme.strmatch.domain.model.LocusSchema;
import com.acme.strmatch.domain.model.Profile;
import com.acme.strmatch.domain.ports.CandidateSource;
import com.acme.strmatch.domain.scoring.ProfileAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of a reference database held in memory.  Rows are
 * parsed once when the snapshot is built; afterwards the source may be
 * scanned by any number of queries and threads concurrently.
 *
 * <p>The locus schema is the union of all non-identifier columns in the
 * order they were first seen.
 */
public final class InMemoryCandidateSource implements CandidateSource {
    private final LocusSchema schema;
    private final List<Profile> profiles;
    private final int rejected;

    private InMemoryCandidateSource(LocusSchema schema, List<Profile> profiles, int rejected) {
        this.schema = schema;
        this.profiles = profiles;
        this.rejected = rejected;
    }

    public static Builder builder(ProfileAssembler assembler) {
        return new Builder(assembler);
    }

    @Override
    public LocusSchema schema() {
        return schema;
    }

    @Override
    public int size() {
        return profiles.size();
    }

    @Override
    public Profile candidateAt(int index) {
        return profiles.get(index);
    }

    /** Rows skipped by {@link Builder#addAll} because they were structurally invalid. */
    public int rejectedRows() {
        return rejected;
    }

    public static final class Builder {
        private static final Logger log = LoggerFactory.getLogger(InMemoryCandidateSource.class);

        private final ProfileAssembler assembler;
        private final Set<String> loci = new LinkedHashSet<>();
        private final List<Profile> profiles = new ArrayList<>();
        private int rejected;

        private Builder(ProfileAssembler assembler) {
            this.assembler = assembler;
        }

        /**
         * Adds one row.
         *
         * @throws ProfileSchemaException when the row has no identifier
         */
        public Builder add(Map<String, ?> row) {
            Profile profile = assembler.toProfile(row);
            for (String column : row.keySet()) {
                if (!assembler.idColumn().equals(column)) {
                    loci.add(column);
                }
            }
            profiles.add(profile);
            return this;
        }

        /** Adds every valid row; invalid rows are logged and counted, not fatal. */
        public Builder addAll(Iterable<? extends Map<String, ?>> rows) {
            int line = 0;
            for (Map<String, ?> row : rows) {
                try {
                    add(row);
                } catch (ProfileSchemaException e) {
                    rejected++;
                    log.warn("[DB] skipping row {}: {}", line, e.getMessage());
                }
                line++;
            }
            return this;
        }

        /** Declares a locus column even if no row has been added for it yet. */
        public Builder locus(String column) {
            if (!assembler.idColumn().equals(column)) {
                loci.add(column);
            }
            return this;
        }

        public InMemoryCandidateSource build() {
            LocusSchema schema = new LocusSchema(assembler.idColumn(), new ArrayList<>(loci));
            log.info("[DB] snapshot ready: profiles={} loci={} rejected={}",
                    profiles.size(), schema.size(), rejected);
            return new InMemoryCandidateSource(schema,
                    Collections.unmodifiableList(new ArrayList<>(profiles)), rejected);
        }
    }
}
