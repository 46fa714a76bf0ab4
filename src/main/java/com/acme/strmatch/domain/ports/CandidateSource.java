package com.acme.strmatch.domain.ports;

import com.acme.strmatch.domain.model.LocusSchema;
import com.acme.strmatch.domain.model.Profile;

/**
 * Ordered, finite and replayable view of the reference database.  The scan
 * index of a candidate is its position in this source; rankers rely on it
 * for tie-breaking and for splitting the scan into shards, so
 * implementations must return the same profile for the same index for as
 * long as they are in use.
 */
public interface CandidateSource {
    LocusSchema schema();

    int size();

    Profile candidateAt(int index);

    default boolean isEmpty() {
        return size() == 0;
    }
}
