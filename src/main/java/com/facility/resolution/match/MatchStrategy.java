package com.facility.resolution.match;

import com.facility.resolution.core.model.Candidate;
import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.core.model.MatchStrategyType;

import java.util.List;

/**
 * One independent way of finding existing records that may be the same facility.
 *
 * <p>Implementations return no candidates when the inputs they need are missing; they never
 * propose the query record as its own duplicate.</p>
 */
public interface MatchStrategy {

    MatchStrategyType type();

    /**
     * Finds candidates for {@code record} in {@code corpus}, in corpus order.
     */
    List<Candidate> evaluate(FacilityRecord record, FacilityCorpus corpus);

    /**
     * Rounds a confidence or distance to three decimals.
     */
    static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    static boolean isSelf(FacilityRecord query, FacilityRecord other) {
        return query.getFacilityId() != null && query.getFacilityId().equals(other.getFacilityId());
    }
}
