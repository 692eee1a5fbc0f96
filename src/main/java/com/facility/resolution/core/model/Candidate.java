package com.facility.resolution.core.model;

import java.util.Objects;
import java.util.Set;

/**
 * A possible duplicate of a query record, with the evidence that produced it.
 *
 * @param targetId           facility id of the existing record
 * @param strategy           strategy that produced the candidate
 * @param confidence         confidence in [0, 1]
 * @param matchedName        name of the target record
 * @param matchedAlias       alias of the target that matched, for alias matches
 * @param distanceKm         distance between the two records, when both have coordinates
 * @param matchedCommodities commodities shared by both records, for company matches
 * @param externalRefId      external dataset entry id, for cross-reference matches
 * @param rank               1-based position after ranking, 0 before
 */
public record Candidate(
        String targetId,
        MatchStrategyType strategy,
        double confidence,
        String matchedName,
        String matchedAlias,
        Double distanceKm,
        Set<String> matchedCommodities,
        String externalRefId,
        int rank
) {
    public Candidate {
        Objects.requireNonNull(targetId, "targetId is required");
        Objects.requireNonNull(strategy, "strategy is required");
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        matchedCommodities = matchedCommodities != null ? Set.copyOf(matchedCommodities) : Set.of();
    }

    public static Candidate of(String targetId, MatchStrategyType strategy, double confidence, String matchedName) {
        return new Candidate(targetId, strategy, confidence, matchedName, null, null, Set.of(), null, 0);
    }

    public Candidate withRank(int rank) {
        return new Candidate(targetId, strategy, confidence, matchedName, matchedAlias,
                distanceKm, matchedCommodities, externalRefId, rank);
    }

    public boolean isRanked() {
        return rank > 0;
    }
}
