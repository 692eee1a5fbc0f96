package com.facility.resolution.match;

import com.facility.resolution.core.model.Candidate;
import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.core.model.MatchStrategyType;
import com.facility.resolution.geo.DistanceCalculator;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Matches records whose coordinates lie strictly within a radius of the query.
 * Confidence decays linearly from {@code maxConfidence} at 0 km to {@code minConfidence} at the radius.
 */
public class LocationProximityStrategy implements MatchStrategy {

    private final double radiusKm;
    private final double maxConfidence;
    private final double minConfidence;

    public LocationProximityStrategy(double radiusKm, double maxConfidence, double minConfidence) {
        this.radiusKm = radiusKm;
        this.maxConfidence = maxConfidence;
        this.minConfidence = minConfidence;
    }

    @Override
    public MatchStrategyType type() {
        return MatchStrategyType.LOCATION_PROXIMITY;
    }

    @Override
    public List<Candidate> evaluate(FacilityRecord record, FacilityCorpus corpus) {
        if (!record.hasCoordinates() || corpus.located().length == 0) {
            return List.of();
        }
        double[] distances = DistanceCalculator.distances(record.getLat(), record.getLon(),
                corpus.latitudes(), corpus.longitudes());
        FacilityRecord[] located = corpus.located();

        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < distances.length; i++) {
            double distanceKm = distances[i];
            if (distanceKm >= radiusKm || MatchStrategy.isSelf(record, located[i])) {
                continue;
            }
            double confidence = maxConfidence - (distanceKm / radiusKm) * (maxConfidence - minConfidence);
            candidates.add(new Candidate(located[i].getFacilityId(), type(), MatchStrategy.round3(confidence),
                    located[i].getName(), null, MatchStrategy.round3(distanceKm), Set.of(), null, 0));
        }
        return candidates;
    }
}
