package com.facility.resolution.match;

import com.facility.resolution.core.model.Candidate;
import com.facility.resolution.core.model.Commodity;
import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.core.model.MatchStrategyType;
import com.facility.resolution.geo.DistanceCalculator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Matches records run by the same operator that share at least one commodity.
 *
 * <p>When both sides have coordinates, pairs further apart than the radius are excluded and
 * confidence decays linearly with distance. When either side lacks coordinates a fixed lower
 * confidence is used.</p>
 */
public class CompanyCommodityStrategy implements MatchStrategy {

    private final double radiusKm;
    private final double maxConfidence;
    private final double minConfidence;
    private final double noCoordinatesConfidence;

    public CompanyCommodityStrategy(double radiusKm, double maxConfidence, double minConfidence,
                                    double noCoordinatesConfidence) {
        this.radiusKm = radiusKm;
        this.maxConfidence = maxConfidence;
        this.minConfidence = minConfidence;
        this.noCoordinatesConfidence = noCoordinatesConfidence;
    }

    @Override
    public MatchStrategyType type() {
        return MatchStrategyType.COMPANY_COMMODITY;
    }

    @Override
    public List<Candidate> evaluate(FacilityRecord record, FacilityCorpus corpus) {
        String operatorId = record.getOperatorCompanyId();
        Set<String> metals = metals(record);
        if (operatorId == null || metals.isEmpty()) {
            return List.of();
        }

        List<Candidate> candidates = new ArrayList<>();
        for (FacilityRecord match : corpus.findByOperator(operatorId)) {
            if (MatchStrategy.isSelf(record, match)) {
                continue;
            }
            Set<String> overlap = new LinkedHashSet<>(metals);
            overlap.retainAll(metals(match));
            if (overlap.isEmpty()) {
                continue;
            }

            double confidence;
            Double distanceKm = null;
            if (record.hasCoordinates() && match.hasCoordinates()) {
                double distance = DistanceCalculator.distance(record.getLat(), record.getLon(),
                        match.getLat(), match.getLon());
                if (distance > radiusKm) {
                    continue;
                }
                confidence = maxConfidence - (distance / radiusKm) * (maxConfidence - minConfidence);
                distanceKm = MatchStrategy.round3(distance);
            } else {
                confidence = noCoordinatesConfidence;
            }

            candidates.add(new Candidate(match.getFacilityId(), type(), MatchStrategy.round3(confidence),
                    match.getName(), null, distanceKm, overlap, null, 0));
        }
        return candidates;
    }

    private static Set<String> metals(FacilityRecord record) {
        Set<String> metals = new LinkedHashSet<>();
        for (Commodity commodity : record.getCommodities()) {
            if (!commodity.metal().isBlank()) {
                metals.add(commodity.key());
            }
        }
        return metals;
    }
}
