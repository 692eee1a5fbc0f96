package com.facility.resolution.match;

import com.facility.resolution.core.model.Candidate;
import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.core.model.MatchStrategyType;

import java.util.ArrayList;
import java.util.List;

/**
 * Case-insensitive name equality against the corpus.
 */
public class ExactNameStrategy implements MatchStrategy {

    private final double confidence;

    public ExactNameStrategy(double confidence) {
        this.confidence = confidence;
    }

    @Override
    public MatchStrategyType type() {
        return MatchStrategyType.EXACT_NAME;
    }

    @Override
    public List<Candidate> evaluate(FacilityRecord record, FacilityCorpus corpus) {
        if (record.getName() == null || record.getName().isBlank()) {
            return List.of();
        }
        List<Candidate> candidates = new ArrayList<>();
        for (FacilityRecord match : corpus.findByName(record.getName())) {
            if (!MatchStrategy.isSelf(record, match)) {
                candidates.add(Candidate.of(match.getFacilityId(), type(), confidence, match.getName()));
            }
        }
        return candidates;
    }
}
