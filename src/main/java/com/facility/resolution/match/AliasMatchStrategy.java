package com.facility.resolution.match;

import com.facility.resolution.core.model.Candidate;
import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.core.model.MatchStrategyType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Matches when the query name equals one of an existing record's aliases.
 */
public class AliasMatchStrategy implements MatchStrategy {

    private final double confidence;

    public AliasMatchStrategy(double confidence) {
        this.confidence = confidence;
    }

    @Override
    public MatchStrategyType type() {
        return MatchStrategyType.ALIAS_MATCH;
    }

    @Override
    public List<Candidate> evaluate(FacilityRecord record, FacilityCorpus corpus) {
        if (record.getName() == null || record.getName().isBlank()) {
            return List.of();
        }
        List<Candidate> candidates = new ArrayList<>();
        for (FacilityCorpus.AliasHit hit : corpus.findByAlias(record.getName())) {
            FacilityRecord match = hit.record();
            if (MatchStrategy.isSelf(record, match)) {
                continue;
            }
            candidates.add(new Candidate(match.getFacilityId(), type(), confidence, match.getName(),
                    hit.alias(), null, Set.of(), null, 0));
        }
        return candidates;
    }
}
