package com.facility.resolution.match;

import com.facility.resolution.core.model.Candidate;
import com.facility.resolution.core.model.ExternalFacility;
import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.core.model.MatchStrategyType;
import com.facility.resolution.similarity.StringSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Fuzzy-matches the query name against an external canonical dataset, then reports the local
 * records already linked to the matching external entry.
 */
public class CrossReferenceStrategy implements MatchStrategy {
    private static final Logger log = LoggerFactory.getLogger(CrossReferenceStrategy.class);

    private final ExternalFacilityDataset dataset;
    private final StringSimilarity similarity;
    private final double threshold;

    /**
     * @param threshold minimum name score on the 0-100 scale
     */
    public CrossReferenceStrategy(ExternalFacilityDataset dataset, StringSimilarity similarity, double threshold) {
        this.dataset = dataset != null ? dataset : ExternalFacilityDataset.empty();
        this.similarity = similarity;
        this.threshold = threshold;
    }

    @Override
    public MatchStrategyType type() {
        return MatchStrategyType.CROSS_REFERENCE;
    }

    public boolean isEnabled() {
        return !dataset.isEmpty();
    }

    @Override
    public List<Candidate> evaluate(FacilityRecord record, FacilityCorpus corpus) {
        String name = record.getName();
        if (name == null || name.isBlank() || !isEnabled()) {
            return List.of();
        }
        String query = name.toLowerCase(Locale.ROOT);

        List<Candidate> candidates = new ArrayList<>();
        for (ExternalFacility entry : dataset.entries()) {
            if (entry.name() == null || entry.name().isBlank()) {
                continue;
            }
            double score = similarity.ratio(query, entry.name().toLowerCase(Locale.ROOT)) * 100.0;
            if (score < threshold) {
                continue;
            }
            List<FacilityRecord> linked = corpus.findByExternalRef(entry.id());
            if (linked.isEmpty()) {
                log.debug("External match not linked locally: '{}' (score: {})", entry.name(), score);
                continue;
            }
            for (FacilityRecord match : linked) {
                if (MatchStrategy.isSelf(record, match)) {
                    continue;
                }
                candidates.add(new Candidate(match.getFacilityId(), type(), MatchStrategy.round3(score / 100.0),
                        match.getName(), null, null, Set.of(), entry.id(), 0));
            }
        }
        return candidates;
    }
}
