package com.facility.resolution.merge;

import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.core.model.Verification;

import java.util.Comparator;

/**
 * Scores how much useful data a record carries. Used only to choose the survivor of a
 * duplicate group; the number has no meaning outside that comparison.
 *
 * <p>Every term is additive, so adding data never lowers the score.</p>
 */
public class CompletenessScorer {

    static final double COORDINATES = 10.0;
    static final double PER_COMMODITY = 2.0;
    static final double PER_COMPANY_MENTION = 3.0;
    static final double PER_PRODUCT = 2.0;
    static final double PER_ALIAS = 1.0;
    static final double KNOWN_STATUS = 5.0;
    static final double CONFIDENCE_WEIGHT = 10.0;

    public double score(FacilityRecord record) {
        double score = 0.0;
        if (record.hasCoordinates()) {
            score += COORDINATES;
        }
        score += record.getCommodities().size() * PER_COMMODITY;
        score += record.getCompanyMentions().size() * PER_COMPANY_MENTION;
        score += record.getProducts().size() * PER_PRODUCT;
        score += record.getAliases().size() * PER_ALIAS;
        if (record.hasKnownStatus()) {
            score += KNOWN_STATUS;
        }

        Verification verification = record.getVerification();
        if (verification != null) {
            score += verification.confidence() * CONFIDENCE_WEIGHT;
            score += switch (verification.status()) {
                case HUMAN_VERIFIED -> 20.0;
                case CSV_IMPORTED -> 10.0;
                case LLM_VERIFIED -> 5.0;
                default -> 0.0;
            };
        }
        return score;
    }

    /**
     * Orders records best-first: highest score, then country code, then facility id.
     * Missing country codes sort last.
     */
    public Comparator<FacilityRecord> comparator() {
        return Comparator.comparingDouble(this::score).reversed()
                .thenComparing(FacilityRecord::getCountryIso3, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(FacilityRecord::getFacilityId);
    }
}
