package com.facility.resolution.api;

import com.facility.resolution.similarity.CacheConfig;

/**
 * Thresholds and confidence constants for duplicate detection and grouping.
 *
 * <p>The coordinate deltas, name-similarity cut-offs and proximity radii are empirical
 * values that have not been calibrated against a labelled duplicate dataset. They are
 * exposed here so they can be tuned per corpus.</p>
 */
public class DeduplicationOptions {

    private static final double DEFAULT_EXACT_NAME_CONFIDENCE = 0.95;
    private static final double DEFAULT_ALIAS_CONFIDENCE = 0.90;
    private static final double DEFAULT_PROXIMITY_RADIUS_KM = 5.0;
    private static final double DEFAULT_PROXIMITY_MAX_CONFIDENCE = 0.90;
    private static final double DEFAULT_PROXIMITY_MIN_CONFIDENCE = 0.70;
    private static final double DEFAULT_COMPANY_RADIUS_KM = 50.0;
    private static final double DEFAULT_COMPANY_MAX_CONFIDENCE = 0.85;
    private static final double DEFAULT_COMPANY_MIN_CONFIDENCE = 0.55;
    private static final double DEFAULT_COMPANY_NO_COORDINATES_CONFIDENCE = 0.60;
    private static final double DEFAULT_CROSS_REFERENCE_THRESHOLD = 85.0;
    private static final double DEFAULT_TIER1_COORDINATE_DELTA = 0.01;
    private static final double DEFAULT_TIER1_NAME_SIMILARITY = 0.6;
    private static final double DEFAULT_TIER2_COORDINATE_DELTA = 0.1;
    private static final double DEFAULT_TIER2_NAME_SIMILARITY = 0.85;
    private static final int DEFAULT_BUCKET_DECIMALS = 1;

    private final double exactNameConfidence;
    private final double aliasConfidence;
    private final double proximityRadiusKm;
    private final double proximityMaxConfidence;
    private final double proximityMinConfidence;
    private final double companyRadiusKm;
    private final double companyMaxConfidence;
    private final double companyMinConfidence;
    private final double companyNoCoordinatesConfidence;
    private final double crossReferenceThreshold;
    private final double tier1CoordinateDelta;
    private final double tier1NameSimilarity;
    private final double tier2CoordinateDelta;
    private final double tier2NameSimilarity;
    private final int bucketDecimals;
    private final boolean crossCheckUnlocated;
    private final CacheConfig similarityCache;

    private DeduplicationOptions(Builder builder) {
        this.exactNameConfidence = builder.exactNameConfidence;
        this.aliasConfidence = builder.aliasConfidence;
        this.proximityRadiusKm = builder.proximityRadiusKm;
        this.proximityMaxConfidence = builder.proximityMaxConfidence;
        this.proximityMinConfidence = builder.proximityMinConfidence;
        this.companyRadiusKm = builder.companyRadiusKm;
        this.companyMaxConfidence = builder.companyMaxConfidence;
        this.companyMinConfidence = builder.companyMinConfidence;
        this.companyNoCoordinatesConfidence = builder.companyNoCoordinatesConfidence;
        this.crossReferenceThreshold = builder.crossReferenceThreshold;
        this.tier1CoordinateDelta = builder.tier1CoordinateDelta;
        this.tier1NameSimilarity = builder.tier1NameSimilarity;
        this.tier2CoordinateDelta = builder.tier2CoordinateDelta;
        this.tier2NameSimilarity = builder.tier2NameSimilarity;
        this.bucketDecimals = builder.bucketDecimals;
        this.crossCheckUnlocated = builder.crossCheckUnlocated;
        this.similarityCache = builder.similarityCache;
    }

    public double getExactNameConfidence() {
        return exactNameConfidence;
    }

    public double getAliasConfidence() {
        return aliasConfidence;
    }

    public double getProximityRadiusKm() {
        return proximityRadiusKm;
    }

    public double getProximityMaxConfidence() {
        return proximityMaxConfidence;
    }

    public double getProximityMinConfidence() {
        return proximityMinConfidence;
    }

    public double getCompanyRadiusKm() {
        return companyRadiusKm;
    }

    public double getCompanyMaxConfidence() {
        return companyMaxConfidence;
    }

    public double getCompanyMinConfidence() {
        return companyMinConfidence;
    }

    public double getCompanyNoCoordinatesConfidence() {
        return companyNoCoordinatesConfidence;
    }

    /**
     * Minimum fuzzy name score on the 0-100 scale for a cross-reference match.
     */
    public double getCrossReferenceThreshold() {
        return crossReferenceThreshold;
    }

    public double getTier1CoordinateDelta() {
        return tier1CoordinateDelta;
    }

    public double getTier1NameSimilarity() {
        return tier1NameSimilarity;
    }

    public double getTier2CoordinateDelta() {
        return tier2CoordinateDelta;
    }

    public double getTier2NameSimilarity() {
        return tier2NameSimilarity;
    }

    /**
     * Decimal places that coordinates are rounded to when bucketing records for grouping.
     */
    public int getBucketDecimals() {
        return bucketDecimals;
    }

    /**
     * Whether records without coordinates are cross-checked by exact name and alias during grouping.
     */
    public boolean isCrossCheckUnlocated() {
        return crossCheckUnlocated;
    }

    public CacheConfig getSimilarityCache() {
        return similarityCache;
    }

    /**
     * Creates default options.
     */
    public static DeduplicationOptions defaults() {
        return builder().build();
    }

    /**
     * Creates strict options: only tight coordinate matches group, unlocated records are left alone.
     */
    public static DeduplicationOptions strict() {
        return builder()
                .tier1NameSimilarity(0.75)
                .tier2NameSimilarity(0.95)
                .proximityRadiusKm(2.0)
                .crossCheckUnlocated(false)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double exactNameConfidence = DEFAULT_EXACT_NAME_CONFIDENCE;
        private double aliasConfidence = DEFAULT_ALIAS_CONFIDENCE;
        private double proximityRadiusKm = DEFAULT_PROXIMITY_RADIUS_KM;
        private double proximityMaxConfidence = DEFAULT_PROXIMITY_MAX_CONFIDENCE;
        private double proximityMinConfidence = DEFAULT_PROXIMITY_MIN_CONFIDENCE;
        private double companyRadiusKm = DEFAULT_COMPANY_RADIUS_KM;
        private double companyMaxConfidence = DEFAULT_COMPANY_MAX_CONFIDENCE;
        private double companyMinConfidence = DEFAULT_COMPANY_MIN_CONFIDENCE;
        private double companyNoCoordinatesConfidence = DEFAULT_COMPANY_NO_COORDINATES_CONFIDENCE;
        private double crossReferenceThreshold = DEFAULT_CROSS_REFERENCE_THRESHOLD;
        private double tier1CoordinateDelta = DEFAULT_TIER1_COORDINATE_DELTA;
        private double tier1NameSimilarity = DEFAULT_TIER1_NAME_SIMILARITY;
        private double tier2CoordinateDelta = DEFAULT_TIER2_COORDINATE_DELTA;
        private double tier2NameSimilarity = DEFAULT_TIER2_NAME_SIMILARITY;
        private int bucketDecimals = DEFAULT_BUCKET_DECIMALS;
        private boolean crossCheckUnlocated = true;
        private CacheConfig similarityCache = CacheConfig.defaults();

        public Builder exactNameConfidence(double exactNameConfidence) {
            validateConfidence(exactNameConfidence, "exactNameConfidence");
            this.exactNameConfidence = exactNameConfidence;
            return this;
        }

        public Builder aliasConfidence(double aliasConfidence) {
            validateConfidence(aliasConfidence, "aliasConfidence");
            this.aliasConfidence = aliasConfidence;
            return this;
        }

        public Builder proximityRadiusKm(double proximityRadiusKm) {
            validatePositive(proximityRadiusKm, "proximityRadiusKm");
            this.proximityRadiusKm = proximityRadiusKm;
            return this;
        }

        public Builder proximityConfidenceRange(double min, double max) {
            validateConfidence(min, "proximityMinConfidence");
            validateConfidence(max, "proximityMaxConfidence");
            this.proximityMinConfidence = min;
            this.proximityMaxConfidence = max;
            return this;
        }

        public Builder companyRadiusKm(double companyRadiusKm) {
            validatePositive(companyRadiusKm, "companyRadiusKm");
            this.companyRadiusKm = companyRadiusKm;
            return this;
        }

        public Builder companyConfidenceRange(double min, double max) {
            validateConfidence(min, "companyMinConfidence");
            validateConfidence(max, "companyMaxConfidence");
            this.companyMinConfidence = min;
            this.companyMaxConfidence = max;
            return this;
        }

        public Builder companyNoCoordinatesConfidence(double companyNoCoordinatesConfidence) {
            validateConfidence(companyNoCoordinatesConfidence, "companyNoCoordinatesConfidence");
            this.companyNoCoordinatesConfidence = companyNoCoordinatesConfidence;
            return this;
        }

        public Builder crossReferenceThreshold(double crossReferenceThreshold) {
            if (crossReferenceThreshold < 0.0 || crossReferenceThreshold > 100.0) {
                throw new IllegalArgumentException("crossReferenceThreshold must be between 0 and 100");
            }
            this.crossReferenceThreshold = crossReferenceThreshold;
            return this;
        }

        public Builder tier1CoordinateDelta(double tier1CoordinateDelta) {
            validatePositive(tier1CoordinateDelta, "tier1CoordinateDelta");
            this.tier1CoordinateDelta = tier1CoordinateDelta;
            return this;
        }

        public Builder tier1NameSimilarity(double tier1NameSimilarity) {
            validateConfidence(tier1NameSimilarity, "tier1NameSimilarity");
            this.tier1NameSimilarity = tier1NameSimilarity;
            return this;
        }

        public Builder tier2CoordinateDelta(double tier2CoordinateDelta) {
            validatePositive(tier2CoordinateDelta, "tier2CoordinateDelta");
            this.tier2CoordinateDelta = tier2CoordinateDelta;
            return this;
        }

        public Builder tier2NameSimilarity(double tier2NameSimilarity) {
            validateConfidence(tier2NameSimilarity, "tier2NameSimilarity");
            this.tier2NameSimilarity = tier2NameSimilarity;
            return this;
        }

        public Builder bucketDecimals(int bucketDecimals) {
            if (bucketDecimals < 0 || bucketDecimals > 6) {
                throw new IllegalArgumentException("bucketDecimals must be between 0 and 6");
            }
            this.bucketDecimals = bucketDecimals;
            return this;
        }

        public Builder crossCheckUnlocated(boolean crossCheckUnlocated) {
            this.crossCheckUnlocated = crossCheckUnlocated;
            return this;
        }

        public Builder similarityCache(CacheConfig similarityCache) {
            this.similarityCache = similarityCache != null ? similarityCache : CacheConfig.disabled();
            return this;
        }

        public DeduplicationOptions build() {
            if (proximityMinConfidence > proximityMaxConfidence) {
                throw new IllegalArgumentException("proximity min confidence must be <= max confidence");
            }
            if (companyMinConfidence > companyMaxConfidence) {
                throw new IllegalArgumentException("company min confidence must be <= max confidence");
            }
            if (tier1CoordinateDelta > tier2CoordinateDelta) {
                throw new IllegalArgumentException("tier1CoordinateDelta must be <= tier2CoordinateDelta");
            }
            return new DeduplicationOptions(this);
        }

        private void validateConfidence(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }

        private void validatePositive(double value, String name) {
            if (!(value > 0.0)) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }

    @Override
    public String toString() {
        return "DeduplicationOptions{" +
                "proximityRadiusKm=" + proximityRadiusKm +
                ", companyRadiusKm=" + companyRadiusKm +
                ", crossReferenceThreshold=" + crossReferenceThreshold +
                ", tier1=(" + tier1CoordinateDelta + ", " + tier1NameSimilarity + ")" +
                ", tier2=(" + tier2CoordinateDelta + ", " + tier2NameSimilarity + ")" +
                ", bucketDecimals=" + bucketDecimals +
                ", crossCheckUnlocated=" + crossCheckUnlocated +
                '}';
    }
}
