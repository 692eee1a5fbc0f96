package com.facility.resolution.core.model;

/**
 * Duplicate-detection strategies, declared in evaluation priority order.
 * Declaration order is used to break confidence ties during ranking.
 */
public enum MatchStrategyType {
    EXACT_NAME("exact_name"),
    ALIAS_MATCH("alias_match"),
    LOCATION_PROXIMITY("location_proximity"),
    COMPANY_COMMODITY("company_commodity"),
    CROSS_REFERENCE("cross_reference");

    private final String id;

    MatchStrategyType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Lower value means higher priority.
     */
    public int priority() {
        return ordinal();
    }

    public static MatchStrategyType fromId(String id) {
        for (MatchStrategyType type : values()) {
            if (type.id.equalsIgnoreCase(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown match strategy: " + id);
    }
}
