package com.facility.resolution.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A physical industrial site in the corpus; the unit of identity resolution.
 *
 * <p>The facility id is assigned once and never changes. Collections are kept free of
 * duplicates: aliases case-insensitively, commodities by metal, sources by {@code (type, id)}.
 * Instances are immutable; {@link #builder(FacilityRecord)} derives an updated copy.</p>
 */
public class FacilityRecord {
    public static final String UNKNOWN_STATUS = "unknown";

    private final String facilityId;
    private final String name;
    private final List<String> aliases;
    private final Location location;
    private final String countryIso3;
    private final List<String> types;
    private final String status;
    private final List<Commodity> commodities;
    private final OperatorLink operatorLink;
    private final List<OwnerLink> ownerLinks;
    private final List<CompanyMention> companyMentions;
    private final List<Product> products;
    private final List<SourceRef> sources;
    private final Verification verification;
    private final String externalRefId;
    private final String canonicalName;
    private final String canonicalSlug;

    private FacilityRecord(Builder builder) {
        this.facilityId = builder.facilityId;
        this.name = builder.name;
        this.aliases = dedupeAliases(builder.aliases);
        this.location = builder.location;
        this.countryIso3 = builder.countryIso3;
        this.types = List.copyOf(builder.types);
        this.status = builder.status != null ? builder.status : UNKNOWN_STATUS;
        this.commodities = dedupeCommodities(builder.commodities);
        this.operatorLink = builder.operatorLink;
        this.ownerLinks = List.copyOf(builder.ownerLinks);
        this.companyMentions = List.copyOf(builder.companyMentions);
        this.products = List.copyOf(builder.products);
        this.sources = dedupeSources(builder.sources);
        this.verification = builder.verification != null ? builder.verification : Verification.unverified();
        this.externalRefId = builder.externalRefId;
        this.canonicalName = builder.canonicalName;
        this.canonicalSlug = builder.canonicalSlug;
    }

    public String getFacilityId() {
        return facilityId;
    }

    public String getName() {
        return name;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public Location getLocation() {
        return location;
    }

    public boolean hasCoordinates() {
        return location != null && location.hasCoordinates();
    }

    public Double getLat() {
        return location != null ? location.lat() : null;
    }

    public Double getLon() {
        return location != null ? location.lon() : null;
    }

    public String getCountryIso3() {
        return countryIso3;
    }

    public List<String> getTypes() {
        return types;
    }

    public String getStatus() {
        return status;
    }

    public boolean hasKnownStatus() {
        return !UNKNOWN_STATUS.equalsIgnoreCase(status);
    }

    public List<Commodity> getCommodities() {
        return commodities;
    }

    public OperatorLink getOperatorLink() {
        return operatorLink;
    }

    public String getOperatorCompanyId() {
        return operatorLink != null ? operatorLink.companyId() : null;
    }

    public List<OwnerLink> getOwnerLinks() {
        return ownerLinks;
    }

    public List<CompanyMention> getCompanyMentions() {
        return companyMentions;
    }

    public List<Product> getProducts() {
        return products;
    }

    public List<SourceRef> getSources() {
        return sources;
    }

    public Verification getVerification() {
        return verification;
    }

    public String getExternalRefId() {
        return externalRefId;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public String getCanonicalSlug() {
        return canonicalSlug;
    }

    private static List<String> dedupeAliases(Collection<String> values) {
        Map<String, String> byKey = new LinkedHashMap<>();
        for (String alias : values) {
            if (alias == null || alias.isBlank()) {
                continue;
            }
            byKey.putIfAbsent(alias.trim().toLowerCase(Locale.ROOT), alias.trim());
        }
        return Collections.unmodifiableList(new ArrayList<>(byKey.values()));
    }

    private static List<Commodity> dedupeCommodities(Collection<Commodity> values) {
        Map<String, Commodity> byMetal = new LinkedHashMap<>();
        for (Commodity commodity : values) {
            byMetal.putIfAbsent(commodity.key(), commodity);
        }
        return Collections.unmodifiableList(new ArrayList<>(byMetal.values()));
    }

    private static List<SourceRef> dedupeSources(Collection<SourceRef> values) {
        Map<SourceRef.Key, SourceRef> byKey = new LinkedHashMap<>();
        for (SourceRef source : values) {
            byKey.putIfAbsent(source.key(), source);
        }
        return Collections.unmodifiableList(new ArrayList<>(byKey.values()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FacilityRecord that = (FacilityRecord) o;
        return Objects.equals(facilityId, that.facilityId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(facilityId);
    }

    @Override
    public String toString() {
        return "FacilityRecord{" +
                "facilityId='" + facilityId + '\'' +
                ", name='" + name + '\'' +
                ", location=" + location +
                ", countryIso3='" + countryIso3 + '\'' +
                ", canonicalSlug='" + canonicalSlug + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder pre-populated with a copy of the given record.
     */
    public static Builder builder(FacilityRecord record) {
        return new Builder()
                .facilityId(record.facilityId)
                .name(record.name)
                .aliases(record.aliases)
                .location(record.location)
                .countryIso3(record.countryIso3)
                .types(record.types)
                .status(record.status)
                .commodities(record.commodities)
                .operatorLink(record.operatorLink)
                .ownerLinks(record.ownerLinks)
                .companyMentions(record.companyMentions)
                .products(record.products)
                .sources(record.sources)
                .verification(record.verification)
                .externalRefId(record.externalRefId)
                .canonicalName(record.canonicalName)
                .canonicalSlug(record.canonicalSlug);
    }

    public static class Builder {
        private String facilityId;
        private String name;
        private final List<String> aliases = new ArrayList<>();
        private Location location;
        private String countryIso3;
        private final List<String> types = new ArrayList<>();
        private String status;
        private final List<Commodity> commodities = new ArrayList<>();
        private OperatorLink operatorLink;
        private final List<OwnerLink> ownerLinks = new ArrayList<>();
        private final List<CompanyMention> companyMentions = new ArrayList<>();
        private final List<Product> products = new ArrayList<>();
        private final List<SourceRef> sources = new ArrayList<>();
        private Verification verification;
        private String externalRefId;
        private String canonicalName;
        private String canonicalSlug;

        public Builder facilityId(String facilityId) {
            this.facilityId = facilityId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder aliases(Collection<String> aliases) {
            this.aliases.clear();
            this.aliases.addAll(aliases);
            return this;
        }

        public Builder alias(String alias) {
            this.aliases.add(alias);
            return this;
        }

        public Builder location(Location location) {
            this.location = location;
            return this;
        }

        public Builder coordinates(double lat, double lon) {
            this.location = Location.of(lat, lon, LocationPrecision.SITE);
            return this;
        }

        public Builder countryIso3(String countryIso3) {
            this.countryIso3 = countryIso3;
            return this;
        }

        public Builder types(Collection<String> types) {
            this.types.clear();
            this.types.addAll(types);
            return this;
        }

        public Builder type(String type) {
            this.types.add(type);
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder commodities(Collection<Commodity> commodities) {
            this.commodities.clear();
            this.commodities.addAll(commodities);
            return this;
        }

        public Builder commodity(Commodity commodity) {
            this.commodities.add(commodity);
            return this;
        }

        public Builder operatorLink(OperatorLink operatorLink) {
            this.operatorLink = operatorLink;
            return this;
        }

        public Builder operator(String companyId) {
            this.operatorLink = new OperatorLink(companyId, 1.0);
            return this;
        }

        public Builder ownerLinks(Collection<OwnerLink> ownerLinks) {
            this.ownerLinks.clear();
            this.ownerLinks.addAll(ownerLinks);
            return this;
        }

        public Builder ownerLink(OwnerLink ownerLink) {
            this.ownerLinks.add(ownerLink);
            return this;
        }

        public Builder companyMentions(Collection<CompanyMention> companyMentions) {
            this.companyMentions.clear();
            this.companyMentions.addAll(companyMentions);
            return this;
        }

        public Builder companyMention(CompanyMention companyMention) {
            this.companyMentions.add(companyMention);
            return this;
        }

        public Builder products(Collection<Product> products) {
            this.products.clear();
            this.products.addAll(products);
            return this;
        }

        public Builder product(Product product) {
            this.products.add(product);
            return this;
        }

        public Builder sources(Collection<SourceRef> sources) {
            this.sources.clear();
            this.sources.addAll(sources);
            return this;
        }

        public Builder source(SourceRef source) {
            this.sources.add(source);
            return this;
        }

        public Builder verification(Verification verification) {
            this.verification = verification;
            return this;
        }

        public Builder externalRefId(String externalRefId) {
            this.externalRefId = externalRefId;
            return this;
        }

        public Builder canonicalName(String canonicalName) {
            this.canonicalName = canonicalName;
            return this;
        }

        public Builder canonicalSlug(String canonicalSlug) {
            this.canonicalSlug = canonicalSlug;
            return this;
        }

        /**
         * Builds the record. Identity fields are not checked here; records enter the
         * resolution core through {@code RecordValidator}.
         */
        public FacilityRecord build() {
            return new FacilityRecord(this);
        }
    }
}
