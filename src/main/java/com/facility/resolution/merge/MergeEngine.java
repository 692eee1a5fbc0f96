package com.facility.resolution.merge;

import com.facility.resolution.core.model.Commodity;
import com.facility.resolution.core.model.CompanyMention;
import com.facility.resolution.core.model.FacilityRecord;
import com.facility.resolution.core.model.Location;
import com.facility.resolution.core.model.OwnerLink;
import com.facility.resolution.core.model.Product;
import com.facility.resolution.core.model.SourceRef;
import com.facility.resolution.core.validation.RecordValidator;
import com.facility.resolution.core.validation.ValidationException;
import com.facility.resolution.logging.LogContext;
import com.facility.resolution.metrics.MetricsService;
import com.facility.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Folds a duplicate group into a single canonical record.
 *
 * <p>The survivor is the most complete member. Its own values win; fields it lacks are filled
 * from the next most complete member that has them. Multi-valued fields are unioned. The input
 * records are never modified: the result carries a new survivor instance and the ids of the
 * absorbed members, which the caller is responsible for deleting.</p>
 */
public class MergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    static final String MERGE_NOTE_PREFIX = "Merged from: ";

    private final CompletenessScorer scorer;
    private final MetricsService metricsService;

    public MergeEngine() {
        this(new CompletenessScorer(), new NoOpMetricsService());
    }

    public MergeEngine(CompletenessScorer scorer, MetricsService metricsService) {
        this.scorer = scorer;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Merges a duplicate group.
     *
     * <p>Malformed members are skipped with a warning and counted; the rest are merged.</p>
     *
     * @param group records believed to be the same facility
     * @return the canonical record and the ids absorbed into it
     * @throws IllegalArgumentException if the group is empty
     * @throws ValidationException      if no member is valid, or the valid members cannot be merged
     */
    public MergeResult mergeGroup(List<FacilityRecord> group) {
        if (group == null || group.isEmpty()) {
            throw new IllegalArgumentException("Cannot merge an empty group");
        }

        List<ValidationException> rejected = new ArrayList<>();
        List<FacilityRecord> valid = RecordValidator.filterValid(group, e -> {
            rejected.add(e);
            metricsService.incrementRecordsSkipped();
        });
        if (valid.isEmpty()) {
            ValidationException first = rejected.get(0);
            throw new ValidationException(first.getFacilityId(), "group has no valid records", first);
        }

        Map<String, FacilityRecord> distinct = new LinkedHashMap<>();
        for (FacilityRecord record : valid) {
            distinct.putIfAbsent(record.getFacilityId(), record);
        }
        List<FacilityRecord> members = new ArrayList<>(distinct.values());

        Comparator<FacilityRecord> best = scorer.comparator();
        List<FacilityRecord> ranked = new ArrayList<>(members);
        ranked.sort(best);
        FacilityRecord survivor = ranked.get(0);
        double survivorScore = scorer.score(survivor);

        if (members.size() == 1) {
            return MergeResult.unchanged(survivor, survivorScore);
        }

        List<FacilityRecord> absorbed = new ArrayList<>(members);
        absorbed.remove(survivor);
        List<String> absorbedIds = absorbed.stream().map(FacilityRecord::getFacilityId).toList();

        try (LogContext ctx = LogContext.forMerge(LogContext.generateCorrelationId(),
                survivor.getFacilityId(), members.size())) {
            FacilityRecord canonical = fold(survivor, absorbed, ranked, absorbedIds);
            log.info("Merged {} records into {} (absorbed: {})",
                    members.size(), survivor.getFacilityId(), absorbedIds);
            metricsService.incrementRecordsMerged(absorbedIds.size());
            return new MergeResult(canonical, absorbedIds, survivorScore);
        }
    }

    private FacilityRecord fold(FacilityRecord survivor, List<FacilityRecord> absorbed,
                                List<FacilityRecord> ranked, List<String> absorbedIds) {
        List<FacilityRecord> inOrder = new ArrayList<>();
        inOrder.add(survivor);
        inOrder.addAll(absorbed);

        FacilityRecord current = survivor;
        try {
            Map<String, String> aliases = new LinkedHashMap<>();
            Map<String, Commodity> commodities = new LinkedHashMap<>();
            Map<String, CompanyMention> mentions = new LinkedHashMap<>();
            Map<String, OwnerLink> ownerLinks = new LinkedHashMap<>();
            Set<Product> products = new LinkedHashSet<>();
            Map<String, String> types = new LinkedHashMap<>();
            List<SourceRef> sources = new ArrayList<>();

            for (FacilityRecord member : inOrder) {
                current = member;
                for (String alias : member.getAliases()) {
                    aliases.putIfAbsent(lower(alias), alias);
                }
                if (member != survivor) {
                    aliases.putIfAbsent(lower(member.getName()), member.getName().trim());
                }
                for (Commodity commodity : member.getCommodities()) {
                    commodities.merge(commodity.key(), commodity, MergeEngine::preferFormula);
                }
                for (CompanyMention mention : member.getCompanyMentions()) {
                    mentions.merge(mention.key(), mention,
                            (held, next) -> next.confidence() > held.confidence() ? next : held);
                }
                for (OwnerLink link : member.getOwnerLinks()) {
                    ownerLinks.merge(link.companyId() + "|" + link.role(), link,
                            (held, next) -> next.confidence() > held.confidence() ? next : held);
                }
                products.addAll(member.getProducts());
                for (String type : member.getTypes()) {
                    types.putIfAbsent(lower(type), type);
                }
                sources.addAll(member.getSources());
            }
            current = survivor;
            aliases.remove(lower(survivor.getName()));

            List<String> mergedAliases = new ArrayList<>(aliases.values());
            mergedAliases.sort(String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder()));

            FacilityRecord.Builder builder = FacilityRecord.builder(survivor)
                    .aliases(mergedAliases)
                    .commodities(new ArrayList<>(commodities.values()))
                    .companyMentions(new ArrayList<>(mentions.values()))
                    .ownerLinks(new ArrayList<>(ownerLinks.values()))
                    .products(new ArrayList<>(products))
                    .types(new ArrayList<>(types.values()))
                    .sources(sources)
                    .location(firstPresent(ranked, FacilityRecord::getLocation, Location::hasCoordinates,
                            survivor.getLocation()))
                    .countryIso3(firstPresent(ranked, FacilityRecord::getCountryIso3))
                    .status(firstKnownStatus(ranked))
                    .operatorLink(firstPresent(ranked, FacilityRecord::getOperatorLink))
                    .externalRefId(firstPresent(ranked, FacilityRecord::getExternalRefId))
                    .canonicalName(firstPresent(ranked, FacilityRecord::getCanonicalName))
                    .canonicalSlug(firstPresent(ranked, FacilityRecord::getCanonicalSlug))
                    .verification(survivor.getVerification()
                            .withAppendedNote(MERGE_NOTE_PREFIX + String.join(", ", absorbedIds)));
            return builder.build();
        } catch (ValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ValidationException(current.getFacilityId(), "merge failed: " + e.getMessage(), e);
        }
    }

    /**
     * Same metal from two members: the entry with a chemical formula wins, first one on a tie.
     * A primary flag on either side is kept.
     */
    private static Commodity preferFormula(Commodity held, Commodity next) {
        Commodity chosen = !held.hasFormula() && next.hasFormula() ? next : held;
        boolean primary = held.primary() || next.primary();
        return primary == chosen.primary() ? chosen : new Commodity(chosen.metal(), primary, chosen.chemicalFormula());
    }

    private static <T> T firstPresent(List<FacilityRecord> ranked, Function<FacilityRecord, T> field) {
        for (FacilityRecord record : ranked) {
            T value = field.apply(record);
            if (value != null && !(value instanceof String s && s.isBlank())) {
                return value;
            }
        }
        return null;
    }

    private static <T> T firstPresent(List<FacilityRecord> ranked, Function<FacilityRecord, T> field,
                                      Predicate<T> usable, T fallback) {
        for (FacilityRecord record : ranked) {
            T value = field.apply(record);
            if (value != null && usable.test(value)) {
                return value;
            }
        }
        return fallback;
    }

    private static String firstKnownStatus(List<FacilityRecord> ranked) {
        for (FacilityRecord record : ranked) {
            if (record.hasKnownStatus()) {
                return record.getStatus();
            }
        }
        return FacilityRecord.UNKNOWN_STATUS;
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
