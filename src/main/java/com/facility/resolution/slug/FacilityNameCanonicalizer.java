package com.facility.resolution.slug;

import com.facility.resolution.core.model.FacilityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Builds canonical facility names of the form {@code {Town} {Operator} {Core} {Type}}.
 *
 * <pre>
 * "Olympic Dam", types [mine, smelter], operator BHP, town Roxby Downs
 *     -&gt; "Roxby Downs BHP Olympic Dam Mine"
 * </pre>
 *
 * <p>The core name is the facility name with parentheticals, known company names, type
 * descriptors, noise words and company suffixes removed. Operator names come from an optional
 * lookup by company id; without one the operator component is omitted.</p>
 */
public class FacilityNameCanonicalizer {
    private static final Logger log = LoggerFactory.getLogger(FacilityNameCanonicalizer.class);

    static final Set<String> NOISE_WORDS = Set.of(
            "project", "operation", "operations", "complex", "property",
            "facility", "facilities", "area", "district", "group",
            "the", "new", "old", "east", "west", "north", "south",
            "upper", "lower", "main", "central");

    static final Set<String> TYPE_DESCRIPTORS = Set.of(
            "mine", "mines", "mining",
            "smelter", "refinery", "concentrator",
            "plant", "mill", "heap leach", "tailings",
            "sx ew", "sx/ew", "leach pad",
            "underground", "open pit", "opencast", "pit");

    static final Set<String> COMPANY_SUFFIXES = Set.of(
            "inc", "ltd", "llc", "plc", "corp", "corporation",
            "limited", "company", "co", "group", "mining",
            "resources", "minerals", "metals");

    static final List<String> DEFAULT_KNOWN_COMPANIES = List.of(
            "bhp", "bhp billiton", "rio tinto", "vale", "glencore",
            "freeport-mcmoran", "freeport mcmoran", "phelps dodge",
            "anglo american", "angloamerican", "barrick", "newmont",
            "southern copper", "codelco", "antofagasta", "first quantum",
            "ivanhoe", "teck", "fortescue", "fmg", "arcelormittal",
            "sibanye", "sibanye-stillwater", "implats", "amplats",
            "harmony", "goldfields", "anglogold ashanti", "kinross");

    private static final Set<String> ACRONYMS = Set.of("sx", "ew", "pgm", "pge", "ree", "usa", "uk");
    private static final String DEFAULT_TYPE = "Facility";
    private static final String PLACEHOLDER_TOWN = "TODO";
    private static final Pattern PARENTHETICAL = Pattern.compile("\\([^)]*\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Function<String, String> companyNameLookup;
    private final List<Pattern> companyPatterns;
    private final List<Pattern> descriptorPatterns;

    public FacilityNameCanonicalizer() {
        this(null, DEFAULT_KNOWN_COMPANIES);
    }

    public FacilityNameCanonicalizer(Function<String, String> companyNameLookup) {
        this(companyNameLookup, DEFAULT_KNOWN_COMPANIES);
    }

    /**
     * @param companyNameLookup resolves an operator company id to its display name, may be null
     * @param knownCompanies    company names stripped from facility names when extracting the core
     */
    public FacilityNameCanonicalizer(Function<String, String> companyNameLookup, Collection<String> knownCompanies) {
        this.companyNameLookup = companyNameLookup;
        this.companyPatterns = wordPatterns(knownCompanies);
        this.descriptorPatterns = wordPatterns(TYPE_DESCRIPTORS);
    }

    public CanonicalName canonicalize(FacilityRecord record) {
        String town = record.getLocation() != null ? record.getLocation().town() : null;
        return canonicalize(record.getName(), record.getTypes(), record.getOperatorCompanyId(), town);
    }

    public CanonicalName canonicalize(String name, List<String> types, String operatorCompanyId, String town) {
        String core = extractCoreName(name);
        String operator = operatorName(operatorCompanyId);
        String type = primaryType(types);

        List<String> components = new ArrayList<>(4);
        if (town != null && !town.isBlank() && !PLACEHOLDER_TOWN.equals(town.trim())) {
            components.add(town.trim());
        }
        if (operator != null && !operator.isBlank()) {
            components.add(operator.trim());
        }
        components.add(core);
        components.add(type);

        return new CanonicalName(String.join(" ", components), core, type, Slugs.slugify(core, type));
    }

    /**
     * Strips a facility name down to its distinguishing core, e.g.
     * {@code "Phelps Dodge Safford Project"} to {@code "Safford"}.
     * Falls back to the trimmed input if nothing remains.
     */
    public String extractCoreName(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String core = PARENTHETICAL.matcher(name.trim()).replaceAll("").toLowerCase(Locale.ROOT);
        for (Pattern pattern : companyPatterns) {
            core = pattern.matcher(core).replaceAll("");
        }
        for (Pattern pattern : descriptorPatterns) {
            core = pattern.matcher(core).replaceAll("");
        }

        List<String> words = new ArrayList<>();
        for (String word : WHITESPACE.split(core.trim())) {
            if (word.isEmpty() || NOISE_WORDS.contains(word)) {
                continue;
            }
            String bare = word.endsWith(".") ? word.substring(0, word.length() - 1) : word;
            if (!COMPANY_SUFFIXES.contains(bare)) {
                words.add(word);
            }
        }

        String joined = stripEdges(String.join(" ", words));
        return joined.isEmpty() ? name.trim() : capitalize(joined);
    }

    /**
     * First type, capitalized; {@value #DEFAULT_TYPE} when no type is known.
     */
    public String primaryType(List<String> types) {
        if (types == null || types.isEmpty() || types.get(0) == null || types.get(0).isBlank()) {
            return DEFAULT_TYPE;
        }
        String primary = types.get(0).trim();
        if ("heap_leach".equals(primary)) {
            return "Heap Leach";
        }
        return capitalizeWord(primary);
    }

    private String operatorName(String operatorCompanyId) {
        if (operatorCompanyId == null || companyNameLookup == null) {
            return null;
        }
        try {
            return companyNameLookup.apply(operatorCompanyId);
        } catch (RuntimeException e) {
            log.warn("Could not resolve operator {}: {}", operatorCompanyId, e.getMessage());
            return null;
        }
    }

    private static String capitalize(String name) {
        List<String> words = new ArrayList<>();
        for (String word : WHITESPACE.split(name)) {
            words.add(ACRONYMS.contains(word.toLowerCase(Locale.ROOT))
                    ? word.toUpperCase(Locale.ROOT)
                    : capitalizeWord(word));
        }
        return String.join(" ", words);
    }

    private static String capitalizeWord(String word) {
        if (word.isEmpty()) {
            return word;
        }
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }

    private static String stripEdges(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && " -,".indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && " -,".indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }

    /**
     * Word-bounded, case-insensitive patterns, longest phrase first so that
     * {@code "bhp billiton"} is removed before {@code "bhp"}.
     */
    private static List<Pattern> wordPatterns(Collection<String> phrases) {
        List<String> sorted = new ArrayList<>();
        for (String phrase : phrases) {
            if (phrase != null && !phrase.isBlank()) {
                sorted.add(phrase.trim().toLowerCase(Locale.ROOT));
            }
        }
        sorted.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        List<Pattern> patterns = new ArrayList<>(sorted.size());
        for (String phrase : sorted) {
            patterns.add(Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b", Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(patterns);
    }
}
