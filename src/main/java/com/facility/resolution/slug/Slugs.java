package com.facility.resolution.slug;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * URL-safe slug helpers. Output is lowercase ASCII letters, digits and single hyphens.
 */
public final class Slugs {

    /**
     * Slug used when a name has no usable characters.
     */
    public static final String FALLBACK = "facility";

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_HYPHENS = Pattern.compile("^-+|-+$");

    private Slugs() {
    }

    /**
     * Joins the non-blank parts with spaces and slugifies the result.
     * Accents are folded to ASCII; anything else outside {@code [a-z0-9]} becomes a hyphen.
     *
     * @return the slug, or {@value #FALLBACK} if nothing usable remains
     */
    public static String slugify(String... parts) {
        List<String> kept = new ArrayList<>();
        if (parts != null) {
            for (String part : parts) {
                if (part != null && !part.isBlank()) {
                    kept.add(Normalizer.normalize(part, Normalizer.Form.NFC));
                }
            }
        }
        String slug = clean(String.join(" ", kept));
        return slug.isEmpty() ? FALLBACK : slug;
    }

    /**
     * Slugifies a disambiguation suffix (region, town). Returns an empty string if nothing usable remains.
     */
    public static String slugifySuffix(String value) {
        return value == null ? "" : clean(value.trim());
    }

    static String toAscii(String value) {
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFKD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        StringBuilder ascii = new StringBuilder(stripped.length());
        for (int i = 0; i < stripped.length(); i++) {
            char c = stripped.charAt(i);
            if (c < 128) {
                ascii.append(c);
            }
        }
        return ascii.toString();
    }

    private static String clean(String value) {
        String lower = toAscii(value).toLowerCase(Locale.ROOT);
        String hyphenated = NON_ALNUM.matcher(lower).replaceAll("-");
        return EDGE_HYPHENS.matcher(hyphenated).replaceAll("");
    }
}
