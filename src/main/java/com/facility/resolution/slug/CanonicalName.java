package com.facility.resolution.slug;

/**
 * Canonical naming of a facility, following {@code {Town} {Operator} {Core} {Type}}.
 *
 * @param canonicalName full canonical name, missing components omitted
 * @param coreName      facility name stripped of operators, descriptors and noise words; the short form shown to users
 * @param primaryType   capitalized primary facility type
 * @param slugBase      slug proposed for the registry, built from core name and type
 */
public record CanonicalName(
        String canonicalName,
        String coreName,
        String primaryType,
        String slugBase
) {}
