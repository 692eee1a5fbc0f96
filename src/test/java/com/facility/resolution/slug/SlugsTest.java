package com.facility.resolution.slug;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Slugs Tests")
class SlugsTest {

    @ParameterizedTest
    @DisplayName("Names become lowercase hyphenated ASCII")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "Olympic Dam Mine|olympic-dam-mine",
            "Côte d'Ivoire Gold|cote-d-ivoire-gold",
            "  --Kambalda  Nickel-- |kambalda-nickel",
            "São Bento #2|sao-bento-2",
            "Mina Ministro Hales (DMH)|mina-ministro-hales-dmh"
    })
    void slugify(String name, String expected) {
        assertEquals(expected, Slugs.slugify(name));
    }

    @Test
    @DisplayName("Parts are joined and blank parts skipped")
    void joinsParts() {
        assertEquals("olympic-dam-mine", Slugs.slugify("Olympic Dam", null, " ", "Mine"));
    }

    @ParameterizedTest
    @DisplayName("Names with nothing usable fall back")
    @ValueSource(strings = {"", "   ", "!!!", "北京"})
    void fallback(String name) {
        assertEquals(Slugs.FALLBACK, Slugs.slugify(name));
    }

    @Test
    @DisplayName("No parts at all falls back")
    void noParts() {
        assertEquals(Slugs.FALLBACK, Slugs.slugify());
        assertEquals(Slugs.FALLBACK, Slugs.slugify((String) null));
    }

    @Test
    @DisplayName("Suffixes are slugified without fallback")
    void suffix() {
        assertEquals("western-australia", Slugs.slugifySuffix(" Western Australia "));
        assertEquals("", Slugs.slugifySuffix("  "));
        assertEquals("", Slugs.slugifySuffix(null));
    }

    @Test
    @DisplayName("Output only uses the slug alphabet")
    void alphabet() {
        for (String name : new String[]{"Ñandú Mine", "Mt. Isa / George Fisher", "Ørsted--Pit", "A__B"}) {
            String slug = Slugs.slugify(name);
            assertTrue(slug.matches("[a-z0-9]+(-[a-z0-9]+)*"), slug);
        }
    }
}
