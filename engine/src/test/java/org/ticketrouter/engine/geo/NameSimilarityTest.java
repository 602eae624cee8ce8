package org.ticketrouter.engine.geo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

@DisplayName("NameSimilarity Tests")
class NameSimilarityTest {

    @ParameterizedTest
    @CsvSource({
            "kitten, sitting, 3",
            "Актау, Актау, 0",
            "Актобе, Актау, 3",
            "'', abc, 3"
    })
    void testLevenshtein(String a, String b, int expected) {
        assertEquals(expected, NameSimilarity.levenshtein(a, b));
    }

    @Test
    @DisplayName("Normalization ignores case, surrounding blanks and ё")
    void testNormalize() {
        assertEquals("приозерск", NameSimilarity.normalize("  Приозёрск "));
        assertEquals(1.0, NameSimilarity.score("ПРИОЗЕРСК", "Приозёрск"), 1e-9);
    }

    @Test
    @DisplayName("Best match respects the threshold")
    void testBestMatchThreshold() {
        assertEquals(Optional.of("Павлодар"),
                NameSimilarity.bestMatch("Павладар", Arrays.asList("Петропавловск", "Павлодар"), 0.75));
        assertFalse(NameSimilarity.bestMatch("Павлодарская область", Collections.singletonList("Павлодар"), 0.75)
                .isPresent());
    }

    @Test
    @DisplayName("Ties keep the earlier candidate")
    void testBestMatchTieKeepsFirst() {
        assertEquals(Optional.of("Нур-Султан"),
                NameSimilarity.bestMatch("Нур-Султан", Arrays.asList("Нур-Султан", "нур-султан"), 0.75));
    }

    @Test
    @DisplayName("Blank names never match")
    void testBlankName() {
        assertFalse(NameSimilarity.bestMatch("  ", Collections.singletonList(""), 0.1).isPresent());
    }
}
