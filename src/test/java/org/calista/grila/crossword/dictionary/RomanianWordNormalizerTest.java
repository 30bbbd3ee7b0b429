package org.calista.grila.crossword.dictionary;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RomanianWordNormalizerTest {

    private final WordNormalizer n = RomanianWordNormalizer.INSTANCE;

    @Test
    void foldsRomanianDiacritics() {
        assertEquals("PADURE", n.normalize("pădure"));
        assertEquals("RAU", n.normalize("râu"));
        assertEquals("INTAI", n.normalize("întâi"));
        assertEquals("SAPTE", n.normalize("șapte"));
        assertEquals("TARA", n.normalize("Țara"));
    }

    @Test
    void foldsCedillaVariants() {
        assertEquals("SAPTE", n.normalize("şapte"));
        assertEquals("TARA", n.normalize("ţara"));
    }

    @Test
    void dropsEverythingOutsideAtoZ() {
        assertEquals("BUNAZIUA", n.normalize("bună-ziua"));
        assertEquals("ABC", n.normalize(" a1 b'c "));
        assertEquals("", n.normalize("123 -"));
        assertEquals("", n.normalize(null));
    }
}
