package com.spanmatcher.text;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TextNormalizerTest {

    @ParameterizedTest
    @CsvSource({
        "Fièvre, fievre",
        "HÔPITAL, hopital",
        "Aspirin, aspirin",
        "50MG, 50mg",
        "l’œdème, l'œdeme"
    })
    void testNormalize(String input, String expected) {
        assertEquals(expected, TextNormalizer.normalize(input));
    }

    @Test
    void testQuotesFolded() {
        assertEquals("\"dit\"", TextNormalizer.normalize("“dit”"));
    }

    @Test
    @DisplayName("韩文音节不被拆成字母，天城文元音符号保留")
    void testSyllablesAndSpacingMarksKept() {
        assertEquals("한국", TextNormalizer.normalize("한국"));
        assertEquals(2, TextNormalizer.normalize("한국").length());
        assertEquals("\u0915\u093E", TextNormalizer.normalize("\u0915\u093E"));
        assertEquals("cafe", TextNormalizer.normalize("CAFE\u0301"));
    }

    @Test
    void testNullAndEmpty() {
        assertEquals("", TextNormalizer.normalize(null));
        assertEquals("", TextNormalizer.normalize(""));
    }
}
