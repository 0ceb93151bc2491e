package com.spanmatcher.matcher;

import com.spanmatcher.config.Attribute;
import com.spanmatcher.config.FuzzyOptions;
import com.spanmatcher.document.DocumentFactory;
import com.spanmatcher.document.MatchSource;
import com.spanmatcher.document.TokenizedDocument;
import com.spanmatcher.text.RuleTokenizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FuzzyMatcherTest {

    private final RuleTokenizer tokenizer = new RuleTokenizer();
    private final DocumentFactory factory = new DocumentFactory();

    @ParameterizedTest
    @CsvSource({
        "aspirin, aspirin, 100.0",
        "aspirin, asprin, 92.3",
        "abc, xyz, 0.0",
        "chest pain, chest pian, 90.0"
    })
    void testRatio(String left, String right, double expected) {
        assertEquals(expected, FuzzyMatcher.ratio(left, right), 0.05);
    }

    @Test
    void testRatioOfEmptyStrings() {
        assertEquals(100.0, FuzzyMatcher.ratio("", ""));
    }

    @Test
    @DisplayName("拼写错误在阈值 90 下命中，阈值 99 下不命中")
    void testMisspellingThreshold() {
        TokenizedDocument document = factory.create("Patient takes asprin daily");

        FuzzyMatcher lenient = matcher(new FuzzyOptions(90, true, 0), "aspirin", "aspirin");
        assertEquals(List.of(new Match("aspirin", 2, 3, MatchSource.FUZZY)), lenient.scan(document, 0, document.size()));

        FuzzyMatcher strict = matcher(new FuzzyOptions(99, true, 0), "aspirin", "aspirin");
        assertTrue(strict.scan(document, 0, document.size()).isEmpty());
    }

    @Test
    @DisplayName("大小写敏感开关")
    void testIgnoreCase() {
        TokenizedDocument document = factory.create("ASPIRIN");

        assertEquals(1, matcher(new FuzzyOptions(90, true, 0), "drug", "aspirin").scan(document, 0, 1).size());
        assertTrue(matcher(new FuzzyOptions(90, false, 0), "drug", "aspirin").scan(document, 0, 1).isEmpty());
    }

    @Test
    @DisplayName("多词模式按窗口比较")
    void testMultiTokenPattern() {
        TokenizedDocument document = factory.create("severe chest pian since monday");

        List<Match> matches = matcher(new FuzzyOptions(85, true, 0), "symptom", "chest pain")
            .scan(document, 0, document.size());

        assertEquals(List.of(new Match("symptom", 1, 3, MatchSource.FUZZY)), matches);
    }

    @Test
    @DisplayName("flex 允许窗口长度浮动但取最佳窗口")
    void testFlexKeepsBestWindow() {
        TokenizedDocument document = factory.create("severe chest pain");

        List<Match> matches = matcher(new FuzzyOptions(90, true, 1), "symptom", "chest pain")
            .scan(document, 0, document.size());

        assertEquals(List.of(new Match("symptom", 1, 3, MatchSource.FUZZY)), matches);
    }

    @Test
    @DisplayName("同一模式的多个不重叠命中按起点输出")
    void testRepeatedOccurrences() {
        TokenizedDocument document = factory.create("asprin then aspirin");

        List<Match> matches = matcher(FuzzyOptions.defaults(), "drug", "aspirin").scan(document, 0, document.size());

        assertEquals(List.of(
            new Match("drug", 0, 1, MatchSource.FUZZY),
            new Match("drug", 2, 3, MatchSource.FUZZY)), matches);
    }

    @Test
    @DisplayName("扫描区间限制")
    void testScanRange() {
        TokenizedDocument document = factory.create("aspirin then aspirin");

        List<Match> matches = matcher(FuzzyOptions.defaults(), "drug", "aspirin").scan(document, 1, 3);

        assertEquals(List.of(new Match("drug", 2, 3, MatchSource.FUZZY)), matches);
    }

    @Test
    void testSealedMatcherRejectsPatterns() {
        FuzzyMatcher fuzzyMatcher = matcher(FuzzyOptions.defaults(), "drug", "aspirin");
        fuzzyMatcher.seal();

        assertThrows(IllegalStateException.class, () -> fuzzyMatcher.add("drug", List.of(tokenizer.tokenize("x"))));
    }

    private FuzzyMatcher matcher(FuzzyOptions options, String label, String term) {
        FuzzyMatcher fuzzyMatcher = new FuzzyMatcher(Attribute.TEXT, options);
        fuzzyMatcher.add(label, List.of(tokenizer.tokenize(term)));
        return fuzzyMatcher;
    }
}
