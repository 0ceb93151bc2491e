package com.spanmatcher.matcher;

import com.spanmatcher.config.Attribute;
import com.spanmatcher.document.Document;
import com.spanmatcher.document.MatchSource;
import com.spanmatcher.text.Token;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 精确短语匹配：词元序列在指定属性下逐一相等即命中。
 *
 * 引擎内部以数字编号记录标签，扫描结果在返回前经 {@link LabelStore} 还原为标签字符串。
 * 输出按起点升序、终点升序、登记顺序排列。
 */
public class PhraseMatcher implements TermMatcher {

    private final Attribute attribute;
    private final LabelStore labelStore = new LabelStore();
    private final Map<String, List<PhrasePattern>> patternsByFirstToken = new HashMap<>();
    private int patternCount;
    private boolean sealed;

    public PhraseMatcher(Attribute attribute) {
        this.attribute = attribute;
    }

    public Attribute getAttribute() {
        return attribute;
    }

    @Override
    public void add(String label, List<List<Token>> patterns) {
        if (sealed) {
            throw new IllegalStateException("PhraseMatcher 已封存，不能再登记模式");
        }
        int labelId = labelStore.intern(label);
        for (List<Token> pattern : patterns) {
            if (pattern.isEmpty()) {
                continue;
            }
            List<String> values = new ArrayList<>(pattern.size());
            for (Token token : pattern) {
                values.add(attribute == Attribute.TEXT ? token.text() : token.norm());
            }
            PhrasePattern phrasePattern = new PhrasePattern(labelId, List.copyOf(values), patternCount++);
            patternsByFirstToken.computeIfAbsent(values.get(0), key -> new ArrayList<>()).add(phrasePattern);
        }
    }

    @Override
    public void seal() {
        sealed = true;
    }

    @Override
    public int patternCount() {
        return patternCount;
    }

    @Override
    public List<Match> scan(Document document, int start, int end) {
        List<Match> matches = new ArrayList<>();
        for (RawMatch rawMatch : scanIds(document, start, end)) {
            matches.add(new Match(labelStore.resolve(rawMatch.labelId()), rawMatch.start(), rawMatch.end(), MatchSource.EXACT));
        }
        return matches;
    }

    /**
     * 扫描并返回以标签编号表示的匹配。
     */
    List<RawMatch> scanIds(Document document, int start, int end) {
        List<RawMatch> matches = new ArrayList<>();
        Set<RawMatch> seen = new HashSet<>();
        for (int position = start; position < end; position++) {
            List<PhrasePattern> candidates = patternsByFirstToken.get(document.tokenValue(position, attribute));
            if (candidates == null) {
                continue;
            }
            List<PhrasePattern> hits = new ArrayList<>();
            for (PhrasePattern candidate : candidates) {
                if (matchesAt(document, position, end, candidate)) {
                    hits.add(candidate);
                }
            }
            hits.sort(Comparator.comparingInt((PhrasePattern pattern) -> pattern.values().size())
                .thenComparingInt(PhrasePattern::order));
            for (PhrasePattern hit : hits) {
                RawMatch rawMatch = new RawMatch(hit.labelId(), position, position + hit.values().size());
                if (seen.add(rawMatch)) {
                    matches.add(rawMatch);
                }
            }
        }
        return matches;
    }

    private boolean matchesAt(Document document, int position, int end, PhrasePattern pattern) {
        List<String> values = pattern.values();
        if (position + values.size() > end) {
            return false;
        }
        for (int offset = 1; offset < values.size(); offset++) {
            if (!values.get(offset).equals(document.tokenValue(position + offset, attribute))) {
                return false;
            }
        }
        return true;
    }

    record RawMatch(int labelId, int start, int end) {
    }

    private record PhrasePattern(int labelId, List<String> values, int order) {
    }
}
