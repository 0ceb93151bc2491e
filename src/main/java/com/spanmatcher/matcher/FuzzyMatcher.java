package com.spanmatcher.matcher;

import com.spanmatcher.config.Attribute;
import com.spanmatcher.config.FuzzyOptions;
import com.spanmatcher.document.Document;
import com.spanmatcher.document.MatchSource;
import com.spanmatcher.text.Token;
import org.apache.commons.text.similarity.LongestCommonSubsequence;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 模糊短语匹配。
 *
 * 对每个模式，在扫描区间内枚举长度为 n-flex..n+flex 的词元窗口，
 * 以基于最长公共子序列的相似度（0-100）与模式文本比较，不低于 minRatio 即为候选。
 * 同一模式的候选按相似度降序贪心去除重叠；结果直接携带标签字符串。
 */
public class FuzzyMatcher implements TermMatcher {

    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    private final Attribute attribute;
    private final FuzzyOptions options;
    private final List<FuzzyPattern> patterns = new ArrayList<>();
    private boolean sealed;

    public FuzzyMatcher(Attribute attribute, FuzzyOptions options) {
        this.attribute = attribute;
        this.options = options;
    }

    public Attribute getAttribute() {
        return attribute;
    }

    public FuzzyOptions getOptions() {
        return options;
    }

    @Override
    public void add(String label, List<List<Token>> tokenPatterns) {
        if (sealed) {
            throw new IllegalStateException("FuzzyMatcher 已封存，不能再登记模式");
        }
        for (List<Token> pattern : tokenPatterns) {
            if (pattern.isEmpty()) {
                continue;
            }
            List<String> values = new ArrayList<>(pattern.size());
            for (Token token : pattern) {
                values.add(attribute == Attribute.TEXT ? token.text() : token.norm());
            }
            patterns.add(new FuzzyPattern(label, prepare(String.join(" ", values)), values.size(), patterns.size()));
        }
    }

    @Override
    public void seal() {
        sealed = true;
    }

    @Override
    public int patternCount() {
        return patterns.size();
    }

    @Override
    public List<Match> scan(Document document, int start, int end) {
        List<Candidate> accepted = new ArrayList<>();
        for (FuzzyPattern pattern : patterns) {
            accepted.addAll(scanPattern(document, start, end, pattern));
        }
        accepted.sort(Comparator.comparingInt(Candidate::start)
            .thenComparingInt(Candidate::end)
            .thenComparingInt(candidate -> candidate.pattern().order()));

        List<Match> matches = new ArrayList<>(accepted.size());
        Set<Match> seen = new HashSet<>();
        for (Candidate candidate : accepted) {
            Match match = new Match(candidate.pattern().label(), candidate.start(), candidate.end(), MatchSource.FUZZY);
            if (seen.add(match)) {
                matches.add(match);
            }
        }
        return matches;
    }

    /**
     * 计算两个字符串的相似度，取值 0-100。
     */
    public static double ratio(String left, String right) {
        int totalLength = left.length() + right.length();
        if (totalLength == 0) {
            return 100.0;
        }
        int common = LCS.apply(left, right);
        return 100.0 * 2 * common / totalLength;
    }

    private List<Candidate> scanPattern(Document document, int start, int end, FuzzyPattern pattern) {
        int minLength = Math.max(1, pattern.length() - options.flex());
        int maxLength = pattern.length() + options.flex();

        List<Candidate> candidates = new ArrayList<>();
        for (int position = start; position < end; position++) {
            Candidate best = null;
            for (int length = minLength; length <= maxLength && position + length <= end; length++) {
                String window = prepare(windowText(document, position, position + length));
                double score = ratio(pattern.text(), window);
                if (score >= options.minRatio() && (best == null || score > best.score())) {
                    best = new Candidate(pattern, position, position + length, score);
                }
            }
            if (best != null) {
                candidates.add(best);
            }
        }

        candidates.sort(Comparator.comparingDouble(Candidate::score).reversed()
            .thenComparingInt(Candidate::start));
        List<Candidate> kept = new ArrayList<>();
        for (Candidate candidate : candidates) {
            boolean overlapping = false;
            for (Candidate other : kept) {
                if (candidate.start() < other.end() && other.start() < candidate.end()) {
                    overlapping = true;
                    break;
                }
            }
            if (!overlapping) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    private String windowText(Document document, int start, int end) {
        StringBuilder builder = new StringBuilder();
        for (int index = start; index < end; index++) {
            if (index > start) {
                builder.append(' ');
            }
            builder.append(document.tokenValue(index, attribute));
        }
        return builder.toString();
    }

    private String prepare(String text) {
        return options.ignoreCase() ? text.toLowerCase(Locale.ROOT) : text;
    }

    private record FuzzyPattern(String label, String text, int length, int order) {
    }

    private record Candidate(FuzzyPattern pattern, int start, int end, double score) {
    }
}
