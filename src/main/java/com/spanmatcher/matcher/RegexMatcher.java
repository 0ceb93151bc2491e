package com.spanmatcher.matcher;

import com.spanmatcher.config.Attribute;
import com.spanmatcher.config.ConfigurationException;
import com.spanmatcher.document.Document;
import com.spanmatcher.document.MatchSource;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 正则匹配：在指定属性的字符串视图上查找，并把字符区间扩展对齐到词元区间。
 *
 * 每个标签可单独选择 TEXT 或 NORMALIZED。输出按标签登记顺序、模式顺序、命中位置排列。
 */
public class RegexMatcher {

    private final List<RegexEntry> entries = new ArrayList<>();
    private boolean sealed;

    /**
     * 登记某个标签下的一组正则模式。
     *
     * @throws ConfigurationException 模式无法编译
     */
    public void add(String label, List<String> patterns, Attribute attribute) {
        if (sealed) {
            throw new IllegalStateException("RegexMatcher 已封存，不能再登记模式");
        }
        for (String source : patterns) {
            try {
                entries.add(new RegexEntry(label, Pattern.compile(source), attribute));
            } catch (PatternSyntaxException exception) {
                throw new ConfigurationException("非法正则表达式: " + exception.getDescription(), label, source, exception);
            }
        }
    }

    public void seal() {
        sealed = true;
    }

    public int patternCount() {
        return entries.size();
    }

    public List<Match> scan(Document document, int start, int end) {
        if (entries.isEmpty() || start >= end) {
            return List.of();
        }

        Map<Attribute, TextView> views = new EnumMap<>(Attribute.class);
        List<Match> matches = new ArrayList<>();
        for (RegexEntry entry : entries) {
            TextView view = views.computeIfAbsent(entry.attribute(), attribute -> TextView.of(document, start, end, attribute));
            Matcher matcher = entry.pattern().matcher(view.text());
            while (matcher.find()) {
                if (matcher.start() == matcher.end()) {
                    continue;
                }
                int[] tokenRange = view.toTokenRange(matcher.start(), matcher.end());
                if (tokenRange != null) {
                    matches.add(new Match(entry.label(), tokenRange[0], tokenRange[1], MatchSource.REGEX));
                }
            }
        }
        return matches;
    }

    private record RegexEntry(String label, Pattern pattern, Attribute attribute) {
    }

    /**
     * 区间文本视图及每个词元在视图中的字符偏移。
     */
    private record TextView(String text, int firstToken, int[] tokenStarts, int[] tokenEnds) {

        static TextView of(Document document, int start, int end, Attribute attribute) {
            int count = end - start;
            int[] starts = new int[count];
            int[] ends = new int[count];
            StringBuilder builder = new StringBuilder();
            for (int index = start; index < end; index++) {
                starts[index - start] = builder.length();
                builder.append(document.tokenValue(index, attribute));
                ends[index - start] = builder.length();
                if (index < end - 1) {
                    builder.append(document.token(index).whitespace());
                }
            }
            return new TextView(builder.toString(), start, starts, ends);
        }

        /**
         * 把字符区间扩展为覆盖它的最小词元区间；落在纯空白中时返回 null。
         */
        int[] toTokenRange(int charStart, int charEnd) {
            int first = firstEndingAfter(charStart);
            if (first >= tokenStarts.length || tokenStarts[first] >= charEnd) {
                return null;
            }
            int last = first;
            while (last + 1 < tokenStarts.length && tokenStarts[last + 1] < charEnd) {
                last++;
            }
            return new int[] {firstToken + first, firstToken + last + 1};
        }

        /**
         * 二分查找第一个结束位置大于 offset 的词元。
         */
        private int firstEndingAfter(int offset) {
            int low = 0;
            int high = tokenEnds.length;
            while (low < high) {
                int mid = (low + high) >>> 1;
                if (tokenEnds[mid] > offset) {
                    high = mid;
                } else {
                    low = mid + 1;
                }
            }
            return low;
        }
    }
}
