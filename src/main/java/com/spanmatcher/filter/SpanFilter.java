package com.spanmatcher.filter;

import com.spanmatcher.document.Span;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;

/**
 * 重叠片段过滤。
 *
 * 贪心策略：按长度降序稳定排序（等长片段保持输入顺序），依次接受与已接受片段不共享任何词元的片段，
 * 最后按起点升序返回。结果两两不重叠，但不追求覆盖最大化。
 */
public class SpanFilter {

    private final boolean enabled;

    public SpanFilter(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * 启用时执行过滤，未启用时原样返回。
     */
    public List<Span> apply(List<Span> spans) {
        return enabled ? filterSpans(spans) : spans;
    }

    public static List<Span> filterSpans(List<Span> spans) {
        if (spans.isEmpty()) {
            return List.of();
        }

        List<Span> byLength = new ArrayList<>(spans);
        byLength.sort(Comparator.comparingInt(Span::length).reversed());

        BitSet taken = new BitSet();
        List<Span> accepted = new ArrayList<>();
        for (Span span : byLength) {
            int firstTaken = taken.nextSetBit(span.start());
            if (firstTaken >= 0 && firstTaken < span.end()) {
                continue;
            }
            taken.set(span.start(), span.end());
            accepted.add(span);
        }

        accepted.sort(Comparator.comparingInt(Span::start));
        return accepted;
    }
}
