package com.spanmatcher.matcher;

import com.spanmatcher.document.Document;
import com.spanmatcher.document.MatchSource;
import com.spanmatcher.document.Span;

/**
 * 匹配引擎产出的原始结果：标签与文档级词元区间 [start, end)。
 */
public record Match(String label, int start, int end, MatchSource source) {

    public Match {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("非法匹配区间: [" + start + ", " + end + ")");
        }
    }

    public Span toSpan(Document document) {
        return new Span(document, start, end, label, source);
    }
}
