package com.spanmatcher.document;

import com.spanmatcher.config.Attribute;

import java.util.Objects;

/**
 * 绑定到具体文档的带标签词元区间 [start, end)。
 */
public record Span(Document document, int start, int end, String label, MatchSource source) {

    public Span {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(label, "label");
        if (start < 0 || end <= start || end > document.size()) {
            throw new IllegalArgumentException(
                "片段越界: [" + start + ", " + end + ") 文档词元数 " + document.size());
        }
    }

    public int length() {
        return end - start;
    }

    public String text() {
        return document.text(start, end, Attribute.TEXT);
    }

    /**
     * 判断两个片段的词元区间是否有交集。
     */
    public boolean overlaps(Span other) {
        return start < other.end && other.start < end;
    }

    @Override
    public String toString() {
        return label + "[" + start + ", " + end + ")";
    }
}
