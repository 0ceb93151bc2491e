package com.spanmatcher.document;

/**
 * 句子：文档内的词元区间 [start, end)。
 */
public record Sentence(int index, int start, int end) {

    public Sentence {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("非法句子区间: [" + start + ", " + end + ")");
        }
    }

    public boolean contains(int tokenIndex) {
        return tokenIndex >= start && tokenIndex < end;
    }

    public int length() {
        return end - start;
    }
}
