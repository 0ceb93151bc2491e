package com.spanmatcher.text;

public record Token(
    String text,
    String norm,
    String whitespace,
    int position,
    int startOffset,
    int endOffset
) {

    /**
     * 返回替换归一化形式后的新词元。
     */
    public Token withNorm(String norm) {
        return new Token(text, norm, whitespace, position, startOffset, endOffset);
    }
}
