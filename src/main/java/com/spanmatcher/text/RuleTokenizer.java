package com.spanmatcher.text;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于字符类别的规则分词器。
 *
 * 连续的字母/数字构成一个词元，标点符号各自成为一个词元，CJK字符逐字切分。
 * 词元保留原文大小写，归一化形式初始与原文相同，由 {@link TextNormalizer} 补全。
 */
public class RuleTokenizer implements Tokenizer {

    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<int[]> bounds = new ArrayList<>();
        int cursor = 0;
        while (cursor < text.length()) {
            int codePoint = text.codePointAt(cursor);
            if (Character.isWhitespace(codePoint)) {
                cursor += Character.charCount(codePoint);
                continue;
            }

            int segmentStart = cursor;
            int segmentEnd = cursor + Character.charCount(codePoint);
            if (isWordChar(codePoint) && !isCjk(codePoint)) {
                while (segmentEnd < text.length()) {
                    int next = text.codePointAt(segmentEnd);
                    if (!isWordChar(next) || isCjk(next)) {
                        break;
                    }
                    segmentEnd += Character.charCount(next);
                }
            }
            bounds.add(new int[] {segmentStart, segmentEnd});
            cursor = segmentEnd;
        }

        List<Token> tokens = new ArrayList<>(bounds.size());
        for (int index = 0; index < bounds.size(); index++) {
            int start = bounds.get(index)[0];
            int end = bounds.get(index)[1];
            int nextStart = index + 1 < bounds.size() ? bounds.get(index + 1)[0] : text.length();
            String term = text.substring(start, end);
            tokens.add(new Token(term, term, text.substring(end, nextStart), index, start, end));
        }
        return List.copyOf(tokens);
    }

    private boolean isWordChar(int codePoint) {
        if (Character.isLetterOrDigit(codePoint)) {
            return true;
        }
        int type = Character.getType(codePoint);
        return type == Character.NON_SPACING_MARK || type == Character.COMBINING_SPACING_MARK;
    }

    /**
     * 判断字符是否属于CJK脚本。
     */
    private boolean isCjk(int codePoint) {
        Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
        return script == Character.UnicodeScript.HAN
            || script == Character.UnicodeScript.HIRAGANA
            || script == Character.UnicodeScript.KATAKANA
            || script == Character.UnicodeScript.HANGUL;
    }
}
