package com.spanmatcher.text;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 词元归一化：小写、去除重音符号、弯引号折叠为ASCII。
 */
public final class TextNormalizer {

    private static final Pattern NON_SPACING_MARKS = Pattern.compile("\\p{Mn}+");

    private TextNormalizer() {
        // 工具类，禁止实例化
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        String stripped = NON_SPACING_MARKS.matcher(decomposed).replaceAll("");
        // 重新组合，韩文音节等分解后的字符需要还原
        String recomposed = Normalizer.normalize(stripped, Normalizer.Form.NFC);
        return foldQuotes(recomposed).toLowerCase(Locale.ROOT);
    }

    private static String foldQuotes(String text) {
        StringBuilder builder = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char ch = text.charAt(index);
            switch (ch) {
                case '‘', '’', '‛', '´', '`' -> builder.append('\'');
                case '“', '”', '„', '«', '»' -> builder.append('"');
                default -> builder.append(ch);
            }
        }
        return builder.toString();
    }
}
