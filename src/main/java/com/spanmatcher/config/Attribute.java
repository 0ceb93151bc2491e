package com.spanmatcher.config;

import java.util.Locale;
import java.util.Optional;

/**
 * 匹配所依据的文本表示。
 */
public enum Attribute {
    /** 原文 */
    TEXT,
    /** 归一化文本 */
    NORMALIZED;

    /**
     * 解析配置中的属性名，接受 TEXT、NORMALIZED 与简写 NORM，大小写不敏感。
     */
    public static Optional<Attribute> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "TEXT" -> Optional.of(TEXT);
            case "NORM", "NORMALIZED" -> Optional.of(NORMALIZED);
            default -> Optional.empty();
        };
    }
}
