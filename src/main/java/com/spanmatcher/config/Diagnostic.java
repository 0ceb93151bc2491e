package com.spanmatcher.config;

/**
 * 配置阶段产生的非致命诊断信息。
 */
public record Diagnostic(Code code, String message) {

    public enum Code {
        /** 属性键不对应任何正则标签 */
        UNKNOWN_ATTRIBUTE_KEY,
        /** 使用归一化文本但上游没有归一化阶段 */
        MISSING_NORMALIZER,
        /** 启用了模糊匹配 */
        FUZZY_PERFORMANCE,
        /** 词表条目分词后为空 */
        EMPTY_TERM
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
