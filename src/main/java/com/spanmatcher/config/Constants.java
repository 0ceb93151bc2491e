package com.spanmatcher.config;

/**
 * 全局常量定义
 *
 * 包含属性配置保留键、匹配默认参数和流水线阶段名
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 属性配置 ====================
    /** 属性映射中代表词表匹配属性的保留键 */
    public static final String TERM_ATTR = "term_attr";
    /** 属性映射中缺省键的默认属性 */
    public static final Attribute DEFAULT_ATTR = Attribute.NORMALIZED;
    /** 未提供属性配置时的统一属性 */
    public static final Attribute DEFAULT_UNIFORM_ATTR = Attribute.TEXT;

    // ==================== 模糊匹配参数 ====================
    /** 最小相似度（0-100） */
    public static final int DEFAULT_FUZZY_MIN_RATIO = 90;
    /** 默认忽略大小写 */
    public static final boolean DEFAULT_FUZZY_IGNORE_CASE = true;
    /** 窗口长度相对模式长度的默认浮动词元数 */
    public static final int DEFAULT_FUZZY_FLEX = 0;

    // ==================== 流水线阶段 ====================
    /** 归一化阶段名 */
    public static final String NORMALIZER_STAGE = "normalizer";
    /** 匹配阶段默认名 */
    public static final String MATCHER_STAGE = "matcher";
}
