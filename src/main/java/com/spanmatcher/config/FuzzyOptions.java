package com.spanmatcher.config;

/**
 * 模糊匹配参数。
 *
 * @param minRatio 最小相似度（0-100）
 * @param ignoreCase 比较前是否统一小写
 * @param flex 窗口长度相对模式长度允许浮动的词元数
 */
public record FuzzyOptions(int minRatio, boolean ignoreCase, int flex) {

    public FuzzyOptions {
        if (minRatio < 0 || minRatio > 100) {
            throw new ConfigurationException("最小相似度必须在 0-100 之间", "min_r2", String.valueOf(minRatio));
        }
        if (flex < 0) {
            throw new ConfigurationException("flex 不能为负数", "flex", String.valueOf(flex));
        }
    }

    public static FuzzyOptions defaults() {
        return new FuzzyOptions(Constants.DEFAULT_FUZZY_MIN_RATIO, Constants.DEFAULT_FUZZY_IGNORE_CASE,
            Constants.DEFAULT_FUZZY_FLEX);
    }
}
