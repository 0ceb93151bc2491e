package com.spanmatcher.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 匹配器运行时配置
 *
 * 构造后不可变；词表与正则映射均已规整为“标签 → 有序字符串列表”。
 */
public final class MatcherConfig {
    private final Map<String, List<String>> terms;
    private final Map<String, List<String>> regex;
    private final AttributeSpec attr;
    private final boolean fuzzy;
    private final FuzzyOptions fuzzyOptions;
    private final boolean filterMatches;
    private final boolean onEntsOnly;

    private MatcherConfig(Builder builder) {
        this.terms = freeze(builder.terms);
        this.regex = freeze(builder.regex);
        this.attr = builder.attr;
        this.fuzzy = builder.fuzzy;
        this.fuzzyOptions = builder.fuzzyOptions;
        this.filterMatches = builder.filterMatches;
        this.onEntsOnly = builder.onEntsOnly;
    }

    public Map<String, List<String>> getTerms() {
        return terms;
    }

    public Map<String, List<String>> getRegex() {
        return regex;
    }

    public AttributeSpec getAttr() {
        return attr;
    }

    public boolean isFuzzy() {
        return fuzzy;
    }

    public FuzzyOptions getFuzzyOptions() {
        return fuzzyOptions;
    }

    public boolean isFilterMatches() {
        return filterMatches;
    }

    public boolean isOnEntsOnly() {
        return onEntsOnly;
    }

    /**
     * 使用默认配置创建实例
     */
    public static MatcherConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Map<String, List<String>> freeze(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((label, values) -> copy.put(label, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }

    public static final class Builder {
        private final Map<String, List<String>> terms = new LinkedHashMap<>();
        private final Map<String, List<String>> regex = new LinkedHashMap<>();
        private AttributeSpec attr = AttributeSpec.uniform(Constants.DEFAULT_UNIFORM_ATTR);
        private boolean fuzzy;
        private FuzzyOptions fuzzyOptions = FuzzyOptions.defaults();
        private boolean filterMatches = true;
        private boolean onEntsOnly;

        private Builder() {
        }

        public Builder term(String label, String... values) {
            return terms(label, List.of(values));
        }

        public Builder terms(String label, List<String> values) {
            appendTo(terms, label, values);
            return this;
        }

        public Builder terms(Map<String, List<String>> values) {
            values.forEach(this::terms);
            return this;
        }

        public Builder regex(String label, String... patterns) {
            return regex(label, List.of(patterns));
        }

        public Builder regex(String label, List<String> patterns) {
            appendTo(regex, label, patterns);
            return this;
        }

        public Builder regex(Map<String, List<String>> patterns) {
            patterns.forEach(this::regex);
            return this;
        }

        public Builder attr(Attribute attribute) {
            this.attr = AttributeSpec.uniform(attribute);
            return this;
        }

        public Builder attr(AttributeSpec spec) {
            this.attr = Objects.requireNonNull(spec, "attr");
            return this;
        }

        public Builder fuzzy(boolean fuzzy) {
            this.fuzzy = fuzzy;
            return this;
        }

        public Builder fuzzyOptions(FuzzyOptions fuzzyOptions) {
            this.fuzzyOptions = Objects.requireNonNull(fuzzyOptions, "fuzzyOptions");
            return this;
        }

        public Builder filterMatches(boolean filterMatches) {
            this.filterMatches = filterMatches;
            return this;
        }

        public Builder onEntsOnly(boolean onEntsOnly) {
            this.onEntsOnly = onEntsOnly;
            return this;
        }

        public MatcherConfig build() {
            return new MatcherConfig(this);
        }

        private static void appendTo(Map<String, List<String>> target, String label, List<String> values) {
            Objects.requireNonNull(label, "label");
            List<String> existing = target.computeIfAbsent(label, key -> new ArrayList<>());
            for (String value : values) {
                existing.add(Objects.requireNonNull(value, "pattern of " + label));
            }
        }
    }
}
