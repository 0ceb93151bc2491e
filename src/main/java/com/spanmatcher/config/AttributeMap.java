package com.spanmatcher.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 已解析的属性映射：每个正则标签与词表保留键各对应一个属性。
 */
public final class AttributeMap {
    private final Map<String, Attribute> values;

    AttributeMap(Map<String, Attribute> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * 词表匹配使用的属性。
     */
    public Attribute termAttribute() {
        return values.get(Constants.TERM_ATTR);
    }

    public Attribute get(String key) {
        Attribute attribute = values.get(key);
        if (attribute == null) {
            throw new IllegalArgumentException("未解析的属性键: " + key);
        }
        return attribute;
    }

    public boolean uses(Attribute attribute) {
        return values.containsValue(attribute);
    }

    public Map<String, Attribute> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof AttributeMap that && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
