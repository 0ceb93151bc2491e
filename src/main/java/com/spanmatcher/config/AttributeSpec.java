package com.spanmatcher.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 原始属性配置：统一取值或按标签映射。取值保持字符串形式，由 {@link AttributeResolver} 校验。
 */
public sealed interface AttributeSpec permits AttributeSpec.Uniform, AttributeSpec.PerLabel {

    static AttributeSpec uniform(String value) {
        return new Uniform(value);
    }

    static AttributeSpec uniform(Attribute attribute) {
        return new Uniform(attribute.name());
    }

    static AttributeSpec perLabel(Map<String, String> values) {
        return new PerLabel(values);
    }

    record Uniform(String value) implements AttributeSpec {
    }

    record PerLabel(Map<String, String> values) implements AttributeSpec {
        public PerLabel {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }
    }
}
