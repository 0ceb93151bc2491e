package com.spanmatcher.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 属性配置解析器：把统一取值或按标签映射展开为完整的 {@link AttributeMap}。
 *
 * 解析结果覆盖全部正则标签与词表保留键 {@value Constants#TERM_ATTR}；
 * 非法取值抛出 {@link ConfigurationException}，其余问题以诊断信息返回。
 */
public final class AttributeResolver {

    private AttributeResolver() {
        // 工具类，禁止实例化
    }

    public static AttributeResolution resolve(AttributeSpec spec, Collection<String> regexLabels,
                                              Collection<String> pipeNames) {
        Set<String> keys = new LinkedHashSet<>(regexLabels);
        keys.add(Constants.TERM_ATTR);

        List<Diagnostic> diagnostics = new ArrayList<>();
        Map<String, Attribute> resolved = new LinkedHashMap<>();

        if (spec instanceof AttributeSpec.Uniform uniform) {
            Attribute attribute = parseOrFail("attr", uniform.value());
            for (String key : keys) {
                resolved.put(key, attribute);
            }
        } else if (spec instanceof AttributeSpec.PerLabel perLabel) {
            Map<String, String> provided = new LinkedHashMap<>();
            perLabel.values().forEach((key, value) -> provided.put(key.trim(), value));

            Set<String> unknownKeys = new TreeSet<>(provided.keySet());
            unknownKeys.removeAll(keys);
            if (!unknownKeys.isEmpty()) {
                diagnostics.add(new Diagnostic(Diagnostic.Code.UNKNOWN_ATTRIBUTE_KEY,
                    "some of 'attr' keys are not regex labels and will be ignored: " + unknownKeys));
            }

            for (String key : keys) {
                String value = provided.get(key);
                resolved.put(key, value == null ? Constants.DEFAULT_ATTR : parseOrFail(key, value));
            }
        } else {
            throw new ConfigurationException("缺少属性配置", null, null);
        }

        if (resolved.containsValue(Attribute.NORMALIZED) && !pipeNames.contains(Constants.NORMALIZER_STAGE)) {
            diagnostics.add(new Diagnostic(Diagnostic.Code.MISSING_NORMALIZER,
                "NORMALIZED attribute is used but no '" + Constants.NORMALIZER_STAGE
                    + "' stage runs upstream; normalized text equals raw text"));
        }

        return new AttributeResolution(new AttributeMap(resolved), diagnostics);
    }

    private static Attribute parseOrFail(String key, String value) {
        return Attribute.parse(value)
            .orElseThrow(() -> new ConfigurationException(
                "不支持的匹配属性，仅支持 TEXT 或 NORMALIZED", key, value));
    }
}
