package com.spanmatcher.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AttributeResolverTest {

    private static final List<String> REGEX_LABELS = List.of("dose", "date");
    private static final List<String> WITH_NORMALIZER = List.of("sentences", Constants.NORMALIZER_STAGE);

    @ParameterizedTest
    @ValueSource(strings = {"TEXT", "text", " Text "})
    @DisplayName("统一取值广播到全部正则标签与保留键")
    void testUniformTextBroadcast(String value) {
        AttributeResolution resolution = AttributeResolver.resolve(AttributeSpec.uniform(value), REGEX_LABELS, List.of());

        Map<String, Attribute> resolved = resolution.attributes().asMap();
        assertEquals(3, resolved.size());
        assertEquals(Attribute.TEXT, resolved.get("dose"));
        assertEquals(Attribute.TEXT, resolved.get("date"));
        assertEquals(Attribute.TEXT, resolution.attributes().termAttribute());
        assertTrue(resolution.diagnostics().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"NORM", "norm", "NORMALIZED"})
    void testUniformNormalizedBroadcast(String value) {
        AttributeResolution resolution = AttributeResolver.resolve(AttributeSpec.uniform(value), REGEX_LABELS, WITH_NORMALIZER);

        for (Attribute attribute : resolution.attributes().asMap().values()) {
            assertEquals(Attribute.NORMALIZED, attribute);
        }
        assertTrue(resolution.diagnostics().isEmpty());
    }

    @Test
    @DisplayName("部分映射：缺省键取默认值 NORMALIZED")
    void testPartialMappingFillsDefault() {
        AttributeSpec spec = AttributeSpec.perLabel(Map.of("dose", "text"));

        AttributeResolution resolution = AttributeResolver.resolve(spec, REGEX_LABELS, WITH_NORMALIZER);

        assertEquals(Attribute.TEXT, resolution.attributes().get("dose"));
        assertEquals(Constants.DEFAULT_ATTR, resolution.attributes().get("date"));
        assertEquals(Constants.DEFAULT_ATTR, resolution.attributes().termAttribute());
        assertTrue(resolution.diagnostics().isEmpty());
    }

    @Test
    @DisplayName("空映射：全部取默认值")
    void testEmptyMapping() {
        AttributeResolution resolution = AttributeResolver.resolve(AttributeSpec.perLabel(Map.of()), List.of(), WITH_NORMALIZER);

        assertEquals(Map.of(Constants.TERM_ATTR, Attribute.NORMALIZED), resolution.attributes().asMap());
    }

    @Test
    @DisplayName("未知键产生警告并被忽略")
    void testUnknownKeyWarns() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("dose", "TEXT");
        values.put("weight", "TEXT");
        values.put(Constants.TERM_ATTR, "TEXT");

        AttributeResolution resolution = AttributeResolver.resolve(AttributeSpec.perLabel(values), REGEX_LABELS, List.of());

        assertEquals(1, resolution.diagnostics().size());
        Diagnostic diagnostic = resolution.diagnostics().get(0);
        assertEquals(Diagnostic.Code.UNKNOWN_ATTRIBUTE_KEY, diagnostic.code());
        assertTrue(diagnostic.message().contains("weight"));
        assertEquals(false, resolution.attributes().asMap().containsKey("weight"));
        assertEquals(Attribute.TEXT, resolution.attributes().termAttribute());
    }

    @Test
    @DisplayName("非法取值为致命错误")
    void testUnsupportedValueFails() {
        AttributeSpec spec = AttributeSpec.perLabel(Map.of("dose", "LEMMA"));

        ConfigurationException exception = assertThrows(ConfigurationException.class,
            () -> AttributeResolver.resolve(spec, REGEX_LABELS, List.of()));
        assertEquals("dose", exception.getKey());
        assertEquals("LEMMA", exception.getValue());
    }

    @Test
    void testUnsupportedTermValueFails() {
        AttributeSpec spec = AttributeSpec.perLabel(Map.of(Constants.TERM_ATTR, "LOWER"));

        assertThrows(ConfigurationException.class, () -> AttributeResolver.resolve(spec, REGEX_LABELS, List.of()));
    }

    @Test
    void testUnsupportedUniformValueFails() {
        assertThrows(ConfigurationException.class,
            () -> AttributeResolver.resolve(AttributeSpec.uniform("LEMMA"), REGEX_LABELS, List.of()));
        assertThrows(ConfigurationException.class,
            () -> AttributeResolver.resolve(AttributeSpec.uniform((String) null), REGEX_LABELS, List.of()));
    }

    @Test
    @DisplayName("使用 NORMALIZED 但缺少归一化阶段时给出警告")
    void testMissingNormalizerWarns() {
        AttributeResolution resolution = AttributeResolver.resolve(
            AttributeSpec.perLabel(Map.of("dose", "TEXT")), REGEX_LABELS, List.of("sentences"));

        assertEquals(1, resolution.diagnostics().size());
        assertEquals(Diagnostic.Code.MISSING_NORMALIZER, resolution.diagnostics().get(0).code());
    }

    @Test
    void testTextOnlyNeedsNoNormalizer() {
        AttributeResolution resolution = AttributeResolver.resolve(
            AttributeSpec.uniform(Attribute.TEXT), REGEX_LABELS, List.of());

        assertTrue(resolution.diagnostics().isEmpty());
        assertEquals(false, resolution.attributes().uses(Attribute.NORMALIZED));
    }
}
