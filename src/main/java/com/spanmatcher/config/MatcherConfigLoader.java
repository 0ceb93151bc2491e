package com.spanmatcher.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从 JSON 读取匹配器配置。
 *
 * 标量/列表、标量/映射两种写法只在这里规整一次，之后的流程只看到 {@link MatcherConfig}。
 * <pre>
 * {
 *   "terms": {"drug": ["aspirin", "paracetamol"], "cough": "toux"},
 *   "regex": {"dose": "\\d+mg"},
 *   "attr": {"term_attr": "NORM", "dose": "TEXT"},
 *   "fuzzy": false,
 *   "fuzzy_kwargs": {"min_r2": 90, "ignore_case": true},
 *   "filter_matches": true,
 *   "on_ents_only": false
 * }
 * </pre>
 */
public class MatcherConfigLoader {

    private final ObjectMapper mapper;

    public MatcherConfigLoader() {
        this.mapper = new ObjectMapper()
            .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public MatcherConfig load(Path path) throws IOException {
        try {
            return toConfig(mapper.readValue(path.toFile(), RawConfig.class));
        } catch (JsonProcessingException exception) {
            throw new ConfigurationException("无法解析配置 " + path + ": " + exception.getOriginalMessage(),
                null, null, exception);
        }
    }

    public MatcherConfig parse(String json) {
        try {
            return toConfig(mapper.readValue(json, RawConfig.class));
        } catch (JsonProcessingException exception) {
            throw new ConfigurationException("无法解析配置: " + exception.getOriginalMessage(), null, null, exception);
        }
    }

    private MatcherConfig toConfig(RawConfig raw) {
        MatcherConfig.Builder builder = MatcherConfig.builder()
            .fuzzy(raw.fuzzy)
            .filterMatches(raw.filterMatches)
            .onEntsOnly(raw.onEntsOnly);
        if (raw.terms != null) {
            builder.terms(raw.terms);
        }
        if (raw.regex != null) {
            builder.regex(raw.regex);
        }
        if (raw.attr != null && !raw.attr.isNull()) {
            builder.attr(toAttributeSpec(raw.attr));
        }
        if (raw.fuzzyKwargs != null) {
            builder.fuzzyOptions(new FuzzyOptions(
                raw.fuzzyKwargs.minRatio == null ? Constants.DEFAULT_FUZZY_MIN_RATIO : raw.fuzzyKwargs.minRatio,
                raw.fuzzyKwargs.ignoreCase == null ? Constants.DEFAULT_FUZZY_IGNORE_CASE : raw.fuzzyKwargs.ignoreCase,
                raw.fuzzyKwargs.flex == null ? Constants.DEFAULT_FUZZY_FLEX : raw.fuzzyKwargs.flex));
        }
        return builder.build();
    }

    private AttributeSpec toAttributeSpec(JsonNode node) {
        if (node.isTextual()) {
            return AttributeSpec.uniform(node.asText());
        }
        if (node.isObject()) {
            Map<String, String> values = new LinkedHashMap<>();
            node.fields().forEachRemaining(entry -> {
                if (!entry.getValue().isTextual()) {
                    throw new ConfigurationException("属性取值必须是字符串", entry.getKey(), entry.getValue().toString());
                }
                values.put(entry.getKey(), entry.getValue().asText());
            });
            return AttributeSpec.perLabel(values);
        }
        throw new ConfigurationException("attr 必须是字符串或对象", "attr", node.toString());
    }

    static class RawConfig {
        @JsonProperty("terms")
        Map<String, List<String>> terms;

        @JsonProperty("regex")
        Map<String, List<String>> regex;

        @JsonProperty("attr")
        JsonNode attr;

        @JsonProperty("fuzzy")
        boolean fuzzy;

        @JsonProperty("fuzzy_kwargs")
        RawFuzzyOptions fuzzyKwargs;

        @JsonProperty("filter_matches")
        boolean filterMatches = true;

        @JsonProperty("on_ents_only")
        boolean onEntsOnly;
    }

    static class RawFuzzyOptions {
        @JsonProperty("min_r2")
        Integer minRatio;

        @JsonProperty("ignore_case")
        Boolean ignoreCase;

        @JsonProperty("flex")
        Integer flex;
    }
}
