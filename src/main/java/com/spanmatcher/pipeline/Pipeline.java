package com.spanmatcher.pipeline;

import com.spanmatcher.config.MatcherConfig;
import com.spanmatcher.document.Document;
import com.spanmatcher.document.DocumentFactory;
import com.spanmatcher.document.TokenizedDocument;
import com.spanmatcher.text.Token;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 有序的具名阶段序列：先分词切句，再依次执行各阶段。
 */
public class Pipeline {

    private final DocumentFactory documentFactory;
    private final List<PipelineComponent> components = new ArrayList<>();

    public Pipeline() {
        this(new DocumentFactory());
    }

    public Pipeline(DocumentFactory documentFactory) {
        this.documentFactory = documentFactory;
    }

    public Pipeline addStage(PipelineComponent component) {
        Set<String> existing = new HashSet<>(pipeNames());
        if (!existing.add(component.name())) {
            throw new IllegalArgumentException("阶段名重复: " + component.name());
        }
        components.add(component);
        return this;
    }

    /**
     * 以当前阶段为上游构建并追加一个匹配阶段。
     */
    public GenericMatcher addMatcher(String name, MatcherConfig config) {
        List<PipelineComponent> upstream = List.copyOf(components);
        GenericMatcher matcher = new GenericMatcher(name, config, documentFactory.getTokenizer(), pipeNames(),
            tokens -> annotatePattern(upstream, tokens));
        addStage(matcher);
        return matcher;
    }

    public List<PipelineComponent> components() {
        return List.copyOf(components);
    }

    public List<String> pipeNames() {
        List<String> names = new ArrayList<>(components.size());
        for (PipelineComponent component : components) {
            names.add(component.name());
        }
        return names;
    }

    public TokenizedDocument process(String text) {
        TokenizedDocument document = documentFactory.create(text);
        run(document);
        return document;
    }

    public Document run(Document document) {
        Document current = document;
        for (PipelineComponent component : components) {
            current = component.apply(current);
        }
        return current;
    }

    /**
     * 只执行名字排在指定阶段之前的部分，供调用方在匹配前写入已有实体。
     */
    public TokenizedDocument prepare(String text, String untilStage) {
        TokenizedDocument document = documentFactory.create(text);
        for (PipelineComponent component : components) {
            if (component.name().equals(untilStage)) {
                break;
            }
            component.apply(document);
        }
        return document;
    }

    public Document runFrom(Document document, String fromStage) {
        Document current = document;
        boolean started = false;
        for (PipelineComponent component : components) {
            started = started || component.name().equals(fromStage);
            if (started) {
                current = component.apply(current);
            }
        }
        return current;
    }

    private static List<Token> annotatePattern(List<PipelineComponent> upstream, List<Token> tokens) {
        List<Token> current = tokens;
        for (PipelineComponent component : upstream) {
            current = component.annotatePattern(current);
        }
        return current;
    }
}
