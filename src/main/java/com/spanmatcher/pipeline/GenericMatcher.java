package com.spanmatcher.pipeline;

import com.spanmatcher.config.AttributeResolution;
import com.spanmatcher.config.AttributeResolver;
import com.spanmatcher.config.Constants;
import com.spanmatcher.config.Diagnostic;
import com.spanmatcher.config.MatcherConfig;
import com.spanmatcher.document.Document;
import com.spanmatcher.document.Span;
import com.spanmatcher.filter.SpanFilter;
import com.spanmatcher.matcher.CompiledMatchState;
import com.spanmatcher.matcher.MatchOrchestrator;
import com.spanmatcher.matcher.PatternCompiler;
import com.spanmatcher.text.Token;
import com.spanmatcher.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * 通用词表/正则匹配阶段。
 *
 * 构造时解析属性、编译模式（配置错误在此抛出）；处理文档时运行匹配、可选地过滤重叠，
 * 并用结果整体覆盖文档原有的实体列表。
 */
public class GenericMatcher implements PipelineComponent {
    private static final Logger logger = LoggerFactory.getLogger(GenericMatcher.class);

    private final String name;
    private final MatcherConfig config;
    private final CompiledMatchState state;
    private final MatchOrchestrator orchestrator;
    private final SpanFilter spanFilter;
    private final List<Diagnostic> diagnostics;

    public GenericMatcher(MatcherConfig config, Tokenizer tokenizer) {
        this(Constants.MATCHER_STAGE, config, tokenizer, List.of(), UnaryOperator.identity());
    }

    /**
     * @param pipeNames 上游阶段名，用于检查归一化阶段是否存在
     * @param patternAnnotator 用上游阶段补全模式词元的属性
     */
    public GenericMatcher(String name, MatcherConfig config, Tokenizer tokenizer, Collection<String> pipeNames,
                          UnaryOperator<List<Token>> patternAnnotator) {
        this.name = name;
        this.config = config;

        AttributeResolution resolution = AttributeResolver.resolve(config.getAttr(), config.getRegex().keySet(), pipeNames);
        this.state = new PatternCompiler(tokenizer, patternAnnotator).compile(config, resolution.attributes());
        this.orchestrator = new MatchOrchestrator(state, config.isOnEntsOnly());
        this.spanFilter = new SpanFilter(config.isFilterMatches());

        List<Diagnostic> collected = new ArrayList<>(resolution.diagnostics());
        collected.addAll(state.getDiagnostics());
        this.diagnostics = List.copyOf(collected);
        for (Diagnostic diagnostic : diagnostics) {
            logger.warn("[{}] {}", name, diagnostic.message());
        }
        logger.debug("[{}] 已编译 {} 个词表模式、{} 个正则模式，属性: {}", name,
            state.getTermMatcher().patternCount(), state.getRegexMatcher().patternCount(), state.getAttributes());
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * 查找匹配片段，按配置过滤重叠后返回，不修改文档。
     */
    public List<Span> process(Document document) {
        List<Span> spans = spanFilter.apply(orchestrator.process(document));
        logger.debug("[{}] 文档词元数 {}，输出片段 {} 个", name, document.size(), spans.size());
        return spans;
    }

    /**
     * 运行匹配并用结果覆盖文档的实体列表。
     */
    @Override
    public Document apply(Document document) {
        List<Span> spans = process(document);
        document.setEntities(spans);
        return document;
    }

    public MatcherConfig getConfig() {
        return config;
    }

    public CompiledMatchState getState() {
        return state;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
