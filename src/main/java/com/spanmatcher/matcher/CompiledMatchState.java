package com.spanmatcher.matcher;

import com.spanmatcher.config.AttributeMap;
import com.spanmatcher.config.Diagnostic;

import java.util.List;

/**
 * 编译后的匹配状态：词表引擎、正则引擎与所用属性映射。
 *
 * 由 {@link PatternCompiler} 一次性构建，之后只读，可在并发处理的多个文档间共享。
 */
public final class CompiledMatchState {
    private final TermMatcher termMatcher;
    private final RegexMatcher regexMatcher;
    private final AttributeMap attributes;
    private final List<Diagnostic> diagnostics;

    CompiledMatchState(TermMatcher termMatcher, RegexMatcher regexMatcher, AttributeMap attributes,
                       List<Diagnostic> diagnostics) {
        termMatcher.seal();
        regexMatcher.seal();
        this.termMatcher = termMatcher;
        this.regexMatcher = regexMatcher;
        this.attributes = attributes;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public TermMatcher getTermMatcher() {
        return termMatcher;
    }

    public RegexMatcher getRegexMatcher() {
        return regexMatcher;
    }

    public AttributeMap getAttributes() {
        return attributes;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean isFuzzy() {
        return termMatcher instanceof FuzzyMatcher;
    }
}
