package com.spanmatcher.matcher;

import com.spanmatcher.document.Document;
import com.spanmatcher.document.Sentence;
import com.spanmatcher.document.Span;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 对单个文档运行已编译的匹配引擎。
 *
 * 整篇模式下两个引擎各扫描全文一次；实体范围模式下只扫描含已有实体的句子（按发现顺序去重）。
 * 返回顺序：全部词表片段在前，全部正则片段在后，这一顺序决定了重叠过滤时等长片段的取舍。
 */
public class MatchOrchestrator {

    private final CompiledMatchState state;
    private final boolean onEntsOnly;

    public MatchOrchestrator(CompiledMatchState state, boolean onEntsOnly) {
        this.state = state;
        this.onEntsOnly = onEntsOnly;
    }

    public List<Span> process(Document document) {
        List<Span> termSpans = new ArrayList<>();
        List<Span> regexSpans = new ArrayList<>();

        for (Sentence scope : scopes(document)) {
            for (Match match : state.getTermMatcher().scan(document, scope.start(), scope.end())) {
                termSpans.add(match.toSpan(document));
            }
            for (Match match : state.getRegexMatcher().scan(document, scope.start(), scope.end())) {
                regexSpans.add(match.toSpan(document));
            }
        }

        List<Span> spans = new ArrayList<>(termSpans.size() + regexSpans.size());
        spans.addAll(termSpans);
        spans.addAll(regexSpans);
        return spans;
    }

    /**
     * 待扫描的词元区间，以句子形式表示；整篇模式下是覆盖全文的单个区间。
     */
    List<Sentence> scopes(Document document) {
        if (!onEntsOnly) {
            return document.size() == 0 ? List.of() : List.of(new Sentence(0, 0, document.size()));
        }
        Set<Sentence> sentences = new LinkedHashSet<>();
        for (Span entity : document.entities()) {
            sentences.add(document.sentenceOf(entity.start()));
        }
        return List.copyOf(sentences);
    }

    public boolean isOnEntsOnly() {
        return onEntsOnly;
    }
}
