package com.spanmatcher.matcher;

import com.spanmatcher.config.AttributeMap;
import com.spanmatcher.config.Diagnostic;
import com.spanmatcher.config.FuzzyOptions;
import com.spanmatcher.config.MatcherConfig;
import com.spanmatcher.text.Token;
import com.spanmatcher.text.Tokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * 把词表与正则配置编译为 {@link CompiledMatchState}。
 *
 * 词表条目经分词器切分后登记到精确或模糊引擎（全局二选一），统一使用保留键对应的属性；
 * 正则按标签登记，各自使用该标签的属性。
 */
public class PatternCompiler {

    private final Tokenizer tokenizer;
    private final UnaryOperator<List<Token>> patternAnnotator;

    public PatternCompiler(Tokenizer tokenizer) {
        this(tokenizer, UnaryOperator.identity());
    }

    /**
     * @param patternAnnotator 对模式词元补全上游阶段产生的属性（如归一化形式）
     */
    public PatternCompiler(Tokenizer tokenizer, UnaryOperator<List<Token>> patternAnnotator) {
        this.tokenizer = tokenizer;
        this.patternAnnotator = patternAnnotator;
    }

    public CompiledMatchState compile(MatcherConfig config, AttributeMap attributes) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        TermMatcher termMatcher = createTermMatcher(config.isFuzzy(), config.getFuzzyOptions(), attributes, diagnostics);

        for (Map.Entry<String, List<String>> entry : config.getTerms().entrySet()) {
            List<List<Token>> patterns = new ArrayList<>();
            for (String expression : entry.getValue()) {
                List<Token> tokens = patternAnnotator.apply(tokenizer.tokenize(expression));
                if (tokens.isEmpty()) {
                    diagnostics.add(new Diagnostic(Diagnostic.Code.EMPTY_TERM,
                        "term '" + expression + "' of label '" + entry.getKey() + "' has no tokens and is skipped"));
                    continue;
                }
                patterns.add(tokens);
            }
            termMatcher.add(entry.getKey(), patterns);
        }

        RegexMatcher regexMatcher = new RegexMatcher();
        for (Map.Entry<String, List<String>> entry : config.getRegex().entrySet()) {
            regexMatcher.add(entry.getKey(), entry.getValue(), attributes.get(entry.getKey()));
        }

        return new CompiledMatchState(termMatcher, regexMatcher, attributes, diagnostics);
    }

    private TermMatcher createTermMatcher(boolean fuzzy, FuzzyOptions fuzzyOptions, AttributeMap attributes,
                                          List<Diagnostic> diagnostics) {
        if (fuzzy) {
            diagnostics.add(new Diagnostic(Diagnostic.Code.FUZZY_PERFORMANCE,
                "fuzzy matching was requested, which significantly increases compute times (x60 is common)"));
            return new FuzzyMatcher(attributes.termAttribute(), fuzzyOptions);
        }
        return new PhraseMatcher(attributes.termAttribute());
    }
}
