package com.spanmatcher;

import com.spanmatcher.config.Attribute;
import com.spanmatcher.config.MatcherConfig;
import com.spanmatcher.document.DocumentFactory;
import com.spanmatcher.document.MatchSource;
import com.spanmatcher.document.Sentence;
import com.spanmatcher.document.Span;
import com.spanmatcher.document.TokenizedDocument;
import com.spanmatcher.pipeline.GenericMatcher;
import com.spanmatcher.text.RuleTokenizer;
import com.spanmatcher.text.SentenceSplitter;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 精确匹配与模糊匹配的单文档耗时对比
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class MatcherBenchmark {

    private static final String[] DRUGS = {
        "aspirin", "paracetamol", "ibuprofen", "amoxicillin", "metformin",
        "atorvastatin", "omeprazole", "lisinopril", "levothyroxine", "amlodipine"
    };

    @Param({"false", "true"})
    public boolean onEntsOnly;

    private GenericMatcher exactMatcher;
    private GenericMatcher fuzzyMatcher;
    private TokenizedDocument document;

    @Setup
    public void setup() {
        RuleTokenizer tokenizer = new RuleTokenizer();
        exactMatcher = new GenericMatcher(config(false), tokenizer);
        fuzzyMatcher = new GenericMatcher(config(true), tokenizer);

        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 200; i++) {
            text.append("Patient ").append(i).append(" takes ")
                .append(DRUGS[i % DRUGS.length]).append(' ')
                .append(10 * (i % 7 + 1)).append("mg daily. ")
                .append("No further complaint reported today.\n");
        }
        document = new DocumentFactory(tokenizer, new SentenceSplitter()).create(text.toString());
        // 每隔一句放一个已有实体，供实体范围模式使用
        List<Span> seeds = new ArrayList<>();
        for (Sentence sentence : document.sentences()) {
            if (sentence.index() % 2 == 0) {
                seeds.add(new Span(document, sentence.start(), sentence.start() + 1,
                    "person", MatchSource.EXACT));
            }
        }
        document.setEntities(seeds);
    }

    private MatcherConfig config(boolean fuzzy) {
        return MatcherConfig.builder()
            .terms("drug", List.of(DRUGS))
            .regex("dose", "\\d+mg")
            .attr(Attribute.TEXT)
            .fuzzy(fuzzy)
            .onEntsOnly(onEntsOnly)
            .build();
    }

    @Benchmark
    public int exact() {
        return exactMatcher.process(document).size();
    }

    @Benchmark
    public int fuzzy() {
        return fuzzyMatcher.process(document).size();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(MatcherBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
