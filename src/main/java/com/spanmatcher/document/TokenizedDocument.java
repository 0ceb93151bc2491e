package com.spanmatcher.document;

import com.spanmatcher.config.Attribute;
import com.spanmatcher.text.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 基于已分词文本的内存文档实现。
 */
public class TokenizedDocument implements Document {

    private final String text;
    private final List<Token> tokens;
    private final List<Token> tokensView;
    private final List<Sentence> sentences;
    private final int[] sentenceByToken;
    private List<Span> entities = List.of();

    public TokenizedDocument(String text, List<Token> tokens, List<int[]> sentenceBounds) {
        this.text = text == null ? "" : text;
        this.tokens = new ArrayList<>(tokens);
        this.tokensView = Collections.unmodifiableList(this.tokens);
        this.sentenceByToken = new int[tokens.size()];

        List<Sentence> builtSentences = new ArrayList<>(sentenceBounds.size());
        int expectedStart = 0;
        for (int[] bounds : sentenceBounds) {
            if (bounds[0] != expectedStart || bounds[1] <= bounds[0] || bounds[1] > tokens.size()) {
                throw new IllegalArgumentException(
                    "句子边界必须连续覆盖全部词元: [" + bounds[0] + ", " + bounds[1] + ")");
            }
            Sentence sentence = new Sentence(builtSentences.size(), bounds[0], bounds[1]);
            for (int index = sentence.start(); index < sentence.end(); index++) {
                sentenceByToken[index] = sentence.index();
            }
            builtSentences.add(sentence);
            expectedStart = bounds[1];
        }
        if (expectedStart != tokens.size()) {
            throw new IllegalArgumentException("句子边界未覆盖全部词元: " + expectedStart + " / " + tokens.size());
        }
        this.sentences = List.copyOf(builtSentences);
    }

    public String rawText() {
        return text;
    }

    @Override
    public List<Token> tokens() {
        return tokensView;
    }

    @Override
    public int size() {
        return tokens.size();
    }

    @Override
    public List<Sentence> sentences() {
        return sentences;
    }

    @Override
    public Sentence sentenceOf(int tokenIndex) {
        return sentences.get(sentenceByToken[tokenIndex]);
    }

    @Override
    public List<Span> entities() {
        return entities;
    }

    @Override
    public void setEntities(List<Span> entities) {
        for (Span span : entities) {
            if (span.document() != this) {
                throw new IllegalArgumentException("实体不属于当前文档: " + span);
            }
        }
        this.entities = List.copyOf(entities);
    }

    /**
     * 用给定的归一化形式替换词元列表，供归一化阶段使用。
     */
    public void replaceNorms(List<String> norms) {
        if (norms.size() != tokens.size()) {
            throw new IllegalArgumentException("归一化结果数量与词元数量不一致");
        }
        for (int index = 0; index < tokens.size(); index++) {
            tokens.set(index, tokens.get(index).withNorm(norms.get(index)));
        }
    }

    @Override
    public String text(int start, int end, Attribute attribute) {
        if (start < 0 || end > tokens.size() || start > end) {
            throw new IndexOutOfBoundsException("非法区间: [" + start + ", " + end + ")");
        }
        StringBuilder builder = new StringBuilder();
        for (int index = start; index < end; index++) {
            builder.append(tokenValue(index, attribute));
            if (index < end - 1) {
                builder.append(tokens.get(index).whitespace());
            }
        }
        return builder.toString();
    }
}
