package com.spanmatcher.document;

import com.spanmatcher.config.Attribute;
import com.spanmatcher.text.Token;

import java.util.List;

/**
 * 匹配核心所依赖的文档抽象：有序词元、句子边界、可替换的实体列表，以及任意词元区间的原文/归一化文本视图。
 */
public interface Document {

    List<Token> tokens();

    default Token token(int index) {
        return tokens().get(index);
    }

    default int size() {
        return tokens().size();
    }

    List<Sentence> sentences();

    /**
     * 返回包含指定词元的句子。
     */
    Sentence sentenceOf(int tokenIndex);

    List<Span> entities();

    /**
     * 整体替换文档的实体列表。
     */
    void setEntities(List<Span> entities);

    /**
     * 返回词元区间 [start, end) 在指定属性下的字符串视图，词元之间保留原文空白。
     */
    String text(int start, int end, Attribute attribute);

    /**
     * 返回单个词元在指定属性下的取值。
     */
    default String tokenValue(int index, Attribute attribute) {
        Token token = token(index);
        return attribute == Attribute.TEXT ? token.text() : token.norm();
    }
}
