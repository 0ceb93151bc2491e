package com.spanmatcher.document;

import com.spanmatcher.text.RuleTokenizer;
import com.spanmatcher.text.SentenceSplitter;
import com.spanmatcher.text.Token;
import com.spanmatcher.text.Tokenizer;

import java.util.List;

/**
 * 由原始文本构建文档：分词后切分句子。
 */
public class DocumentFactory {

    private final Tokenizer tokenizer;
    private final SentenceSplitter sentenceSplitter;

    public DocumentFactory() {
        this(new RuleTokenizer(), new SentenceSplitter());
    }

    public DocumentFactory(Tokenizer tokenizer, SentenceSplitter sentenceSplitter) {
        this.tokenizer = tokenizer;
        this.sentenceSplitter = sentenceSplitter;
    }

    public Tokenizer getTokenizer() {
        return tokenizer;
    }

    public TokenizedDocument create(String text) {
        List<Token> tokens = tokenizer.tokenize(text);
        return new TokenizedDocument(text, tokens, sentenceSplitter.split(tokens));
    }
}
