package com.spanmatcher.pipeline;

import com.spanmatcher.config.Constants;
import com.spanmatcher.document.Document;
import com.spanmatcher.document.TokenizedDocument;
import com.spanmatcher.text.TextNormalizer;
import com.spanmatcher.text.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * 归一化阶段：为每个词元写入 {@link TextNormalizer} 生成的归一化形式。
 */
public class NormalizerStage implements PipelineComponent {

    @Override
    public String name() {
        return Constants.NORMALIZER_STAGE;
    }

    @Override
    public Document apply(Document document) {
        if (!(document instanceof TokenizedDocument tokenizedDocument)) {
            throw new IllegalArgumentException("归一化阶段只支持 TokenizedDocument: " + document.getClass().getName());
        }
        List<String> norms = new ArrayList<>(document.size());
        for (Token token : document.tokens()) {
            norms.add(TextNormalizer.normalize(token.text()));
        }
        tokenizedDocument.replaceNorms(norms);
        return document;
    }

    @Override
    public List<Token> annotatePattern(List<Token> tokens) {
        List<Token> annotated = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            annotated.add(token.withNorm(TextNormalizer.normalize(token.text())));
        }
        return List.copyOf(annotated);
    }
}
