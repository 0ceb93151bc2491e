package com.spanmatcher.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 按句末标点与换行切分句子，输出每个句子的词元区间 [start, end)。
 */
public class SentenceSplitter {

    private static final Set<String> TERMINATORS = Set.of(".", "!", "?", "。", "！", "？");

    public List<int[]> split(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return List.of();
        }

        List<int[]> sentences = new ArrayList<>();
        int sentenceStart = 0;
        for (int index = 0; index < tokens.size(); index++) {
            Token token = tokens.get(index);
            boolean lastToken = index == tokens.size() - 1;
            if (lastToken || TERMINATORS.contains(token.text()) || token.whitespace().indexOf('\n') >= 0) {
                sentences.add(new int[] {sentenceStart, index + 1});
                sentenceStart = index + 1;
            }
        }
        return List.copyOf(sentences);
    }
}
