package com.spanmatcher.text;

import java.util.List;

public interface Tokenizer {

    /**
     * 将输入文本切分为词元列表。
     */
    List<Token> tokenize(String text);
}
