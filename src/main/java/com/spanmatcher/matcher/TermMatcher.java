package com.spanmatcher.matcher;

import com.spanmatcher.document.Document;
import com.spanmatcher.text.Token;

import java.util.List;

/**
 * 词表匹配引擎（精确或模糊）。
 */
public interface TermMatcher {

    /**
     * 在标签下登记一组已分词的模式。
     */
    void add(String label, List<List<Token>> patterns);

    /**
     * 在词元区间 [start, end) 内扫描，返回文档级下标的匹配结果。
     */
    List<Match> scan(Document document, int start, int end);

    /**
     * 结束登记，之后只读。
     */
    void seal();

    int patternCount();
}
