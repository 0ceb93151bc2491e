package com.spanmatcher.pipeline;

import com.spanmatcher.document.Document;
import com.spanmatcher.text.Token;

import java.util.List;

/**
 * 流水线中的具名处理阶段。
 */
public interface PipelineComponent {

    String name();

    Document apply(Document document);

    /**
     * 为模式词元补全本阶段会写入文档词元的属性，使模式与文档在同一表示下比较。默认不做处理。
     */
    default List<Token> annotatePattern(List<Token> tokens) {
        return tokens;
    }
}
