package com.spanmatcher.cli;

import com.spanmatcher.document.Span;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record MatchReport(
    Instant processedAt,
    long elapsedMs,
    int tokenCount,
    List<SpanView> spans
) {

    public static MatchReport of(Instant processedAt, long elapsedMs, int tokenCount, List<Span> spans) {
        List<SpanView> views = new ArrayList<>(spans.size());
        for (Span span : spans) {
            views.add(new SpanView(span.label(), span.start(), span.end(), span.text(), span.source().name()));
        }
        return new MatchReport(processedAt, elapsedMs, tokenCount, List.copyOf(views));
    }

    public record SpanView(String label, int start, int end, String text, String source) {
    }
}
