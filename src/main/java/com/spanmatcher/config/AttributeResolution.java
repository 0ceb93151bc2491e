package com.spanmatcher.config;

import java.util.List;

public record AttributeResolution(AttributeMap attributes, List<Diagnostic> diagnostics) {
    public AttributeResolution {
        diagnostics = List.copyOf(diagnostics);
    }
}
