package com.sitelens.crawl.model;

import java.time.Instant;
import java.util.List;

public record StructureAnalysis(
    String url,
    Instant analyzedAt,
    List<Section> sections,
    Recommendations recommendations,
    DebugInfo debugInfo
) {
    public Section topSection() {
        return sections == null || sections.isEmpty() ? null : sections.get(0);
    }
}
