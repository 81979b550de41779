package com.sitelens.crawl.model;

import java.util.List;
import java.util.Map;

public record PageContent(
    String title,
    List<String> content,
    List<LinkData> links,
    List<ImageData> images,
    Map<String, String> metadata
) {
    public static PageContent empty() {
        return new PageContent(null, List.of(), List.of(), List.of(), Map.of());
    }
}
