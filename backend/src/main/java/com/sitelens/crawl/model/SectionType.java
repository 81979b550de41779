package com.sitelens.crawl.model;

public enum SectionType {
    MAIN_CONTENT,
    ARTICLE,
    SIDEBAR,
    NAVIGATION,
    HEADER,
    FOOTER,
    COMMENTS,
    RELATED_LINKS,
    ADVERTISEMENTS,
    UNKNOWN;

    public boolean isContent() {
        return this == MAIN_CONTENT || this == ARTICLE;
    }

    public boolean isPageChrome() {
        return this == NAVIGATION || this == HEADER || this == FOOTER;
    }
}
