package com.sitelens.crawl.model;

public enum PlanSource {
    PROFILE,
    ANALYSIS
}
