package com.sitelens.crawl.http;

import com.sitelens.crawl.model.HttpFetchResult;

/**
 * One GET per URL. Network and HTTP failures are reported through the result, never thrown.
 */
@FunctionalInterface
public interface PageFetcher {
    HttpFetchResult fetch(String url);
}
