package com.sitelens.crawl.util;

@FunctionalInterface
public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
}
