package com.example.acfeed;

@FunctionalInterface
public interface BrowserSessionFactory {

    BrowserSession open();
}
