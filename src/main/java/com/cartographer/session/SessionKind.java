package com.cartographer.session;

public enum SessionKind {
    CRAWL,
    GOAL
}
