package com.cartographer.crawler;

/**
 * 爬取状态机: INIT -> {PROCESS_SCREEN <-> EXECUTE_TASK} -> DONE
 */
public enum CrawlState {
    IDLE,
    INIT,
    PROCESS_SCREEN,
    EXECUTE_TASK,
    DONE,
    CANCELLED,
    FAILED
}
