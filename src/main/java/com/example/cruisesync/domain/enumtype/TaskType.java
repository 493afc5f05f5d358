package com.example.cruisesync.domain.enumtype;

public enum TaskType {
    FULL_CRAWL,
    LINE_CRAWL,
    WEBHOOK_LINE_SYNC
}
