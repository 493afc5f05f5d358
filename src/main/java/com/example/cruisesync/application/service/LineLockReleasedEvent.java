package com.example.cruisesync.application.service;

/**
 * Published after a crawl gives back a line lock, so webhook events merged while the crawl
 * held the line still get their run.
 */
public class LineLockReleasedEvent {

    private final int lineId;
    private final String holderId;

    public LineLockReleasedEvent(int lineId, String holderId) {
        this.lineId = lineId;
        this.holderId = holderId;
    }

    public int getLineId() {
        return lineId;
    }

    public String getHolderId() {
        return holderId;
    }
}
