package com.catalog.picklist.dto;

public record SyncRequestMetadata(String sourceIp, String userAgent, long requestBodySize) {

    public static SyncRequestMetadata unknown() {
        return new SyncRequestMetadata(null, null, 0L);
    }
}
