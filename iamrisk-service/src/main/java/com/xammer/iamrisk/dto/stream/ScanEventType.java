package com.xammer.iamrisk.dto.stream;

import java.util.Arrays;
import java.util.Optional;

/**
 * Event types of the scan stream, with their wire names and payload classes.
 */
public enum ScanEventType {
    START("start", ScanStartEvent.class),
    PROGRESS("progress", ScanProgressEvent.class),
    RESULT("result", ScanResultEvent.class),
    COMPLETE("complete", ScanCompleteEvent.class);

    private final String wireName;
    private final Class<? extends ScanEvent> payloadType;

    ScanEventType(String wireName, Class<? extends ScanEvent> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    public String getWireName() {
        return wireName;
    }

    public Class<? extends ScanEvent> getPayloadType() {
        return payloadType;
    }

    public static Optional<ScanEventType> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }
}
