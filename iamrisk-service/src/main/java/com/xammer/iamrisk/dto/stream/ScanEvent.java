package com.xammer.iamrisk.dto.stream;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Base type of every frame sent on the scan stream. The subclass is the JSON payload of the
 * frame; the type travels in the {@code event:} line.
 */
public abstract class ScanEvent {

    @JsonIgnore
    public abstract ScanEventType getType();
}
