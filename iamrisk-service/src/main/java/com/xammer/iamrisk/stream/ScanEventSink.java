package com.xammer.iamrisk.stream;

import com.xammer.iamrisk.dto.stream.ScanEvent;

import java.io.IOException;

/**
 * Destination of the events produced by one scan.
 */
public interface ScanEventSink {

    /**
     * @throws IOException when the event could not be delivered; the scan stops
     */
    void send(ScanEvent event) throws IOException;

    /** Called once after the last event. */
    void complete();

    /** Called instead of {@link #complete()} when the scan failed unexpectedly. */
    void completeWithError(Throwable error);
}
