package com.xammer.iamrisk.stream;

import com.xammer.iamrisk.dto.stream.ScanEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Writes encoded frames to an HTTP response emitter.
 */
public class EmitterScanEventSink implements ScanEventSink {

    private static final Logger logger = LoggerFactory.getLogger(EmitterScanEventSink.class);

    private static final MediaType TEXT_UTF8 = new MediaType("text", "plain", StandardCharsets.UTF_8);

    private final ResponseBodyEmitter emitter;
    private final ScanEventCodec codec;

    public EmitterScanEventSink(ResponseBodyEmitter emitter, ScanEventCodec codec) {
        this.emitter = emitter;
        this.codec = codec;
    }

    /**
     * Cancels the scan when the emitter completes, times out or fails before the scan is done.
     */
    public EmitterScanEventSink cancelOnDisconnect(ScanCancellation cancellation) {
        emitter.onTimeout(() -> cancellation.cancel("stream timed out"));
        emitter.onError(e -> cancellation.cancel("stream error: " + e.getMessage()));
        emitter.onCompletion(() -> cancellation.cancel("stream closed"));
        return this;
    }

    @Override
    public void send(ScanEvent event) throws IOException {
        logger.debug("Sending {} event", event.getType().getWireName());
        emitter.send(codec.encode(event), TEXT_UTF8);
    }

    @Override
    public void complete() {
        emitter.complete();
    }

    @Override
    public void completeWithError(Throwable error) {
        emitter.completeWithError(error);
    }
}
