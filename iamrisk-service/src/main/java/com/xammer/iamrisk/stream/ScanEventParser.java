package com.xammer.iamrisk.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.xammer.iamrisk.dto.stream.ScanEvent;
import com.xammer.iamrisk.dto.stream.ScanEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Incremental parser for a scan event stream. Chunks may split frames anywhere; complete
 * frames are returned as soon as their terminating blank line arrives. Frames of unknown
 * type or with an unreadable payload are skipped.
 *
 * <p>Not thread-safe; use one instance per stream.
 */
public class ScanEventParser {

    private static final Logger logger = LoggerFactory.getLogger(ScanEventParser.class);

    private final ScanEventCodec codec;
    private final StringBuilder pending = new StringBuilder();
    private String eventName;
    private StringBuilder data;

    ScanEventParser(ScanEventCodec codec) {
        this.codec = codec;
    }

    public List<ScanEvent> feed(String chunk) {
        List<ScanEvent> events = new ArrayList<>();
        pending.append(chunk);
        int newline;
        while ((newline = pending.indexOf("\n")) >= 0) {
            String line = pending.substring(0, newline);
            pending.delete(0, newline + 1);
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            processLine(line).ifPresent(events::add);
        }
        return events;
    }

    /**
     * Flushes a final frame that was not followed by a blank line.
     */
    public List<ScanEvent> finish() {
        List<ScanEvent> events = new ArrayList<>();
        if (pending.length() > 0) {
            String line = pending.toString();
            pending.setLength(0);
            processLine(line).ifPresent(events::add);
        }
        dispatch().ifPresent(events::add);
        return events;
    }

    private Optional<ScanEvent> processLine(String line) {
        if (line.isEmpty()) {
            return dispatch();
        }
        if (line.startsWith(":")) {
            return Optional.empty();
        }
        int colon = line.indexOf(':');
        String field = colon >= 0 ? line.substring(0, colon) : line;
        String value = colon >= 0 ? line.substring(colon + 1) : "";
        if (value.startsWith(" ")) {
            value = value.substring(1);
        }
        if ("event".equals(field)) {
            eventName = value;
        } else if ("data".equals(field)) {
            if (data == null) {
                data = new StringBuilder(value);
            } else {
                data.append('\n').append(value);
            }
        }
        return Optional.empty();
    }

    private Optional<ScanEvent> dispatch() {
        String name = eventName;
        StringBuilder payload = data;
        eventName = null;
        data = null;
        if (name == null || payload == null) {
            return Optional.empty();
        }
        Optional<ScanEventType> type = ScanEventType.fromWireName(name);
        if (type.isEmpty()) {
            logger.warn("Skipping scan stream frame of unknown type '{}'", name);
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(type.get(), payload.toString()));
        } catch (JsonProcessingException e) {
            logger.warn("Skipping unreadable '{}' frame: {}", name, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
