package com.xammer.iamrisk.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.iamrisk.dto.stream.ScanEvent;
import com.xammer.iamrisk.dto.stream.ScanEventType;
import org.springframework.stereotype.Component;

/**
 * Encodes scan events as Server-Sent Event frames and decodes frame payloads back into
 * typed events. A frame is {@code event: <type>\ndata: <json>\n\n} with the JSON on one line.
 */
@Component
public class ScanEventCodec {

    private final ObjectMapper objectMapper;

    public ScanEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ScanEvent event) {
        try {
            return "event: " + event.getType().getWireName() + "\n"
                    + "data: " + objectMapper.writeValueAsString(event) + "\n\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + event.getType().getWireName() + " event", e);
        }
    }

    public ScanEvent decode(ScanEventType type, String data) throws JsonProcessingException {
        return objectMapper.readValue(data, type.getPayloadType());
    }

    public ScanEventParser newParser() {
        return new ScanEventParser(this);
    }
}
