package com.xammer.iamrisk.dto.stream;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScanStartEvent extends ScanEvent {
    @JsonAlias("totalPermissionSets")
    private int totalCount;
    private String message;

    @Override
    public ScanEventType getType() {
        return ScanEventType.START;
    }
}
