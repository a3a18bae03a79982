package com.xammer.iamrisk.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.xammer.iamrisk.dto.PermissionSetDetails;
import com.xammer.iamrisk.dto.ScanProgress;
import com.xammer.iamrisk.dto.ScanSummary;
import com.xammer.iamrisk.dto.risk.UserRiskProfile;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * State of one resumable scan. {@code results} follow the order of {@code permissionSets}.
 * {@code recorded} is set once a stream has attached to write into the session.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScanSession {
    private String id;
    private String scope;
    private List<PermissionSetDetails> permissionSets = new ArrayList<>();
    private String region;
    private String ssoRegion;
    private Instant startTime;
    private boolean active;
    private boolean recorded;
    private List<UserRiskProfile> results = new ArrayList<>();
    private ScanProgress progress;
    private ScanSummary summary;
    private String error;

    public ScanSession snapshot() {
        ScanSession copy = new ScanSession();
        copy.setId(id);
        copy.setScope(scope);
        copy.setPermissionSets(new ArrayList<>(permissionSets));
        copy.setRegion(region);
        copy.setSsoRegion(ssoRegion);
        copy.setStartTime(startTime);
        copy.setActive(active);
        copy.setRecorded(recorded);
        copy.setResults(new ArrayList<>(results));
        if (progress != null) {
            copy.setProgress(new ScanProgress(progress.getCurrentIndex(), progress.getTotalCount(),
                    progress.getPermissionSetName(), progress.getMessage(), progress.getCurrentStep(),
                    progress.getProgress()));
        }
        copy.setSummary(summary);
        copy.setError(error);
        return copy;
    }
}
