package com.xammer.iamrisk.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A permission set as received from clients or read from the SSO Admin API.
 * All policy fields are optional; an absent list means nothing of that kind is attached.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PermissionSetDetails {
    private String name;
    private String arn;
    private String description;
    private String sessionDuration;
    @Builder.Default
    private List<String> managedPolicies = new ArrayList<>();
    @Builder.Default
    private List<CustomerManagedPolicyReference> customerManagedPolicies = new ArrayList<>();
    private String inlinePolicyDocument;

    /**
     * Accepts a bare permission set ARN where a full object is expected.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PermissionSetDetails fromArn(String arn) {
        PermissionSetDetails details = new PermissionSetDetails();
        details.setArn(arn);
        details.setName(nameFromArn(arn));
        return details;
    }

    public static String nameFromArn(String arn) {
        if (arn == null) {
            return null;
        }
        int slash = arn.lastIndexOf('/');
        return slash >= 0 && slash < arn.length() - 1 ? arn.substring(slash + 1) : arn;
    }

    public boolean hasInlinePolicy() {
        return inlinePolicyDocument != null && !inlinePolicyDocument.isBlank();
    }

    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return arn != null ? arn : "Unknown";
    }
}
