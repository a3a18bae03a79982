package com.xammer.iamrisk.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One account a user is (or is not) assigned to, with the permission sets granting it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccountAccess {
    private String accountId;
    private String accountName;
    private boolean hasAccess;
    private String accessType;
    private List<PermissionSetDetails> permissionSets;
    private List<String> roles;
    private JsonNode detailedAccess;
}
