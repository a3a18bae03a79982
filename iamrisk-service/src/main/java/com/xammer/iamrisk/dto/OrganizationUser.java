package com.xammer.iamrisk.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OrganizationUser {
    private IdentityUser user;
    private String homeAccountId;
    private List<AccountAccess> accountAccess;

    public boolean hasAccountAccessData() {
        return accountAccess != null && !accountAccess.isEmpty();
    }

    /**
     * Identity store user, using the identity store's capitalised field names on the wire.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IdentityUser {
        @JsonProperty("UserId")
        @JsonAlias("userId")
        private String userId;

        @JsonProperty("UserName")
        @JsonAlias("userName")
        private String userName;

        @JsonProperty("DisplayName")
        @JsonAlias("displayName")
        private String displayName;
    }
}
