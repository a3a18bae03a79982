package com.xammer.iamrisk.service;

import com.xammer.iamrisk.dto.AwsRequestCredentials;
import org.springframework.stereotype.Service;

/**
 * Opens SSO Admin backed permission set sources for the caller's credentials.
 */
@Service
public class PermissionSetDetailsService {

    private final AwsClientProvider awsClientProvider;

    public PermissionSetDetailsService(AwsClientProvider awsClientProvider) {
        this.awsClientProvider = awsClientProvider;
    }

    public PermissionSetSource open(AwsRequestCredentials credentials, String ssoRegion) {
        return new SsoAdminPermissionSetSource(awsClientProvider.getSsoAdminClient(credentials, ssoRegion));
    }
}
