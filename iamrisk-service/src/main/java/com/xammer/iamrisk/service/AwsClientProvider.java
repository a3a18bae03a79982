package com.xammer.iamrisk.service;

import com.xammer.iamrisk.dto.AwsRequestCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ssoadmin.SsoAdminClient;

import java.time.Duration;

@Service
public class AwsClientProvider {

    private static final Logger logger = LoggerFactory.getLogger(AwsClientProvider.class);

    @Value("${aws.region:us-east-1}")
    private String defaultRegion;

    @Value("${aws.sso-admin.api-call-timeout-ms:15000}")
    private long apiCallTimeoutMs;

    /**
     * Credentials supplied with the request take precedence; without them the default
     * provider chain of the host is used.
     */
    public AwsCredentialsProvider getCredentialsProvider(AwsRequestCredentials credentials) {
        if (credentials == null || credentials.getAccessKeyId() == null) {
            return DefaultCredentialsProvider.create();
        }
        if (credentials.getSessionToken() != null && !credentials.getSessionToken().isBlank()) {
            return StaticCredentialsProvider.create(AwsSessionCredentials.create(
                    credentials.getAccessKeyId(), credentials.getSecretAccessKey(), credentials.getSessionToken()));
        }
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(
                credentials.getAccessKeyId(), credentials.getSecretAccessKey()));
    }

    public SsoAdminClient getSsoAdminClient(AwsRequestCredentials credentials, String region) {
        String effectiveRegion = region != null && !region.isBlank() ? region : defaultRegion;
        logger.debug("Creating SsoAdminClient in region {}", effectiveRegion);
        return SsoAdminClient.builder()
                .region(Region.of(effectiveRegion))
                .credentialsProvider(getCredentialsProvider(credentials))
                .overrideConfiguration(overrideConfiguration())
                .build();
    }

    /**
     * Bounds every SSO Admin call, retries included, so an abandoned enrichment does not keep
     * its worker thread.
     */
    ClientOverrideConfiguration overrideConfiguration() {
        return ClientOverrideConfiguration.builder()
                .apiCallTimeout(Duration.ofMillis(apiCallTimeoutMs))
                .build();
    }
}
