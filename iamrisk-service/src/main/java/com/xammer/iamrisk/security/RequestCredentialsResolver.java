package com.xammer.iamrisk.security;

import com.xammer.iamrisk.dto.AwsRequestCredentials;
import com.xammer.iamrisk.exception.MissingAwsCredentialsException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads caller-supplied AWS credentials from request headers.
 */
@Component
public class RequestCredentialsResolver {

    public static final String ACCESS_KEY_ID_HEADER = "x-aws-access-key-id";
    public static final String SECRET_ACCESS_KEY_HEADER = "x-aws-secret-access-key";
    public static final String SESSION_TOKEN_HEADER = "x-aws-session-token";

    public Optional<AwsRequestCredentials> resolve(HttpHeaders headers) {
        String accessKeyId = headers.getFirst(ACCESS_KEY_ID_HEADER);
        String secretAccessKey = headers.getFirst(SECRET_ACCESS_KEY_HEADER);
        if (isBlank(accessKeyId) || isBlank(secretAccessKey)) {
            return Optional.empty();
        }
        String sessionToken = headers.getFirst(SESSION_TOKEN_HEADER);
        return Optional.of(new AwsRequestCredentials(accessKeyId, secretAccessKey,
                isBlank(sessionToken) ? null : sessionToken));
    }

    public AwsRequestCredentials require(HttpHeaders headers) {
        return resolve(headers).orElseThrow(() -> new MissingAwsCredentialsException(
                "AWS credentials are required. Please configure your credentials."));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
