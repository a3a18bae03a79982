package com.xammer.iamrisk.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AwsRequestCredentials {
    private String accessKeyId;
    @ToString.Exclude
    private String secretAccessKey;
    @ToString.Exclude
    private String sessionToken;
}
