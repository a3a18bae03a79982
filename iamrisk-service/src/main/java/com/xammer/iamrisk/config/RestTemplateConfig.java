package com.xammer.iamrisk.config;

import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class RestTemplateConfig {

    @Value("${risk.stream-client.read-timeout-ms:1800000}")
    private int readTimeoutMs;

    /**
     * Unbuffered so that scan streams can be read while they are still being written.
     */
    @Bean
    public RestTemplate riskStreamRestTemplate() {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setMaxConnTotal(20)
                .setMaxConnPerRoute(5)
                .build();

        HttpComponentsClientHttpRequestFactory factory = new HttpComponentsClientHttpRequestFactory(httpClient);
        factory.setConnectTimeout(30000);
        factory.setReadTimeout(readTimeoutMs);
        factory.setBufferRequestBody(false);
        return new RestTemplate(factory);
    }
}
