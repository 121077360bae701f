package com.pipedesk.drive.configuration;

import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.List;

@Configuration
@ConditionalOnProperty(name = "pipedesk.drive.store.mode", havingValue = "remote")
public class FolderStoreRestClientConfig {

    @Bean
    public RestClient folderStoreRestClient(
            @Value("${pipedesk.drive.store.base-url}") String baseUrl,
            @Value("${pipedesk.drive.store.token:}") String token,
            @Value("${pipedesk.drive.store.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${pipedesk.drive.store.read-timeout-ms:15000}") long readTimeoutMs) {
        // every store call is bounded, a hung connection surfaces as a timeout
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(connectTimeoutMs));
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));
        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeaders(headers -> {
                    if (StringUtils.isNotBlank(token)) {
                        headers.setBearerAuth(token);
                    }
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
                })
                .build();
    }
}
