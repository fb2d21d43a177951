package com.fieldforce.fieldexecutionbackend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

@Slf4j
@Configuration
public class BackendClientConfig {

    @Bean
    public RestTemplate fieldBackendRestTemplate(RestTemplateBuilder builder, FieldExecutionProperties props) {
        FieldExecutionProperties.Backend backend = props.getBackend();
        log.info("Field backend baseUrl = {}", backend.getBaseUrl());
        if (backend.getApiToken() == null) {
            log.warn("field-execution.backend.api-token is not set, backend calls are unauthenticated");
        }

        RestTemplateBuilder configured = builder
                .setConnectTimeout(backend.getConnectTimeout())
                .setReadTimeout(backend.getReadTimeout())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (backend.getApiToken() != null) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "token " + backend.getApiToken());
        }
        return configured.build();
    }
}
