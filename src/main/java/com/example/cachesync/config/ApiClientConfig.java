package com.example.cachesync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Slf4j
@Configuration
public class ApiClientConfig {

    @Bean
    @Qualifier("enrichmentRestTemplate")
    public RestTemplate enrichmentRestTemplate(RestTemplateBuilder builder,
                                               @Value("${cache-sync.api.base-url}") String baseUrl,
                                               @Value("${cache-sync.api.connect-timeout:5s}") Duration connectTimeout,
                                               @Value("${cache-sync.api.read-timeout:10s}") Duration readTimeout) {
        log.info("Initializing enrichmentRestTemplate for {} (connect {}, read {})", baseUrl, connectTimeout, readTimeout);
        return builder
                .rootUri(baseUrl)
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .additionalInterceptors((request, body, execution) -> {
                    log.debug("Enrichment API request: {} {}", request.getMethod(), request.getURI());
                    var response = execution.execute(request, body);
                    log.debug("Enrichment API response status: {}", response.getStatusCode());
                    return response;
                })
                .build();
    }
}
