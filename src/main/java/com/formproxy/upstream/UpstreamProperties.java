package com.formproxy.upstream;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "upstream")
public record UpstreamProperties(String baseUrl,
                                 String bearerToken,
                                 Duration connectTimeout,
                                 Duration readTimeout) {}
