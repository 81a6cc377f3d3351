package com.formproxy.upstream;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class UpstreamClientConfig {

    @Bean
    public RestTemplate upstreamRestTemplate(RestTemplateBuilder builder, UpstreamProperties properties) {
        RestTemplateBuilder configured = builder;
        if (properties.connectTimeout() != null) {
            configured = configured.setConnectTimeout(properties.connectTimeout());
        }
        if (properties.readTimeout() != null) {
            configured = configured.setReadTimeout(properties.readTimeout());
        }
        return configured.build();
    }
}
