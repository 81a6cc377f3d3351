package com.formproxy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FormProxyApplication {
    public static void main(String[] args) {
        SpringApplication.run(FormProxyApplication.class, args);
    }
}
