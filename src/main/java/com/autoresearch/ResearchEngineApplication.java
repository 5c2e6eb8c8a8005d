package com.autoresearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ResearchEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResearchEngineApplication.class, args);
    }
}
