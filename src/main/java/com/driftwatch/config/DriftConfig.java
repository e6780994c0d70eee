package com.driftwatch.config;

import com.driftwatch.service.TokenCounter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(DriftProperties.class)
public class DriftConfig {

    @Bean
    public TokenCounter tokenCounter() {
        return new TokenCounter();
    }
}
