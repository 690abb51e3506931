package com.parley.dispatch.platform;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PlatformConfig {

    @Bean
    @ConditionalOnMissingBean(PlatformAdapter.class)
    public PlatformAdapter platformAdapter() {
        return new LoggingPlatformAdapter();
    }
}
