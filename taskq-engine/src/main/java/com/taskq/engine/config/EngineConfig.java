package com.taskq.engine.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(TaskQueueProperties.class)
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
