package com.humasol.followup.application.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FollowupProperties.class)
public class FollowupConfig {

    // "today" for every follow-up decision is the calendar day in the configured zone
    @Bean
    public Clock clock(FollowupProperties properties) {
        return Clock.system(ZoneId.of(properties.notification().timezone()));
    }
}
