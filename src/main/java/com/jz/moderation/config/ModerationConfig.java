package com.jz.moderation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class ModerationConfig {

    @Bean
    public ModerationSettingsHolder moderationSettingsHolder(ModerationProperties props) {
        ModerationSettings initial = ModerationSettings.fromProperties(props);
        log.info("Moderation settings loaded: defaultContext={}, contexts={}, disabledComponents={}, stageTimeoutMs={}, queueTimeoutMs={}",
                initial.getPolicies().getDefaultContext(),
                initial.getPolicies().getPolicies().keySet(),
                initial.getDefaultComponents().disabledToggles(),
                initial.getStageTimeout().toMillis(),
                initial.getQueueTimeout().toMillis());
        return new ModerationSettingsHolder(initial);
    }

    @Bean
    public Clock moderationClock() {
        return Clock.systemUTC();
    }
}
