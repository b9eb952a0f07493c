package com.capgains.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. replay-executor runs one task per symbol; a symbol's own history is never split.
 */
@Configuration
public class AsyncConfig {

    public static final String REPLAY_EXECUTOR = "replay-executor";

    @Bean(name = REPLAY_EXECUTOR)
    public Executor replayExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(4);
        e.setThreadNamePrefix("replay-");
        e.initialize();
        return e;
    }
}
