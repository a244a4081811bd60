package com.jz.moderation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /** 分析器调用专用池；队列满时直接拒绝，由调用方按失败兜底 */
    @Bean(name = "analyzerExecutor")
    public ThreadPoolTaskExecutor analyzerExecutor(ModerationProperties props) {
        ModerationProperties.Executor cfg = props.getExecutor();
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(cfg.getCorePoolSize());
        ex.setMaxPoolSize(cfg.getMaxPoolSize());
        ex.setQueueCapacity(cfg.getQueueCapacity());
        ex.setKeepAliveSeconds(60);
        ex.setThreadNamePrefix(cfg.getThreadNamePrefix());
        ex.setAwaitTerminationSeconds(10);
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }
}
