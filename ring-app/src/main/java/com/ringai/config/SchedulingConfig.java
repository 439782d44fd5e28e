package com.ringai.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 会话续期调度器。每个活跃会话在其中挂一个一次性续期任务，会话关闭时取消。
 */
@Slf4j
@Configuration
public class SchedulingConfig {

    @Bean(name = "sessionExtensionScheduler")
    public ThreadPoolTaskScheduler sessionExtensionScheduler(
            @Value("${scheduling.session-extension.pool-size:4}") int poolSize,
            @Value("${scheduling.session-extension.thread-name-prefix:session-extension-}") String threadNamePrefix,
            @Value("${scheduling.session-extension.await-termination-seconds:10}") int awaitTerminationSeconds) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(poolSize, 1));
        scheduler.setThreadNamePrefix(threadNamePrefix);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setAwaitTerminationSeconds(Math.max(awaitTerminationSeconds, 0));
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(throwable ->
                log.error("Session extension task failed. scheduler={}, error={}",
                        threadNamePrefix, throwable.getMessage(), throwable));
        return scheduler;
    }
}
