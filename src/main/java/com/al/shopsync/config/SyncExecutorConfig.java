package com.al.shopsync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools of the service.
 *
 * <ul>
 * <li>{@code taskExecutor}: {@code @Async} work such as audit logging</li>
 * <li>{@code syncJobExecutor}: background sync-all jobs</li>
 * <li>{@code syncItemExecutor}: items of one orchestrator call</li>
 * </ul>
 */
@Configuration
@Slf4j
public class SyncExecutorConfig {

    @Bean
    public ThreadPoolTaskExecutor taskExecutor() {
        return pool("async-", 2, 4);
    }

    @Bean
    public ThreadPoolTaskExecutor syncJobExecutor(ShopSyncProperties properties) {
        int size = Math.max(1, properties.getSync().getJobConcurrency());
        ThreadPoolTaskExecutor executor = pool("sync-job-", size, size);
        executor.setQueueCapacity(Math.max(0, properties.getSync().getJobQueueCapacity()));
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor syncItemExecutor(ShopSyncProperties properties) {
        int size = Math.max(1, properties.getSync().getItemConcurrency());
        log.info("Sync items processed with {} thread(s)", size);
        return pool("sync-item-", size, size);
    }

    private ThreadPoolTaskExecutor pool(String prefix, int coreSize, int maxSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
