package org.photocollage.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TaskExecutorConfig {

    @Bean(name = "collageFetchExecutor")
    public AsyncTaskExecutor collageFetchExecutor(AppProperties appProperties) {
        int concurrency = Math.max(1, appProperties.getCollage().getFetchConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(Math.max(appProperties.getCollage().getMaxImages(), 1) * 16);
        executor.setThreadNamePrefix("collage-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
