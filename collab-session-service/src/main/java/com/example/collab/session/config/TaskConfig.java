package com.example.collab.session.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("collab-scheduled-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Runs inbound command processing, which may block on the shared store.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler inboundScheduler() {
        return Schedulers.newBoundedElastic(50, 100000, "collab-inbound");
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler throttleScheduler() {
        return Schedulers.newParallel("collab-throttle", 4);
    }
}
