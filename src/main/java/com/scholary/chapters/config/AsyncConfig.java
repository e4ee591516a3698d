package com.scholary.chapters.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the job worker pool.
 *
 * <p>Sets up a bounded thread pool that runs concatenation jobs. The pool size
 * ({@code MAX_CONCURRENT_JOBS}) and backlog are configurable to control how many ffmpeg processes
 * run at once.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "jobExecutor")
  public ThreadPoolTaskExecutor jobExecutor(MergerProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.maxConcurrentJobs());
    executor.setMaxPoolSize(properties.maxConcurrentJobs());
    executor.setQueueCapacity(properties.jobQueueCapacity());
    executor.setThreadNamePrefix("merge-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
