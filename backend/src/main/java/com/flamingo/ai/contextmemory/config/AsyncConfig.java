package com.flamingo.ai.contextmemory.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations and scheduled jobs. */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

  /** Fan-out pool for the context read path (search, preferences, linked documents). */
  @Bean(name = "contextAssemblyExecutor")
  public ThreadPoolTaskExecutor contextAssemblyExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("ctx-asm-");
    executor.initialize();
    return executor;
  }

  /**
   * Pool for persisting finished turns. Separate from the request threads so that a cancelled
   * request never cancels a dispatched write.
   */
  @Bean(name = "memoryWriterExecutor")
  public Executor memoryWriterExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("mem-write-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  /** Best-effort access counter updates. */
  @Bean(name = "memoryAccessExecutor")
  public Executor memoryAccessExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(1000);
    executor.setThreadNamePrefix("mem-access-");
    executor.initialize();
    return executor;
  }

  /** Runs provider calls so that callers can bound them with their own timeout. */
  @Bean(name = "embeddingExecutor")
  public Executor embeddingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("embed-");
    executor.initialize();
    return executor;
  }
}
