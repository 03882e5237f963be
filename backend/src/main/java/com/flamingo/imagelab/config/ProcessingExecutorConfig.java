package com.flamingo.imagelab.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the worker pool that runs pixel folds. */
@Configuration
@RequiredArgsConstructor
public class ProcessingExecutorConfig {

  private final ImageLabConfig imageLabConfig;

  /**
   * Bounded pool for CPU-bound batch folds. Request threads hand a fold to this pool and wait on
   * it with the batch timeout.
   */
  @Bean(name = "imageProcessingExecutor")
  public ThreadPoolTaskExecutor imageProcessingExecutor() {
    int threads = imageLabConfig.getProcessing().getWorkerThreads();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(imageLabConfig.getProcessing().getQueueCapacity());
    executor.setThreadNamePrefix("img-proc-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(60);
    executor.initialize();
    return executor;
  }
}
