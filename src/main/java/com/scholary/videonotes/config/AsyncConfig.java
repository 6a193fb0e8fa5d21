package com.scholary.videonotes.config;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the pipeline's worker pools.
 *
 * <p>Three bounded pools:
 *
 * <ul>
 *   <li>{@code modelExecutor}: chunk-level language model calls, sized by the API concurrency
 *       budget rather than the CPU count
 *   <li>{@code frameExecutor}: per-moment frame decoding, sized by CPU cores
 *   <li>{@code taskExecutor}: async synthesis jobs started through the REST API
 * </ul>
 *
 * <p>Workers inherit the submitting thread's MDC so pool log lines keep the run id.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "modelExecutor")
  public ThreadPoolTaskExecutor modelExecutor(PipelineProperties properties) {
    return boundedExecutor(
        properties.modelConcurrency(), properties.executorQueueSize(), "model-");
  }

  @Bean(name = "frameExecutor")
  public ThreadPoolTaskExecutor frameExecutor(PipelineProperties properties) {
    return boundedExecutor(
        properties.effectiveFrameConcurrency(), properties.executorQueueSize(), "frame-");
  }

  @Bean(name = "taskExecutor")
  public ThreadPoolTaskExecutor taskExecutor(
      @Value("${jobs.executorThreads:2}") int threads,
      @Value("${jobs.executorQueueSize:50}") int queueSize) {
    return boundedExecutor(threads, queueSize, "synthesis-");
  }

  private static ThreadPoolTaskExecutor boundedExecutor(
      int threads, int queueSize, String threadNamePrefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix(threadNamePrefix);
    executor.setTaskDecorator(AsyncConfig::withCallerMdc);
    executor.initialize();
    return executor;
  }

  static Runnable withCallerMdc(Runnable task) {
    Map<String, String> context = MDC.getCopyOfContextMap();
    return () -> {
      Map<String, String> previous = MDC.getCopyOfContextMap();
      if (context != null) {
        MDC.setContextMap(context);
      } else {
        MDC.clear();
      }
      try {
        task.run();
      } finally {
        if (previous != null) {
          MDC.setContextMap(previous);
        } else {
          MDC.clear();
        }
      }
    };
  }
}
