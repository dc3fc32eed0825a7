package com.ospicorp.metricsapi.config;

import java.time.Clock;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class IngestionConfig {

  /**
   * Runs batch flushes for metric imports. Each import chains its own flushes, so concurrent
   * imports share the pool while every single import stays sequential.
   */
  @Bean(name = "metricWriterExecutor")
  ThreadPoolTaskExecutor metricWriterExecutor(
      @Value("${metrics.import.writer-threads:2}") int writerThreads) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(writerThreads);
    executor.setMaxPoolSize(writerThreads);
    executor.setThreadNamePrefix("metric-writer-");
    executor.setTaskDecorator(copyLoggingContext());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }

  @Bean
  Clock clock() {
    return Clock.systemDefaultZone();
  }

  private static TaskDecorator copyLoggingContext() {
    return task -> {
      Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        if (context != null) {
          MDC.setContextMap(context);
        }
        try {
          task.run();
        } finally {
          MDC.clear();
        }
      };
    };
  }
}
