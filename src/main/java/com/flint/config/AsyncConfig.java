package com.flint.config;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executor;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(name = "aggregationExecutor")
  public Executor aggregationExecutor(DashboardProperties properties) {
    int threads = properties.executorThreads() > 0 ? properties.executorThreads() : 8;
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("aggregation-");
    executor.setTaskDecorator(runnable -> {
      Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        if (context != null) {
          MDC.setContextMap(context);
        }
        try {
          runnable.run();
        } finally {
          MDC.clear();
        }
      };
    });
    executor.initialize();
    return executor;
  }
}
