package com.flamingo.pagination.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for measuring independent blocks concurrently. */
@Configuration
public class AsyncConfig {

  @Bean(name = "measurementExecutor")
  public Executor measurementExecutor(PaginationConfig paginationConfig) {
    int parallelism = Math.max(1, paginationConfig.getMeasurement().getParallelism());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(parallelism);
    executor.setMaxPoolSize(parallelism);
    executor.setThreadNamePrefix("measure-");
    executor.initialize();
    return executor;
  }
}
