package com.flamingo.dozor.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

/** Configuration for concurrent sub-wedge dispatch. */
@Configuration
public class AsyncConfig {

  /** One thread per sub-wedge; concurrency is bounded by the number of sub-wedges submitted. */
  @Bean(name = "subWedgeExecutor")
  public Executor subWedgeExecutor() {
    SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("subwedge-");
    executor.setConcurrencyLimit(SimpleAsyncTaskExecutor.UNBOUNDED_CONCURRENCY);
    return executor;
  }
}
