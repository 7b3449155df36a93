package io.b2mash.credits.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class GrantExecutorConfig {

  /**
   * Bounded pool for ledger grant calls. Core and max size are equal so concurrency towards the
   * ledger never exceeds {@code credits.scheduler.grant-concurrency}; excess grants queue.
   */
  @Bean(name = "creditGrantExecutor")
  public Executor creditGrantExecutor(CreditSchedulerProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.grantConcurrency());
    executor.setMaxPoolSize(properties.grantConcurrency());
    executor.setThreadNamePrefix("credit-grant-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
