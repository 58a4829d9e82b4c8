package com.monthledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * One scheduler thread carries every remote call: debounced writes, flushes and the periodic
 * connectivity check.
 */
@Configuration
public class SyncSchedulingConfig {
  @Bean
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("ledger-sync-");
    scheduler.setDaemon(true);
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }
}
