package com.altivion.api.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AppConfig {
  public static final String INGEST_EXECUTOR = "ingestExecutor";

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // Store writes run here so servlet threads are released while PostgreSQL commits.
  @Bean(name = INGEST_EXECUTOR)
  public ThreadPoolTaskExecutor ingestExecutor(AltivionProperties properties) {
    AltivionProperties.Ingest ingest = properties.getIngest();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(ingest.getCorePoolSize());
    executor.setMaxPoolSize(Math.max(ingest.getCorePoolSize(), ingest.getMaxPoolSize()));
    executor.setQueueCapacity(ingest.getQueueCapacity());
    executor.setThreadNamePrefix("ingest-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
