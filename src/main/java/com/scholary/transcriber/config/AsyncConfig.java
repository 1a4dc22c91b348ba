package com.scholary.transcriber.config;

import com.scholary.transcriber.events.NotificationProperties;
import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for background execution.
 *
 * <p>Bounded pools for the transcription workers and for event delivery, plus a single maintenance
 * thread for cache cleanup. The maintenance queue holds one task; a cleanup requested while another
 * is pending is rejected.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "transcriptionExecutor")
  public Executor transcriptionExecutor(TranscriptionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workers().threads());
    executor.setMaxPoolSize(properties.workers().threads());
    executor.setQueueCapacity(properties.workers().queueCapacity());
    executor.setThreadNamePrefix("transcription-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  @Bean(name = "notificationExecutor")
  public Executor notificationExecutor(NotificationProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.threads());
    executor.setMaxPoolSize(properties.threads());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix("notify-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "maintenanceExecutor")
  public Executor maintenanceExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(1);
    executor.setThreadNamePrefix("maintenance-");
    executor.initialize();
    return executor;
  }
}
