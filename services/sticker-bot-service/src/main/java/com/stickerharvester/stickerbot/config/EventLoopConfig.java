package com.stickerharvester.stickerbot.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class EventLoopConfig {

  /** Every {@code @Scheduled} tick runs on this one thread. */
  @Bean(name = "taskScheduler")
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("bot-loop-");
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    scheduler.initialize();
    return scheduler;
  }

  @Bean
  public BotEventLoop botEventLoop(@Qualifier("taskScheduler") ThreadPoolTaskScheduler scheduler) {
    return new BotEventLoop(scheduler);
  }

  @Bean(name = "telegramIoExecutor")
  public ThreadPoolTaskExecutor telegramIoExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("telegram-io-");
    executor.initialize();
    return executor;
  }
}
