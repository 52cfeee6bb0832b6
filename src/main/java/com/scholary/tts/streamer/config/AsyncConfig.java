package com.scholary.tts.streamer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Configuration for streaming response execution.
 *
 * <p>Every streaming response body runs on one worker from this bounded pool for the whole length
 * of its generation, so the pool size caps how many requests can be generating or queued on a
 * device lock at once.
 */
@Configuration
public class AsyncConfig implements WebMvcConfigurer {

  private final StreamingProperties properties;

  public AsyncConfig(StreamingProperties properties) {
    this.properties = properties;
  }

  @Bean(name = "streamingExecutor")
  public ThreadPoolTaskExecutor streamingExecutor() {
    StreamingProperties.AsyncProperties async = properties.async();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(async.executorThreads());
    executor.setMaxPoolSize(async.executorThreads());
    executor.setQueueCapacity(async.queueSize());
    executor.setThreadNamePrefix("tts-stream-");
    executor.initialize();
    return executor;
  }

  @Override
  public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
    configurer.setTaskExecutor(streamingExecutor());
    configurer.setDefaultTimeout(properties.async().timeout().toMillis());
  }
}
