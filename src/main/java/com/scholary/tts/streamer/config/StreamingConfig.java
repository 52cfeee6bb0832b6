package com.scholary.tts.streamer.config;

import com.scholary.tts.streamer.cache.InMemoryResultCache;
import com.scholary.tts.streamer.cache.ResultCache;
import com.scholary.tts.streamer.device.DeviceLockRegistry;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the shared server-side state: one device lock registry and one result cache per process.
 *
 * <p>Both are plain objects constructed here once and injected into every handler that needs them.
 */
@Configuration
@EnableConfigurationProperties(StreamingProperties.class)
public class StreamingConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public DeviceLockRegistry deviceLockRegistry(StreamingProperties properties) {
    return new DeviceLockRegistry(properties.deviceCount());
  }

  @Bean
  public ResultCache resultCache(StreamingProperties properties, Clock clock) {
    return new InMemoryResultCache(
        properties.cache().maxEntries(), properties.cache().ttl(), clock);
  }
}
