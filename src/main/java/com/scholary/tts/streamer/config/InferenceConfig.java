package com.scholary.tts.streamer.config;

import com.scholary.tts.streamer.engine.InferenceProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the inference server client.
 *
 * <p>Enables the InferenceProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(InferenceProperties.class)
public class InferenceConfig {}
