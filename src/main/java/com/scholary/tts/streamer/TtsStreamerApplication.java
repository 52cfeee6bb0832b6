package com.scholary.tts.streamer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TtsStreamerApplication {

  public static void main(String[] args) {
    SpringApplication.run(TtsStreamerApplication.class, args);
  }
}
