package com.scholary.transcriber.config;

import com.scholary.transcriber.cache.CacheProperties;
import com.scholary.transcriber.events.NotificationProperties;
import com.scholary.transcriber.tts.SpeechProperties;
import com.scholary.transcriber.whisper.WhisperProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for transcription-related beans.
 *
 * <p>Enables the property records to be loaded from application.yml and provides the clock used
 * for timestamps and age checks.
 */
@Configuration
@EnableConfigurationProperties({
  TranscriptionProperties.class,
  WhisperProperties.class,
  SpeechProperties.class,
  CacheProperties.class,
  NotificationProperties.class
})
public class TranscriptionConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
