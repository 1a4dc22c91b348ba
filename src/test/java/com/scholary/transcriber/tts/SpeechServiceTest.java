package com.scholary.transcriber.tts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.transcriber.cache.ContentAddressedCache;
import com.scholary.transcriber.exception.ValidationException;
import com.scholary.transcriber.objectstore.LocalObjectStoreClient;
import com.scholary.transcriber.testutil.MutableClock;
import com.scholary.transcriber.testutil.TestProperties;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SpeechServiceTest {

  @TempDir Path tempDir;

  private SpeechSynthesizer synthesizer;
  private ContentAddressedCache cache;
  private SpeechService service;

  @BeforeEach
  void setUp() {
    synthesizer = mock(SpeechSynthesizer.class);
    when(synthesizer.synthesize(anyString(), anyString(), anyString()))
        .thenReturn(new byte[] {1, 2, 3});
    cache =
        new ContentAddressedCache(
            new LocalObjectStoreClient(tempDir.toString()),
            TestProperties.cache(10_000),
            new MutableClock(Instant.parse("2024-05-01T00:00:00Z")));
    SpeechProperties properties =
        new SpeechProperties(
            "http://localhost:9999", null, "playai-tts", "Fritz-PlayAI", "wav", 5, 30, 100);
    service = new SpeechService(synthesizer, cache, properties);
  }

  @Test
  void synthesize_callsProviderOnceForRepeatedText() {
    SpeechResult first = service.synthesize("Tell me about yourself.", null, null);
    SpeechResult second = service.synthesize("Tell me about yourself.", null, null);

    verify(synthesizer, times(1)).synthesize("Tell me about yourself.", "Fritz-PlayAI", "wav");
    assertThat(first.cached()).isFalse();
    assertThat(second.cached()).isTrue();
    assertThat(second.key()).isEqualTo(first.key());
    assertThat(second.fileUrl()).isEqualTo("/api/v1/cache/" + first.key());
    assertThat(second.contentType()).isEqualTo("audio/wav");
    assertThat(second.sizeBytes()).isEqualTo(3);
    assertThat(cache.read(first.key()).data()).containsExactly(1, 2, 3);
  }

  @Test
  void synthesize_differentVoiceIsSeparateEntry() {
    SpeechResult fritz = service.synthesize("Hello", null, null);
    SpeechResult other = service.synthesize("Hello", "Arista-PlayAI", "mp3");

    assertThat(other.key()).isNotEqualTo(fritz.key());
    assertThat(other.cached()).isFalse();
    assertThat(other.contentType()).isEqualTo("audio/mpeg");
  }

  @Test
  void synthesize_rejectsBlankText() {
    assertThatThrownBy(() -> service.synthesize("  ", null, null))
        .isInstanceOf(ValidationException.class);
    verifyNoInteractions(synthesizer);
  }

  @Test
  void synthesize_rejectsOverlongText() {
    assertThatThrownBy(() -> service.synthesize("x".repeat(101), null, null))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("100");
  }

  @Test
  void synthesize_rejectsUnknownFormat() {
    assertThatThrownBy(() -> service.synthesize("Hello", null, "aiff"))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("aiff");
  }

  @Test
  void synthesize_providerFailureIsNotCached() {
    when(synthesizer.synthesize(anyString(), anyString(), anyString()))
        .thenThrow(new SpeechSynthesisException("provider down"))
        .thenReturn(new byte[] {9});

    assertThatThrownBy(() -> service.synthesize("Hello", null, null))
        .isInstanceOf(SpeechSynthesisException.class);
    SpeechResult retry = service.synthesize("Hello", null, null);

    assertThat(retry.cached()).isFalse();
    assertThat(retry.sizeBytes()).isEqualTo(1);
  }

  @Test
  void estimateDurationSeconds_usesSpeakingRateWithFloor() {
    assertThat(SpeechService.estimateDurationSeconds("one")).isEqualTo(1.0);
    assertThat(SpeechService.estimateDurationSeconds("word ".repeat(150))).isEqualTo(60.0);
  }
}
