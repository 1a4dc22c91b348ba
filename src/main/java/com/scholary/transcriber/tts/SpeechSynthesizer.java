package com.scholary.transcriber.tts;

/** A text-to-speech provider. */
public interface SpeechSynthesizer {

  /**
   * Render {@code text} as audio.
   *
   * @return the encoded audio bytes
   * @throws SpeechSynthesisException if the provider fails
   */
  byte[] synthesize(String text, String voice, String format);
}
