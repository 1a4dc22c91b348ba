package com.scholary.transcriber.whisper;

/**
 * Interface for transcription services.
 *
 * <p>This abstraction allows us to swap transcription providers without changing the worker pool.
 */
public interface WhisperService {

  /**
   * Transcribe one audio chunk. Makes a single attempt; never throws for provider failures.
   *
   * @param clip the audio to transcribe
   * @return the response, or the classified failure
   */
  WhisperOutcome transcribe(AudioClip clip);
}
