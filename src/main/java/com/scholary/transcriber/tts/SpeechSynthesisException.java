package com.scholary.transcriber.tts;

import com.scholary.transcriber.exception.TranscriberException;

/** Thrown when the text-to-speech provider fails or returns no audio. */
public class SpeechSynthesisException extends TranscriberException {

  public SpeechSynthesisException(String message) {
    super(message);
  }

  public SpeechSynthesisException(String message, Throwable cause) {
    super(message, cause);
  }
}
