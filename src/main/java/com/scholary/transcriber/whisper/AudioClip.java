package com.scholary.transcriber.whisper;

/**
 * Audio handed to the speech-to-text provider.
 *
 * @param data raw audio bytes
 * @param fileName file name sent in the multipart part; the provider infers the codec from it
 * @param contentType MIME type of the audio
 */
public record AudioClip(byte[] data, String fileName, String contentType) {}
