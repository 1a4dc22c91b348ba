package com.scholary.transcriber.chunk;

import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.config.TranscriptionProperties.IngestProperties;
import com.scholary.transcriber.exception.ValidationException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Checks an upload before anything is written.
 *
 * <p>Session ids end up in object keys, so they are restricted to a path-safe alphabet.
 */
@Component
public class ChunkValidator {

  private static final Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

  private final IngestProperties properties;
  private final Set<String> allowedExtensions;

  public ChunkValidator(TranscriptionProperties properties) {
    this.properties = properties.ingest();
    this.allowedExtensions =
        this.properties.allowedExtensions().stream()
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
  }

  /**
   * Validate the upload.
   *
   * @return the normalized (lowercase) file extension
   * @throws ValidationException on the first violated rule
   */
  public String validate(ChunkUpload upload) {
    validateSessionId(upload.sessionId());
    if (upload.sequenceIndex() < 0) {
      throw new ValidationException("sequenceIndex", "sequenceIndex must be >= 0");
    }
    if (upload.sequenceIndex() > properties.maxSequenceIndex()) {
      throw new ValidationException(
          "sequenceIndex", "sequenceIndex must be <= " + properties.maxSequenceIndex());
    }
    if (upload.overlapSeconds() < 0 || Double.isNaN(upload.overlapSeconds())) {
      throw new ValidationException("overlapSeconds", "overlapSeconds must be >= 0");
    }
    if (upload.totalChunks() != null && upload.totalChunks() < 1) {
      throw new ValidationException("totalChunks", "totalChunks must be >= 1");
    }
    if (upload.totalChunks() != null && upload.totalChunks() > properties.maxSequenceIndex() + 1) {
      throw new ValidationException(
          "totalChunks", "totalChunks must be <= " + (properties.maxSequenceIndex() + 1));
    }
    if (upload.data() == null || upload.data().length == 0) {
      throw new ValidationException("file", "File is empty");
    }
    if (upload.data().length > properties.maxFileSizeBytes()) {
      throw new ValidationException(
          "file",
          String.format(
              "File too large: %d bytes, limit is %d bytes",
              upload.data().length, properties.maxFileSizeBytes()));
    }
    return validateExtension(upload.fileName());
  }

  public void validateSessionId(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      throw new ValidationException("sessionId", "sessionId must not be blank");
    }
    if (!SESSION_ID.matcher(sessionId).matches()) {
      throw new ValidationException("sessionId", "sessionId contains unsupported characters");
    }
  }

  private String validateExtension(String fileName) {
    int dot = fileName == null ? -1 : fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      throw new ValidationException("file", "File name has no extension");
    }
    String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    if (!allowedExtensions.contains(extension)) {
      throw new ValidationException(
          "file",
          "Unsupported file type ." + extension + ", allowed: " + properties.allowedExtensions());
    }
    return extension;
  }
}
