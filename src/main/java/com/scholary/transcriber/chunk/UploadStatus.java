package com.scholary.transcriber.chunk;

/** Whether a chunk's audio made it into the object store. */
public enum UploadStatus {
  UPLOADED,
  FAILED
}
