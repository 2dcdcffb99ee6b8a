package com.portfoliosync.infra.kafka.errors;

/** A record whose headers, envelope or identity cannot be trusted. Never retried. */
public class InvalidTaskMetadataException extends RuntimeException {
  public InvalidTaskMetadataException(String message) {
    super(message);
  }

  public InvalidTaskMetadataException(String message, Throwable cause) {
    super(message, cause);
  }
}
