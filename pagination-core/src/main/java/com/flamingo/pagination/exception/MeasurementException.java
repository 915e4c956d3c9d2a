package com.flamingo.pagination.exception;

/** Exception thrown when the measurement port fails for a block. */
public class MeasurementException extends RuntimeException {

  private final String blockId;
  private final String userMessage;

  public MeasurementException(String blockId, String message) {
    super(message);
    this.blockId = blockId;
    this.userMessage = "Failed to measure document content";
  }

  public MeasurementException(String blockId, String message, Throwable cause) {
    super(message, cause);
    this.blockId = blockId;
    this.userMessage = "Failed to measure document content";
  }

  public String getBlockId() {
    return blockId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
