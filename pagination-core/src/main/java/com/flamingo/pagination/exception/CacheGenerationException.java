package com.flamingo.pagination.exception;

/**
 * Thrown when the flow block cache is used outside the begin/commit protocol: a lookup or store
 * with no open generation, a nested {@code begin()}, or a commit with a stale token.
 */
public class CacheGenerationException extends IllegalStateException {

  private final String userMessage;

  public CacheGenerationException(String message) {
    super(message);
    this.userMessage = "Layout cache was used outside a layout pass";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
