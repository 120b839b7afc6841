package io.intellixity.keyset.error;

/**
 * Root of the unchecked failures raised by the paging layer itself.
 * <p>
 * Failures of the underlying store (connectivity, query errors) are never wrapped in this type;
 * they reach the caller exactly as the driver raised them.
 */
public class PaginationException extends RuntimeException {
  public PaginationException(String message) {
    super(message);
  }

  public PaginationException(String message, Throwable cause) {
    super(message, cause);
  }
}
