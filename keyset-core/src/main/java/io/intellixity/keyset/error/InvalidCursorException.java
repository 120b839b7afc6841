package io.intellixity.keyset.error;

/** Raised when a cursor token cannot be decoded into an identifier of the configured type. */
public final class InvalidCursorException extends PaginationException {
  public InvalidCursorException(String message) {
    super(message);
  }

  public InvalidCursorException(String message, Throwable cause) {
    super(message, cause);
  }
}
