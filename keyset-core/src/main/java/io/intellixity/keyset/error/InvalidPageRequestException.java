package io.intellixity.keyset.error;

public final class InvalidPageRequestException extends PaginationException {
  public InvalidPageRequestException(String message) {
    super(message);
  }
}
