package io.intellixity.keyset.page;

import io.intellixity.keyset.error.InvalidPageRequestException;

import java.util.Optional;

/**
 * One page worth of request parameters.
 *
 * @param limit maximum number of items on the page, must be positive
 * @param after cursor returned by the previous page, or null for the first page
 * @param direction sort direction of the identifier field
 */
public record PageRequest(int limit, Cursor after, SortDirection direction) {
  public static final int DEFAULT_LIMIT = 10;

  public PageRequest {
    if (limit <= 0) throw new InvalidPageRequestException("limit must be > 0 but was " + limit);
    direction = (direction == null) ? SortDirection.DESC : direction;
  }

  public static PageRequest first(int limit) {
    return new PageRequest(limit, null, SortDirection.DESC);
  }

  public static PageRequest first(int limit, SortDirection direction) {
    return new PageRequest(limit, null, direction);
  }

  public static PageRequest ofDefaults() {
    return first(DEFAULT_LIMIT);
  }

  public Optional<Cursor> cursor() { return Optional.ofNullable(after); }

  /** Same limit and direction, positioned after {@code next}. */
  public PageRequest after(Cursor next) { return new PageRequest(limit, next, direction); }
}
