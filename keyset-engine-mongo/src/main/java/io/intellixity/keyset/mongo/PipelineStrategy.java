package io.intellixity.keyset.mongo;

import io.intellixity.keyset.error.PaginationException;

import java.util.Locale;

/**
 * Shape of the paging stages appended after the caller's prefilter.
 */
public enum PipelineStrategy {
  /**
   * {@code $group} every matching document into one array, then {@code $filter} it by cursor with a
   * limit. Needs MongoDB 5.2+ and is bounded by the 16MB document size.
   */
  GROUP,

  /** {@code $facet} with a {@code $count} branch and a {@code $match}+{@code $limit} branch. */
  FACET;

  public static PipelineStrategy parse(String s) {
    if (s == null || s.isBlank()) return FACET;
    try {
      return PipelineStrategy.valueOf(s.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new PaginationException("Unknown pipeline strategy: " + s, e);
    }
  }
}
