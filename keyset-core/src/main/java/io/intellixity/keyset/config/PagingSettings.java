package io.intellixity.keyset.config;

import io.intellixity.keyset.error.PaginationException;

import java.util.Objects;

/**
 * Paging defaults shared by all paginators built from the same settings.
 *
 * @param defaultLimit limit used when the caller supplies none
 * @param maxLimit upper bound for any requested limit
 * @param idField identifier field the keyset is built on
 * @param strategy backend pipeline shape (engine specific name, e.g. FACET or GROUP for Mongo)
 * @param idType type cursor tokens are decoded into (engine specific name, e.g. OBJECT_ID)
 */
public record PagingSettings(int defaultLimit, int maxLimit, String idField, String strategy, String idType) {
  public static final int DEFAULT_LIMIT = 10;
  public static final int DEFAULT_MAX_LIMIT = 1000;
  public static final String DEFAULT_ID_FIELD = "_id";
  public static final String DEFAULT_STRATEGY = "FACET";
  public static final String DEFAULT_ID_TYPE = "OBJECT_ID";

  public PagingSettings {
    if (defaultLimit <= 0) throw new PaginationException("defaultLimit must be > 0 but was " + defaultLimit);
    if (maxLimit < defaultLimit) {
      throw new PaginationException("maxLimit (" + maxLimit + ") must be >= defaultLimit (" + defaultLimit + ")");
    }
    Objects.requireNonNull(idField, "idField");
    if (idField.isBlank()) throw new PaginationException("idField must not be blank");
    strategy = (strategy == null || strategy.isBlank()) ? DEFAULT_STRATEGY : strategy.trim();
    idType = (idType == null || idType.isBlank()) ? DEFAULT_ID_TYPE : idType.trim();
  }

  public static PagingSettings defaults() {
    return new PagingSettings(DEFAULT_LIMIT, DEFAULT_MAX_LIMIT, DEFAULT_ID_FIELD, DEFAULT_STRATEGY, DEFAULT_ID_TYPE);
  }

  public PagingSettings withIdField(String idField) {
    return new PagingSettings(defaultLimit, maxLimit, idField, strategy, idType);
  }

  public PagingSettings withStrategy(String strategy) {
    return new PagingSettings(defaultLimit, maxLimit, idField, strategy, idType);
  }

  public PagingSettings withIdType(String idType) {
    return new PagingSettings(defaultLimit, maxLimit, idField, strategy, idType);
  }

  public PagingSettings withLimits(int defaultLimit, int maxLimit) {
    return new PagingSettings(defaultLimit, maxLimit, idField, strategy, idType);
  }
}
