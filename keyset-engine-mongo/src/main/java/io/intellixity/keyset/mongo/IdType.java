package io.intellixity.keyset.mongo;

import io.intellixity.keyset.error.PaginationException;

import java.util.Locale;

/** Java type cursor tokens are decoded into; must match the stored identifier type. */
public enum IdType {
  OBJECT_ID,
  LONG,
  STRING;

  public static IdType parse(String s) {
    if (s == null || s.isBlank()) return OBJECT_ID;
    try {
      return IdType.valueOf(s.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    } catch (IllegalArgumentException e) {
      throw new PaginationException("Unknown id type: " + s, e);
    }
  }
}
