package io.intellixity.keyset.page;

import io.intellixity.keyset.error.InvalidPageRequestException;

import java.util.Locale;

/** Order of the identifier field. DESC returns newest-first for monotonically increasing ids. */
public enum SortDirection {
  ASC(1),
  DESC(-1);

  private final int sign;

  SortDirection(int sign) {
    this.sign = sign;
  }

  /** +1 / -1, as used by sort specifications. */
  public int sign() {
    return sign;
  }

  /**
   * Lenient parse: accepts "asc"/"desc" in any case and "1"/"-1".\n
   * A null or blank value yields {@code fallback}.
   */
  public static SortDirection parse(String s, SortDirection fallback) {
    if (s == null || s.isBlank()) return fallback;
    String v = s.trim().toUpperCase(Locale.ROOT);
    switch (v) {
      case "ASC", "1": return ASC;
      case "DESC", "-1": return DESC;
      default: throw new InvalidPageRequestException("Unknown sort direction: " + s);
    }
  }
}
