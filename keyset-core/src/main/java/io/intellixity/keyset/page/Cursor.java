package io.intellixity.keyset.page;

import java.util.Objects;

/**
 * Keyset position: the identifier of the last item of a previously returned page.\n
 *
 * <p>The key is opaque to the paging layer; it is only compared by the store. Backends decide which
 * key types they accept and how tokens are decoded back into keys.</p>
 */
public record Cursor(Object key) {
  public Cursor {
    Objects.requireNonNull(key, "key");
  }

  public static Cursor of(Object key) {
    return new Cursor(key);
  }

  /** Null-tolerant variant: returns null when {@code key} is null. */
  public static Cursor ofNullable(Object key) {
    return key == null ? null : new Cursor(key);
  }

  /** String form used on the wire (ObjectId hex, decimal numbers, plain strings). */
  public String token() {
    return String.valueOf(key);
  }
}
