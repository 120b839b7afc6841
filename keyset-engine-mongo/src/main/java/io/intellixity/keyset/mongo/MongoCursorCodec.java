package io.intellixity.keyset.mongo;

import io.intellixity.keyset.error.InvalidCursorException;
import io.intellixity.keyset.page.Cursor;
import org.bson.types.ObjectId;

import java.util.Objects;

/** Converts cursor tokens to and from identifier values of a fixed {@link IdType}. */
public final class MongoCursorCodec {
  private final IdType idType;

  public MongoCursorCodec(IdType idType) {
    this.idType = Objects.requireNonNull(idType, "idType");
  }

  public IdType idType() { return idType; }

  /** Null or blank means "first page" and yields null. Malformed tokens are rejected. */
  public Cursor decode(String token) {
    if (token == null || token.isBlank()) return null;
    String t = token.trim();
    switch (idType) {
      case OBJECT_ID -> {
        if (!ObjectId.isValid(t)) throw new InvalidCursorException("Cursor is not a valid ObjectId: '" + t + "'");
        return Cursor.of(new ObjectId(t));
      }
      case LONG -> {
        try {
          return Cursor.of(Long.parseLong(t));
        } catch (NumberFormatException e) {
          throw new InvalidCursorException("Cursor is not a valid long: '" + t + "'", e);
        }
      }
      case STRING -> {
        return Cursor.of(t);
      }
      default -> throw new IllegalStateException("Unhandled id type: " + idType);
    }
  }

  /** Inverse of {@link #decode(String)}; also checks the key matches the configured type. */
  public String encode(Cursor cursor) {
    if (cursor == null) return null;
    return check(cursor).token();
  }

  /** Rejects a cursor whose key is not of the configured type; null passes through. */
  public Cursor check(Cursor cursor) {
    if (cursor == null) return null;
    Object key = cursor.key();
    boolean ok = switch (idType) {
      case OBJECT_ID -> key instanceof ObjectId;
      case LONG -> key instanceof Long || key instanceof Integer;
      case STRING -> key instanceof String;
    };
    if (!ok) {
      throw new InvalidCursorException("Cursor key of type " + key.getClass().getName() + " does not match " + idType);
    }
    return cursor;
  }
}
