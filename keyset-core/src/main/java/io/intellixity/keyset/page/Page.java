package io.intellixity.keyset.page;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * One page of a keyset-paginated result.
 *
 * @param items page items in sort order
 * @param total number of items matching the prefilter, independent of cursor and limit
 * @param nextCursor identifier of the last item, null when {@code items} is empty
 */
@JsonSerialize(using = PageJsonSerializer.class)
public record Page<T>(List<T> items, long total, Cursor nextCursor) {
  public Page {
    items = (items == null) ? List.of() : List.copyOf(items);
    if (total < 0) throw new IllegalArgumentException("total must be >= 0");
    if (items.isEmpty() && nextCursor != null) {
      throw new IllegalArgumentException("nextCursor must be absent on an empty page");
    }
    if (!items.isEmpty() && nextCursor == null) {
      throw new IllegalArgumentException("nextCursor is required on a non-empty page");
    }
  }

  public static <T> Page<T> empty() {
    return new Page<>(List.of(), 0, null);
  }

  public boolean hasNext() { return nextCursor != null; }

  public Optional<Cursor> next() { return Optional.ofNullable(nextCursor); }

  public int size() { return items.size(); }

  public <R> Page<R> map(Function<? super T, ? extends R> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    List<R> out = new ArrayList<>(items.size());
    for (T t : items) out.add(mapper.apply(t));
    return new Page<>(out, total, nextCursor);
  }
}
