package io.intellixity.keyset.page;

import io.intellixity.keyset.error.InvalidPageRequestException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PageRequestTest {

  @Test
  void defaults() {
    PageRequest r = PageRequest.ofDefaults();
    assertEquals(10, r.limit());
    assertNull(r.after());
    assertEquals(SortDirection.DESC, r.direction());
  }

  @Test
  void nullDirection_isDesc() {
    assertEquals(SortDirection.DESC, new PageRequest(3, null, null).direction());
  }

  @Test
  void nonPositiveLimit_isRejected() {
    assertThrows(InvalidPageRequestException.class, () -> PageRequest.first(0));
    assertThrows(InvalidPageRequestException.class, () -> PageRequest.first(-1));
  }

  @Test
  void after_keepsLimitAndDirection() {
    PageRequest r = PageRequest.first(4, SortDirection.ASC).after(Cursor.of(9));
    assertEquals(4, r.limit());
    assertEquals(SortDirection.ASC, r.direction());
    assertEquals(Cursor.of(9), r.cursor().orElseThrow());
  }

  @Test
  void direction_parse() {
    assertEquals(SortDirection.ASC, SortDirection.parse("asc", SortDirection.DESC));
    assertEquals(SortDirection.DESC, SortDirection.parse("-1", SortDirection.ASC));
    assertEquals(SortDirection.ASC, SortDirection.parse("1", SortDirection.DESC));
    assertEquals(SortDirection.ASC, SortDirection.parse(" ", SortDirection.ASC));
    assertThrows(InvalidPageRequestException.class, () -> SortDirection.parse("up", SortDirection.DESC));
    assertEquals(-1, SortDirection.DESC.sign());
  }
}
