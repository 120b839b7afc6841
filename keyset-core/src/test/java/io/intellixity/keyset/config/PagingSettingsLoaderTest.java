package io.intellixity.keyset.config;

import io.intellixity.keyset.error.PaginationException;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class PagingSettingsLoaderTest {

  @Test
  void loadsClasspathResource_keepsDefaultsForMissingKeys() {
    PagingSettings s = PagingSettingsLoader.load();
    assertEquals(25, s.defaultLimit());
    assertEquals(200, s.maxLimit());
    assertEquals("GROUP", s.strategy());
    assertEquals("LONG", s.idType());
    assertEquals("_id", s.idField());
  }

  @Test
  void emptyProperties_areDefaults() {
    assertEquals(PagingSettings.defaults(), PagingSettingsLoader.fromProperties(new Properties()));
  }

  @Test
  void invalidInteger_fails() {
    Properties p = new Properties();
    p.setProperty(PagingSettingsLoader.MAX_LIMIT, "lots");
    PaginationException ex = assertThrows(PaginationException.class, () -> PagingSettingsLoader.fromProperties(p));
    assertTrue(ex.getMessage().contains(PagingSettingsLoader.MAX_LIMIT));
  }

  @Test
  void maxBelowDefault_fails() {
    Properties p = new Properties();
    p.setProperty(PagingSettingsLoader.DEFAULT_LIMIT, "50");
    p.setProperty(PagingSettingsLoader.MAX_LIMIT, "20");
    assertThrows(PaginationException.class, () -> PagingSettingsLoader.fromProperties(p));
  }

  @Test
  void settings_withers() {
    PagingSettings s = PagingSettings.defaults().withIdField("seq").withStrategy(" facet ").withIdType(null);
    assertEquals("seq", s.idField());
    assertEquals("facet", s.strategy());
    assertEquals(PagingSettings.DEFAULT_ID_TYPE, s.idType());
    assertThrows(PaginationException.class, () -> s.withIdField(" "));
  }
}
