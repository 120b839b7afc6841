package io.intellixity.keyset.config;

import io.intellixity.keyset.error.PaginationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Enumeration;
import java.util.Objects;
import java.util.Properties;

/**
 * Loads {@link PagingSettings} from {@code META-INF/keyset-paging.properties} resources.\n
 *
 * Each resource is a Java Properties file:\n
 *
 * <pre>
 * keyset.paging.default-limit=20
 * keyset.paging.max-limit=500
 * keyset.paging.id-field=_id
 * keyset.paging.strategy=GROUP
 * keyset.paging.id-type=LONG
 * </pre>
 *
 * Resources are applied in classpath order, so later ones override earlier keys. Missing keys keep
 * their defaults.
 */
public final class PagingSettingsLoader {
  private static final Logger log = LoggerFactory.getLogger(PagingSettingsLoader.class);

  public static final String RESOURCE = "META-INF/keyset-paging.properties";

  public static final String DEFAULT_LIMIT = "keyset.paging.default-limit";
  public static final String MAX_LIMIT = "keyset.paging.max-limit";
  public static final String ID_FIELD = "keyset.paging.id-field";
  public static final String STRATEGY = "keyset.paging.strategy";
  public static final String ID_TYPE = "keyset.paging.id-type";

  private PagingSettingsLoader() {}

  public static PagingSettings load() {
    return load(Thread.currentThread().getContextClassLoader());
  }

  public static PagingSettings load(ClassLoader cl) {
    if (cl == null) cl = PagingSettingsLoader.class.getClassLoader();

    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new PaginationException("Failed to enumerate " + RESOURCE, e);
    }

    Properties merged = new Properties();
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new PaginationException("Failed to load " + RESOURCE + " from " + url, e);
      }
      log.debug("keyset.config resource={} keys={}", url, p.size());
      merged.putAll(p);
    }
    return fromProperties(merged);
  }

  public static PagingSettings fromProperties(Properties p) {
    Objects.requireNonNull(p, "properties");
    PagingSettings d = PagingSettings.defaults();
    return new PagingSettings(
        intProp(p, DEFAULT_LIMIT, d.defaultLimit()),
        intProp(p, MAX_LIMIT, d.maxLimit()),
        strProp(p, ID_FIELD, d.idField()),
        strProp(p, STRATEGY, d.strategy()),
        strProp(p, ID_TYPE, d.idType()));
  }

  private static int intProp(Properties p, String key, int fallback) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return fallback;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new PaginationException("Invalid integer for " + key + ": " + v, e);
    }
  }

  private static String strProp(Properties p, String key, String fallback) {
    String v = p.getProperty(key);
    return (v == null || v.isBlank()) ? fallback : v.trim();
  }
}
