package io.intellixity.tabula.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style SPI loader.\n
 *
 * Reads every {@code META-INF/tabula.factories} resource on the classpath. Each resource is a
 * Java Properties file mapping an SPI interface name to implementation class names:\n
 *
 * <pre>
 * io.intellixity.tabula.ddl.DdlDialect=io.intellixity.tabula.ddl.postgres.PostgresDdlDialect
 * </pre>
 *
 * Values may be comma-separated; whitespace is ignored. Implementations need a public no-arg
 * constructor.
 */
public final class TabulaFactoriesLoader {
  public static final String RESOURCE = "META-INF/tabula.factories";

  private static final Logger log = LoggerFactory.getLogger(TabulaFactoriesLoader.class);

  private TabulaFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = TabulaFactoriesLoader.class.getClassLoader();

    List<String> implNames = new ArrayList<>();
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to enumerate " + RESOURCE, e);
    }

    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to load " + RESOURCE + " from " + url, e);
      }
      implNames.addAll(parseNames(p.getProperty(spiType.getName())));
    }

    // de-dupe, keep discovery order
    LinkedHashSet<String> uniq = new LinkedHashSet<>(implNames);
    List<T> out = new ArrayList<>(uniq.size());
    for (String implName : uniq) {
      out.add(newInstance(implName, spiType, cl));
    }
    if (log.isDebugEnabled()) {
      log.debug("tabula.factories spi={} implementations={}", spiType.getName(), uniq);
    }
    return out;
  }

  static List<String> parseNames(String value) {
    if (value == null || value.isBlank()) return List.of();
    List<String> out = new ArrayList<>();
    for (String part : value.split(",")) {
      String name = part.trim();
      if (!name.isEmpty()) out.add(name);
    }
    return out;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Class " + implName + " listed for SPI " + spiType.getName() + " not found", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
