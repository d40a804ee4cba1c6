package io.intellixity.tabula.ddl;

import io.intellixity.tabula.util.TabulaFactoriesLoader;

import java.util.*;

/**
 * Dialect registry built via discovery (META-INF/tabula.factories).\n
 *
 * Ids are matched case-insensitively; the first registered dialect for an id wins.
 */
public final class DdlDialects {
  private final Map<String, DdlDialect> byId;

  public DdlDialects() {
    this(TabulaFactoriesLoader.load(DdlDialect.class));
  }

  public DdlDialects(List<DdlDialect> dialects) {
    Map<String, DdlDialect> m = new LinkedHashMap<>();
    for (DdlDialect d : dialects) {
      if (d == null) continue;
      m.putIfAbsent(normalize(d.id()), d);
    }
    this.byId = Collections.unmodifiableMap(m);
  }

  public Set<String> ids() {
    return byId.keySet();
  }

  public Optional<DdlDialect> find(String id) {
    return Optional.ofNullable(byId.get(normalize(id)));
  }

  public DdlDialect forId(String id) {
    DdlDialect d = byId.get(normalize(id));
    if (d == null) throw new IllegalArgumentException("Unknown DDL dialect '" + id + "'; available: " + byId.keySet());
    return d;
  }

  private static String normalize(String id) {
    return id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
  }
}
