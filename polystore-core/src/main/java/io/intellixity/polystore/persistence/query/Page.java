package io.intellixity.polystore.persistence.query;

/** Optional limit plus offset ({@code skip}). A {@code null} limit means unbounded. */
public record Page(Integer limit, int skip) {
  public static final Page ALL = new Page(null, 0);

  public Page {
    if (limit != null && limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    if (skip < 0) throw new IllegalArgumentException("skip must be >= 0");
  }

  public static Page of(Integer limit, int skip) {
    return (limit == null && skip == 0) ? ALL : new Page(limit, skip);
  }

  public static Page limit(int limit) { return new Page(limit, 0); }

  public static Page skip(int skip) { return of(null, skip); }

  public boolean hasLimit() { return limit != null; }
}
