package io.intellixity.polystore.persistence.translate;

/**
 * Bounded row range for the relational backend. A {@code null} limit is only produced together
 * with a zero offset.
 */
public record RowWindow(int offset, Integer limit) {
  public static final RowWindow UNBOUNDED = new RowWindow(0, null);

  public RowWindow {
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    if (limit != null && limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    if (limit == null && offset > 0) throw new IllegalArgumentException("offset requires a limit");
  }

  public static RowWindow first(int limit) { return new RowWindow(0, limit); }

  public boolean bounded() { return limit != null; }

  /** Inclusive index of the last row in the window, or -1 when unbounded. */
  public int lastIndex() { return (limit == null) ? -1 : offset + limit - 1; }
}
