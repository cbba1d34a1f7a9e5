package io.intellixity.polystore.persistence.translate;

import io.intellixity.polystore.persistence.query.Page;
import io.intellixity.polystore.persistence.query.SortField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/** Ordering and paging for the relational backend. */
public final class SortPageTranslator {
  private static final Logger log = LoggerFactory.getLogger(SortPageTranslator.class);

  /**
   * Row count used when an offset is requested without a limit. The relational builder cannot
   * skip without a bounded range, so {@code skip=n} alone reads rows {@code n .. n+999}.
   * <p>
   * This is a compatibility default, not a correctness guarantee: callers that need every row past
   * an offset must pass an explicit limit.
   */
  public static final int DEFAULT_OFFSET_LIMIT = 1000;

  private final IdentifierMapper ids;

  public SortPageTranslator(IdentifierMapper ids) {
    this.ids = (ids == null) ? IdentifierMapper.relational() : ids;
  }

  /**
   * The relational backend takes one ordering key per call: only the first entry is used.
   * Further entries are reported at WARN.
   */
  public Optional<OrderBy> order(List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return Optional.empty();
    if (sort.size() > 1) {
      log.warn("polystore.sort single-key backend: honoring '{}', ignoring {}", sort.get(0).field(), sort.subList(1, sort.size()));
    }
    SortField first = sort.get(0);
    return Optional.of(new OrderBy(ids.toNativeField(first.field()), first.descending()));
  }

  public RowWindow window(Page page) {
    if (page == null) return RowWindow.UNBOUNDED;
    if (page.skip() > 0) {
      int limit = page.hasLimit() ? page.limit() : DEFAULT_OFFSET_LIMIT;
      if (!page.hasLimit()) {
        log.debug("polystore.page skip={} without limit: using default limit={}", page.skip(), DEFAULT_OFFSET_LIMIT);
      }
      return new RowWindow(page.skip(), limit);
    }
    return page.hasLimit() ? RowWindow.first(page.limit()) : RowWindow.UNBOUNDED;
  }
}
