package io.intellixity.polystore.persistence.translate;

import io.intellixity.polystore.persistence.query.Page;
import io.intellixity.polystore.persistence.query.SortField;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class SortPageTranslatorTest {
  private final SortPageTranslator translator = new SortPageTranslator(IdentifierMapper.relational());

  @Test
  void skipWithoutLimit_usesDefaultBoundAtOffset() {
    RowWindow w = translator.window(Page.skip(10));

    assertEquals(10, w.offset());
    assertEquals(SortPageTranslator.DEFAULT_OFFSET_LIMIT, w.limit());
    assertEquals(1000, w.limit());
    assertEquals(1009, w.lastIndex());
  }

  @Test
  void skipWithLimit_usesBoth() {
    assertEquals(new RowWindow(5, 20), translator.window(new Page(20, 5)));
  }

  @Test
  void limitOnly_startsAtZero() {
    assertEquals(RowWindow.first(3), translator.window(Page.limit(3)));
  }

  @Test
  void noPaging_isUnbounded() {
    assertEquals(RowWindow.UNBOUNDED, translator.window(Page.ALL));
    assertEquals(RowWindow.UNBOUNDED, translator.window(null));
    assertFalse(RowWindow.UNBOUNDED.bounded());
  }

  @Test
  void order_honorsFirstEntryOnly() {
    Optional<OrderBy> o = translator.order(List.of(SortField.desc("createdAt"), SortField.asc("name")));
    assertEquals(Optional.of(new OrderBy("createdAt", true)), o);
  }

  @Test
  void order_mapsCanonicalIdentifier() {
    assertEquals(Optional.of(new OrderBy("id", false)), translator.order(List.of(SortField.asc("_id"))));
  }

  @Test
  void order_emptySort() {
    assertEquals(Optional.empty(), translator.order(List.of()));
    assertEquals(Optional.empty(), translator.order(null));
  }

  @Test
  void rowWindow_offsetRequiresLimit() {
    assertThrows(IllegalArgumentException.class, () -> new RowWindow(10, null));
  }
}
