package io.intellixity.polystore.persistence.query;

import io.intellixity.polystore.persistence.exceptions.TranslationAmbiguityException;
import org.junit.jupiter.api.Test;

import java.util.AbstractMap;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SortFieldTest {

  @Test
  void decode_pairAndBareName() {
    List<SortField> s = SortField.decodeAll(List.of(
        List.of("createdAt", -1),
        "name",
        new Object[]{"age", 1},
        new AbstractMap.SimpleEntry<>("score", -1)
    ));

    assertEquals(List.of(
        SortField.desc("createdAt"),
        SortField.asc("name"),
        SortField.asc("age"),
        SortField.desc("score")
    ), s);
  }

  @Test
  void decode_nullSort_isEmpty() {
    assertEquals(List.of(), SortField.decodeAll(null));
  }

  @Test
  void decode_unknownDirectionCode_isRejected() {
    assertThrows(TranslationAmbiguityException.class, () -> SortField.decode(List.of("name", 2)));
  }

  @Test
  void decode_unknownShape_isRejected() {
    assertThrows(TranslationAmbiguityException.class, () -> SortField.decode(Map.of("name", -1)));
    assertThrows(TranslationAmbiguityException.class, () -> SortField.decode(Arrays.asList("a", "b", "c")));
    assertThrows(TranslationAmbiguityException.class, () -> SortField.decode(42));
  }

  @Test
  void direction_codes() {
    assertEquals(1, SortField.Direction.ASC.code());
    assertEquals(-1, SortField.Direction.DESC.code());
    assertEquals(SortField.Direction.DESC, SortField.Direction.fromCode(-1L));
    assertEquals(SortField.Direction.DESC, SortField.Direction.fromCode("desc"));
  }
}
