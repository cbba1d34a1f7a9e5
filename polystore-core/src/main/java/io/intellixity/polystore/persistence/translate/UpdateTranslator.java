package io.intellixity.polystore.persistence.translate;

import io.intellixity.polystore.persistence.update.UpdateExpression;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Flattens update expressions into a column-update map for the relational backend and stamps
 * server-side timestamps. The stamped value always overwrites whatever the caller supplied.
 */
public final class UpdateTranslator {
  public static final String CREATED_AT = "created_at";
  public static final String UPDATED_AT = "updated_at";

  private final Clock clock;

  public UpdateTranslator(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Map<String, Object> toColumnUpdates(UpdateExpression update) {
    Objects.requireNonNull(update, "update");
    Map<String, Object> out = new LinkedHashMap<>(update.values());
    out.put(UPDATED_AT, now());
    return out;
  }

  /** Row for an insert: the document plus {@value #CREATED_AT} and {@value #UPDATED_AT}. */
  public Map<String, Object> stampInsert(Map<String, ?> document) {
    Map<String, Object> out = new LinkedHashMap<>();
    if (document != null) out.putAll(document);
    OffsetDateTime now = now();
    out.put(CREATED_AT, now);
    out.put(UPDATED_AT, now);
    return out;
  }

  public OffsetDateTime now() {
    return clock.instant().atOffset(ZoneOffset.UTC);
  }
}
