package io.intellixity.polystore.persistence.jdbc;

import io.intellixity.polystore.persistence.exceptions.ConfigurationException;
import org.jooq.SQLDialect;
import org.jooq.tools.jdbc.JDBCUtils;

import java.util.Locale;

/** Picks the jOOQ dialect from an explicit name or, failing that, from the JDBC url. */
public final class JooqDialects {
  private JooqDialects() {}

  public static SQLDialect resolve(String dialect, String jdbcUrl) {
    if (dialect != null && !dialect.isBlank()) {
      try {
        return SQLDialect.valueOf(dialect.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("Unknown SQL dialect: " + dialect, e);
      }
    }
    if (jdbcUrl == null) return SQLDialect.DEFAULT;
    return JDBCUtils.dialect(jdbcUrl);
  }
}
