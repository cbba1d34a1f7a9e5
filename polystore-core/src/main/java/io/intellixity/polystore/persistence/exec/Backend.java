package io.intellixity.polystore.persistence.exec;

import io.intellixity.polystore.persistence.exceptions.ConfigurationException;

import java.util.Locale;

/** Backend selector. Chosen once at process start and fixed for the lifetime of a store. */
public enum Backend {
  /** Schemaless document store (MongoDB). */
  MONGO,
  /** Relational store reached through a table/row query builder. */
  JDBC;

  /**
   * Parses a backend-selection setting. Accepts the enum names and the aliases used by older
   * deployments ({@code mongodb}, {@code supabase}, {@code postgres}, {@code sql}).
   * A blank value selects {@link #MONGO}.
   */
  public static Backend parse(String value) {
    if (value == null || value.isBlank()) return MONGO;
    String v = value.trim().toLowerCase(Locale.ROOT);
    return switch (v) {
      case "mongo", "mongodb" -> MONGO;
      case "jdbc", "sql", "postgres", "postgresql", "supabase" -> JDBC;
      default -> throw new ConfigurationException("Unknown backend '" + value + "' (expected mongo or jdbc)");
    };
  }
}
