package io.intellixity.polystore.persistence.config;

import io.intellixity.polystore.persistence.exceptions.ConfigurationException;
import io.intellixity.polystore.persistence.exec.Backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable process-wide persistence settings: the backend selector plus the endpoint and
 * credential settings of each backend. Only the settings of the selected backend are required.
 */
public record PersistenceSettings(Backend backend,
                                  String mongoUrl,
                                  String mongoDatabase,
                                  String jdbcUrl,
                                  String jdbcUsername,
                                  String jdbcPassword,
                                  String jdbcSchema,
                                  String jdbcDialect) {

  public static final String ENV_BACKEND = "DATABASE_TYPE";
  public static final String ENV_MONGO_URL = "MONGO_URL";
  public static final String ENV_MONGO_DATABASE = "DB_NAME";
  public static final String ENV_JDBC_URL = "JDBC_URL";
  public static final String ENV_JDBC_USERNAME = "JDBC_USERNAME";
  public static final String ENV_JDBC_PASSWORD = "JDBC_PASSWORD";
  public static final String ENV_JDBC_SCHEMA = "JDBC_SCHEMA";
  public static final String ENV_JDBC_DIALECT = "JDBC_DIALECT";

  public PersistenceSettings {
    Objects.requireNonNull(backend, "backend");
    mongoUrl = blankToNull(mongoUrl);
    mongoDatabase = blankToNull(mongoDatabase);
    jdbcUrl = blankToNull(jdbcUrl);
    jdbcUsername = blankToNull(jdbcUsername);
    jdbcPassword = blankToNull(jdbcPassword);
    jdbcSchema = blankToNull(jdbcSchema);
    jdbcDialect = blankToNull(jdbcDialect);
  }

  public static Builder builder(Backend backend) {
    return new Builder(backend);
  }

  /** Reads settings from environment-style variables ({@value #ENV_BACKEND}, {@value #ENV_MONGO_URL}, ...). */
  public static PersistenceSettings fromEnvironment(Map<String, String> env) {
    Map<String, String> e = (env == null) ? Map.of() : env;
    return builder(Backend.parse(e.get(ENV_BACKEND)))
        .mongoUrl(e.get(ENV_MONGO_URL))
        .mongoDatabase(e.get(ENV_MONGO_DATABASE))
        .jdbcUrl(e.get(ENV_JDBC_URL))
        .jdbcUsername(e.get(ENV_JDBC_USERNAME))
        .jdbcPassword(e.get(ENV_JDBC_PASSWORD))
        .jdbcSchema(e.get(ENV_JDBC_SCHEMA))
        .jdbcDialect(e.get(ENV_JDBC_DIALECT))
        .build();
  }

  /**
   * Checks that every setting the selected backend needs is present.
   *
   * @throws ConfigurationException naming the missing settings
   */
  public PersistenceSettings requireComplete() {
    List<String> missing = new ArrayList<>();
    switch (backend) {
      case MONGO -> {
        if (mongoUrl == null) missing.add("mongo url (" + ENV_MONGO_URL + ")");
        if (mongoDatabase == null) missing.add("mongo database (" + ENV_MONGO_DATABASE + ")");
      }
      case JDBC -> {
        if (jdbcUrl == null) missing.add("jdbc url (" + ENV_JDBC_URL + ")");
      }
    }
    if (!missing.isEmpty()) {
      throw new ConfigurationException("Missing settings for backend " + backend + ": " + String.join(", ", missing));
    }
    return this;
  }

  @Override
  public String toString() {
    // credentials stay out of logs
    return "PersistenceSettings[backend=" + backend
        + ", mongoUrl=" + (mongoUrl == null ? "null" : "<set>")
        + ", mongoDatabase=" + mongoDatabase
        + ", jdbcUrl=" + (jdbcUrl == null ? "null" : "<set>")
        + ", jdbcUsername=" + jdbcUsername
        + ", jdbcSchema=" + jdbcSchema
        + ", jdbcDialect=" + jdbcDialect + "]";
  }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s.trim();
  }

  public static final class Builder {
    private final Backend backend;
    private String mongoUrl;
    private String mongoDatabase;
    private String jdbcUrl;
    private String jdbcUsername;
    private String jdbcPassword;
    private String jdbcSchema;
    private String jdbcDialect;

    private Builder(Backend backend) {
      this.backend = Objects.requireNonNull(backend, "backend");
    }

    public Builder mongoUrl(String v) { this.mongoUrl = v; return this; }
    public Builder mongoDatabase(String v) { this.mongoDatabase = v; return this; }
    public Builder jdbcUrl(String v) { this.jdbcUrl = v; return this; }
    public Builder jdbcUsername(String v) { this.jdbcUsername = v; return this; }
    public Builder jdbcPassword(String v) { this.jdbcPassword = v; return this; }
    public Builder jdbcSchema(String v) { this.jdbcSchema = v; return this; }
    public Builder jdbcDialect(String v) { this.jdbcDialect = v; return this; }

    public PersistenceSettings build() {
      return new PersistenceSettings(backend, mongoUrl, mongoDatabase, jdbcUrl, jdbcUsername, jdbcPassword, jdbcSchema, jdbcDialect);
    }
  }
}
