package io.intellixity.polystore.examples.config;

import io.intellixity.polystore.persistence.config.PersistenceSettings;
import io.intellixity.polystore.persistence.exec.Backend;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "polystore")
public class PolystoreProperties {
  /** mongo | jdbc (aliases: mongodb, sql, postgres, postgresql, supabase). */
  private String backend = "mongo";
  private final Mongo mongo = new Mongo();
  private final Jdbc jdbc = new Jdbc();

  public String getBackend() { return backend; }
  public void setBackend(String backend) { this.backend = backend; }
  public Mongo getMongo() { return mongo; }
  public Jdbc getJdbc() { return jdbc; }

  public PersistenceSettings toSettings() {
    return PersistenceSettings.builder(Backend.parse(backend))
        .mongoUrl(mongo.getUrl())
        .mongoDatabase(mongo.getDatabase())
        .jdbcUrl(jdbc.getUrl())
        .jdbcUsername(jdbc.getUsername())
        .jdbcPassword(jdbc.getPassword())
        .jdbcSchema(jdbc.getSchema())
        .jdbcDialect(jdbc.getDialect())
        .build();
  }

  public static class Mongo {
    private String url;
    private String database;

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
  }

  public static class Jdbc {
    private String url;
    private String username;
    private String password;
    private String schema;

    /** jOOQ dialect name; sniffed from the url when absent. */
    private String dialect;
    private int maxPoolSize = 10;

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public String getDialect() { return dialect; }
    public void setDialect(String dialect) { this.dialect = dialect; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
  }
}
