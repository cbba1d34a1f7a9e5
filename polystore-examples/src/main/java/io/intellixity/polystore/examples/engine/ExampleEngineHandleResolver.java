package io.intellixity.polystore.examples.engine;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.polystore.persistence.config.PersistenceSettings;
import io.intellixity.polystore.persistence.exec.Backend;
import io.intellixity.polystore.persistence.exec.handle.EngineHandle;
import io.intellixity.polystore.persistence.exec.handle.EngineHandleResolver;
import io.intellixity.polystore.persistence.jdbc.JdbcHandle;
import io.intellixity.polystore.persistence.mongo.MongoHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Builds handles from settings: a {@link MongoClient} owned by this resolver (closed when the
 * context shuts down), or a HikariCP pool handed over to the store.
 */
public final class ExampleEngineHandleResolver implements EngineHandleResolver, DisposableBean {
  private static final Logger log = LoggerFactory.getLogger(ExampleEngineHandleResolver.class);

  private final int maxPoolSize;
  private final List<MongoClient> mongoClients = new CopyOnWriteArrayList<>();

  public ExampleEngineHandleResolver(int maxPoolSize) {
    this.maxPoolSize = maxPoolSize;
  }

  @Override
  public EngineHandle<?> resolve(Backend backend, PersistenceSettings settings) {
    return switch (backend) {
      case MONGO -> {
        MongoClient client = MongoClients.create(settings.mongoUrl());
        mongoClients.add(client);
        yield new MongoHandle("mongo:" + settings.mongoDatabase(), client, settings.mongoDatabase());
      }
      case JDBC -> {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(settings.jdbcUrl());
        hc.setUsername(settings.jdbcUsername());
        hc.setPassword(settings.jdbcPassword());
        if (settings.jdbcSchema() != null) hc.setSchema(settings.jdbcSchema());
        hc.setMaximumPoolSize(maxPoolSize);
        hc.setPoolName("polystore-jdbc");
        yield new JdbcHandle("jdbc:" + hc.getPoolName(), new HikariDataSource(hc), settings.jdbcSchema());
      }
    };
  }

  @Override
  public void destroy() {
    for (MongoClient c : mongoClients) {
      c.close();
      log.info("polystore.mongo client closed");
    }
    mongoClients.clear();
  }
}
