package io.intellixity.polystore.examples.config;

import io.intellixity.polystore.examples.engine.ExampleEngineHandleResolver;
import io.intellixity.polystore.examples.engine.ExampleOperationsFactory;
import io.intellixity.polystore.persistence.adapter.DialectAdapter;
import io.intellixity.polystore.persistence.config.PersistenceSettings;
import io.intellixity.polystore.persistence.exec.handle.EngineHandleResolver;
import io.intellixity.polystore.persistence.spi.BackendOperationsFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PolystoreProperties.class)
public class PolystoreConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public PersistenceSettings persistenceSettings(PolystoreProperties props) {
    return props.toSettings();
  }

  @Bean
  public ExampleEngineHandleResolver engineHandleResolver(PolystoreProperties props) {
    return new ExampleEngineHandleResolver(props.getJdbc().getMaxPoolSize());
  }

  @Bean
  public BackendOperationsFactory backendOperationsFactory(PersistenceSettings settings, Clock clock) {
    return new ExampleOperationsFactory(settings, clock);
  }

  // connect() runs once while the context starts, before the bean is shared.
  @Bean(initMethod = "connect", destroyMethod = "disconnect")
  public DialectAdapter documentStore(PersistenceSettings settings,
                                      EngineHandleResolver resolver,
                                      BackendOperationsFactory operations,
                                      Clock clock) {
    return new DialectAdapter(settings, resolver, operations, clock);
  }
}
