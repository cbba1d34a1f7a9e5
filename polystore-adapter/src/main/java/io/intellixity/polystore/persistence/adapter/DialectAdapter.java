package io.intellixity.polystore.persistence.adapter;

import io.intellixity.polystore.persistence.config.PersistenceSettings;
import io.intellixity.polystore.persistence.exceptions.ConfigurationException;
import io.intellixity.polystore.persistence.exec.AggregateResult;
import io.intellixity.polystore.persistence.exec.Backend;
import io.intellixity.polystore.persistence.exec.DocumentStore;
import io.intellixity.polystore.persistence.exec.handle.ClosableHandle;
import io.intellixity.polystore.persistence.exec.handle.EngineHandle;
import io.intellixity.polystore.persistence.exec.handle.EngineHandleResolver;
import io.intellixity.polystore.persistence.query.Filter;
import io.intellixity.polystore.persistence.query.Page;
import io.intellixity.polystore.persistence.query.SortField;
import io.intellixity.polystore.persistence.spi.BackendOperations;
import io.intellixity.polystore.persistence.spi.BackendOperationsFactory;
import io.intellixity.polystore.persistence.spi.DocumentOperations;
import io.intellixity.polystore.persistence.spi.RelationalOperations;
import io.intellixity.polystore.persistence.translate.IdentifierMapper;
import io.intellixity.polystore.persistence.update.UpdateExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link DocumentStore} over whichever backend the settings select.
 * <p>
 * Lifecycle: {@code UNINITIALIZED -> CONNECTED -> DISCONNECTED}. {@link #connect()} must be called
 * once at startup, before the adapter is shared between threads; after that every operation is a
 * plain synchronous call into the backend driver.
 */
public final class DialectAdapter implements DocumentStore {
  private static final Logger log = LoggerFactory.getLogger(DialectAdapter.class);

  public enum State { UNINITIALIZED, CONNECTED, DISCONNECTED }

  private final PersistenceSettings settings;
  private final EngineHandleResolver resolver;
  private final BackendOperationsFactory operations;
  private final Clock clock;

  private volatile State state = State.UNINITIALIZED;
  private volatile EngineHandle<?> handle;
  private volatile Route route;

  public DialectAdapter(PersistenceSettings settings,
                        EngineHandleResolver resolver,
                        BackendOperationsFactory operations,
                        Clock clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.operations = Objects.requireNonNull(operations, "operations");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public DialectAdapter(PersistenceSettings settings,
                        EngineHandleResolver resolver,
                        BackendOperationsFactory operations) {
    this(settings, resolver, operations, Clock.systemUTC());
  }

  public Backend backend() { return settings.backend(); }

  public State state() { return state; }

  public boolean isConnected() { return state == State.CONNECTED; }

  /**
   * Validates settings, obtains the handle and operation set, and checks the relational backend is
   * reachable. Calling it again while connected does nothing.
   *
   * @throws ConfigurationException when a required setting is missing or the collaborators answer
   *                                for the wrong backend
   * @throws IllegalStateException  after {@link #disconnect()}
   */
  public void connect() {
    if (state == State.CONNECTED) return;
    if (state == State.DISCONNECTED) throw new IllegalStateException("Adapter was disconnected; create a new one");

    Backend backend = settings.requireComplete().backend();
    EngineHandle<?> h = resolver.resolve(backend, settings);
    if (h == null) throw new ConfigurationException("No engine handle resolved for backend " + backend);

    Route r;
    try {
      if (h.backend() != backend) {
        throw new ConfigurationException("Resolved handle " + h.id() + " is for " + h.backend() + ", expected " + backend);
      }
      BackendOperations ops = operations.create(backend, h);
      r = routeFor(backend, ops);
      if (ops instanceof RelationalOperations rel) rel.ping();
    } catch (RuntimeException e) {
      try {
        release(h);
      } catch (RuntimeException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }

    this.handle = h;
    this.route = r;
    this.state = State.CONNECTED;
    log.info("polystore.connect backend={} handleId={} namespace={}", backend, h.id(), h.namespace());
  }

  /** Releases a store-owned handle; externally managed handles stay open. Safe to call repeatedly. */
  public void disconnect() {
    if (state == State.DISCONNECTED) return;
    EngineHandle<?> h = this.handle;
    this.state = State.DISCONNECTED;
    this.route = null;
    this.handle = null;
    if (h != null) {
      release(h);
      log.info("polystore.disconnect backend={} handleId={} closed={}", h.backend(), h.id(), h instanceof ClosableHandle);
    }
  }

  @Override
  public Object create(String collection, Map<String, ?> document) {
    Map<String, Object> doc = new LinkedHashMap<>();
    if (document != null) doc.putAll(document);
    return route().create(collection, doc);
  }

  @Override
  public Optional<Map<String, Object>> get(String collection, Filter filter) {
    return route().get(collection, orEmpty(filter));
  }

  @Override
  public List<Map<String, Object>> getMany(String collection, Filter filter, List<SortField> sort, Page page) {
    return route().getMany(collection, orEmpty(filter), (sort == null) ? List.of() : sort, (page == null) ? Page.ALL : page);
  }

  @Override
  public boolean update(String collection, Filter filter, UpdateExpression update) {
    return route().update(collection, orEmpty(filter), Objects.requireNonNull(update, "update"));
  }

  @Override
  public boolean delete(String collection, Filter filter) {
    return route().delete(collection, orEmpty(filter));
  }

  @Override
  public long count(String collection, Filter filter) {
    return route().count(collection, orEmpty(filter));
  }

  @Override
  public AggregateResult aggregate(String collection, List<Map<String, Object>> pipeline) {
    return route().aggregate(collection, pipeline);
  }

  private Route route() {
    Route r = this.route;
    if (state != State.CONNECTED || r == null) {
      throw new IllegalStateException("Adapter is " + state + "; call connect() first");
    }
    return r;
  }

  private Route routeFor(Backend backend, BackendOperations ops) {
    if (ops == null) throw new ConfigurationException("No operations created for backend " + backend);
    return switch (backend) {
      case MONGO -> {
        if (!(ops instanceof DocumentOperations d)) throw mismatch(backend, ops);
        yield new DocumentRoute(d);
      }
      case JDBC -> {
        if (!(ops instanceof RelationalOperations rel)) throw mismatch(backend, ops);
        yield new RelationalRoute(rel, IdentifierMapper.relational(), clock);
      }
    };
  }

  private static ConfigurationException mismatch(Backend backend, BackendOperations ops) {
    return new ConfigurationException("Operations " + ops.getClass().getSimpleName() + " do not serve backend " + backend);
  }

  private static void release(EngineHandle<?> h) {
    if (h instanceof ClosableHandle<?> c) c.close();
  }

  private static Filter orEmpty(Filter f) {
    return (f == null) ? Filter.empty() : f;
  }
}
