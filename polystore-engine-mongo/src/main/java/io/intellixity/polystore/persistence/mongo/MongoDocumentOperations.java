package io.intellixity.polystore.persistence.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import io.intellixity.polystore.persistence.exceptions.BackendException;
import io.intellixity.polystore.persistence.exec.Backend;
import io.intellixity.polystore.persistence.query.Page;
import io.intellixity.polystore.persistence.query.SortField;
import io.intellixity.polystore.persistence.spi.DocumentOperations;
import io.intellixity.polystore.persistence.translate.UpdateTranslator;
import org.bson.BsonValue;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Document operations on the official MongoDB Java sync driver.
 * <p>
 * Writes carry server-side timestamps: {@code created_at}/{@code updated_at} on insert and
 * {@code updated_at} (inside {@code $set}) on update. Single-document semantics apply to update and
 * delete: the first match is affected.
 */
public final class MongoDocumentOperations implements DocumentOperations {
  private static final Logger log = LoggerFactory.getLogger(MongoDocumentOperations.class);

  static final String SET = "$set";

  private final MongoHandle handle;
  private final MongoDatabase db;
  private final Clock clock;

  public MongoDocumentOperations(MongoHandle handle, Clock clock) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.db = handle.client().getDatabase(handle.database());
  }

  public MongoDocumentOperations(MongoHandle handle) {
    this(handle, Clock.systemUTC());
  }

  @Override
  public Object insertOne(String collection, Map<String, Object> document) {
    Document doc = new Document();
    if (document != null) doc.putAll(document);
    Instant now = clock.instant();
    doc.put(UpdateTranslator.CREATED_AT, now);
    doc.put(UpdateTranslator.UPDATED_AT, now);

    return run("INSERT", collection, () -> {
      InsertOneResult r = col(collection).insertOne(doc);
      // the driver writes a generated _id back into doc; a caller-supplied one is kept as given
      Object id = doc.get("_id");
      return (id == null) ? bsonToJava(r.getInsertedId()) : id;
    });
  }

  @Override
  public Optional<Map<String, Object>> findOne(String collection, Map<String, Object> filter) {
    Document d = run("FIND_ONE", collection, () -> col(collection).find(toDocument(filter)).first());
    return Optional.ofNullable(d);
  }

  @Override
  public List<Map<String, Object>> find(String collection, Map<String, Object> filter, List<SortField> sort, Page page) {
    Document where = toDocument(filter);
    Document order = toSort(sort);
    return run("FIND", collection, () -> {
      FindIterable<Document> find = col(collection).find(where);
      if (!order.isEmpty()) find = find.sort(order);
      if (page != null && page.skip() > 0) find = find.skip(page.skip());
      if (page != null && page.hasLimit()) find = find.limit(page.limit());

      List<Map<String, Object>> out = new ArrayList<>();
      for (Document d : find) out.add(d);
      return out;
    });
  }

  @Override
  public boolean updateOne(String collection, Map<String, Object> filter, Map<String, Object> update) {
    Document where = toDocument(filter);
    Document changes = toUpdate(update);
    return run("UPDATE", collection, () -> {
      UpdateResult r = col(collection).updateOne(where, changes);
      return r.getMatchedCount() > 0;
    });
  }

  @Override
  public boolean deleteOne(String collection, Map<String, Object> filter) {
    Document where = toDocument(filter);
    return run("DELETE", collection, () -> {
      DeleteResult r = col(collection).deleteOne(where);
      return r.getDeletedCount() > 0;
    });
  }

  @Override
  public long count(String collection, Map<String, Object> filter) {
    Document where = toDocument(filter);
    return run("COUNT", collection, () -> col(collection).countDocuments(where));
  }

  @Override
  public List<Map<String, Object>> aggregate(String collection, List<Map<String, Object>> pipeline) {
    List<Document> stages = new ArrayList<>();
    if (pipeline != null) for (Map<String, Object> s : pipeline) stages.add(toDocument(s));
    return run("AGGREGATE", collection, () -> {
      List<Map<String, Object>> out = new ArrayList<>();
      for (Document d : col(collection).aggregate(stages)) out.add(d);
      return out;
    });
  }

  /**
   * Operator documents are kept and get {@code updated_at} merged into their {@code $set}; a flat
   * field map is wrapped in {@code $set} first.
   */
  Document toUpdate(Map<String, Object> update) {
    Document out = new Document();
    Document set = new Document();
    if (update != null) {
      boolean operators = update.keySet().stream().anyMatch(k -> k.startsWith("$"));
      if (operators) {
        for (var e : update.entrySet()) {
          if (SET.equals(e.getKey()) && e.getValue() instanceof Map<?, ?> m) {
            m.forEach((k, v) -> set.put(String.valueOf(k), v));
          } else {
            out.put(e.getKey(), e.getValue());
          }
        }
      } else {
        set.putAll(update);
      }
    }
    set.put(UpdateTranslator.UPDATED_AT, clock.instant());
    out.put(SET, set);
    return out;
  }

  static Document toSort(List<SortField> sort) {
    Document d = new Document();
    if (sort == null) return d;
    for (SortField s : sort) d.put(s.field(), s.direction().code());
    return d;
  }

  private static Document toDocument(Map<String, Object> map) {
    if (map == null) return new Document();
    return (map instanceof Document d) ? d : new Document(map);
  }

  private MongoCollection<Document> col(String collection) {
    return db.getCollection(Objects.requireNonNull(collection, "collection"));
  }

  private <T> T run(String op, String collection, Supplier<T> action) {
    long start = System.nanoTime();
    try {
      T result = action.get();
      if (log.isDebugEnabled()) {
        log.debug("polystore.mongo op={} handleId={} database={} collection={} durationMs={} result={}",
            op, handle.id(), handle.database(), collection, (System.nanoTime() - start) / 1_000_000.0, summarize(result));
      }
      return result;
    } catch (MongoException e) {
      log.debug("polystore.mongo_failed op={} collection={} error={}", op, collection, e.toString());
      throw new BackendException(Backend.MONGO, op, collection, e);
    }
  }

  private static Object summarize(Object result) {
    if (result instanceof List<?> l) return "rows=" + l.size();
    if (result instanceof Document) return "document";
    return result;
  }

  private static Object bsonToJava(BsonValue v) {
    if (v == null) return null;
    if (v.isObjectId()) return v.asObjectId().getValue();
    if (v.isString()) return v.asString().getValue();
    if (v.isInt32()) return v.asInt32().getValue();
    if (v.isInt64()) return v.asInt64().getValue();
    if (v.isBoolean()) return v.asBoolean().getValue();
    return v.toString();
  }
}
