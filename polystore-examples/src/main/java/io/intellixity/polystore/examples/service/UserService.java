package io.intellixity.polystore.examples.service;

import io.intellixity.polystore.persistence.exec.DocumentStore;
import io.intellixity.polystore.persistence.query.DocumentQuery;
import io.intellixity.polystore.persistence.query.Filter;
import io.intellixity.polystore.persistence.update.UpdateExpression;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class UserService {
  static final String USERS = "users";

  private final DocumentStore store;

  public UserService(DocumentStore store) {
    this.store = store;
  }

  public Object register(String name, String email) {
    Map<String, Object> user = new LinkedHashMap<>();
    user.put("name", name);
    user.put("email", email);
    return store.create(USERS, user);
  }

  public Optional<Map<String, Object>> find(Object id) {
    return store.get(USERS, byId(id));
  }

  public Optional<Map<String, Object>> findByEmail(String email) {
    return store.get(USERS, Filter.eq("email", email));
  }

  public boolean rename(Object id, String name) {
    return store.update(USERS, byId(id), UpdateExpression.set(Map.of("name", name)));
  }

  public boolean remove(Object id) {
    return store.delete(USERS, byId(id));
  }

  public List<Map<String, Object>> search(DocumentQuery query) {
    return store.getMany(USERS, query);
  }

  public long count() {
    return store.count(USERS);
  }

  private static Filter byId(Object id) {
    return Filter.eq("_id", id);
  }
}
