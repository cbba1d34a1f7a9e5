package io.intellixity.polystore.persistence.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;
import java.util.*;

/**
 * JSON deserializer for {@link DocumentQuery}.
 * <p>
 * Shape: {@code {"filter": {...}, "sort": [["createdAt", -1], "name", {"field": "x", "dir": "desc"}], "limit": 20, "skip": 0}}.
 * {@code sort} may also be a single document such as {@code {"createdAt": -1, "name": 1}}. Malformed
 * paging values are reported as {@link InvalidFormatException}.
 * The filter uses the document-style operators understood by {@link Filter#decode}.
 */
public final class DocumentQueryJsonDeserializer extends JsonDeserializer<DocumentQuery> {
  @Override
  public DocumentQuery deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) {
      throw InvalidFormatException.from(p, "DocumentQuery JSON must be an object", root, DocumentQuery.class);
    }

    Filter filter = Filter.empty();
    JsonNode f = root.get("filter");
    if (f != null && !f.isNull()) {
      if (!f.isObject()) throw InvalidFormatException.from(p, "filter must be an object", f, Filter.class);
      @SuppressWarnings("unchecked")
      Map<String, Object> m = codec.treeToValue(f, Map.class);
      filter = Filter.decode(m);
    }

    List<SortField> sort = List.of();
    JsonNode s = root.get("sort");
    if (s != null && s.isArray()) {
      List<SortField> out = new ArrayList<>();
      for (JsonNode x : s) out.add(parseSort(x, codec));
      sort = out;
    } else if (s != null && s.isObject()) {
      // document-store form: {"createdAt": -1, "name": 1}, in key order
      List<SortField> out = new ArrayList<>();
      for (Iterator<Map.Entry<String, JsonNode>> it = s.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> e = it.next();
        JsonNode dir = e.getValue();
        out.add(SortField.decode(Map.entry(e.getKey(), dir.isNumber() ? dir.numberValue() : dir.asText())));
      }
      sort = out;
    } else if (s != null && s.isTextual()) {
      sort = List.of(SortField.asc(s.asText()));
    } else if (s != null && !s.isNull()) {
      throw InvalidFormatException.from(p, "sort must be an array, an object or a field name", s, List.class);
    }

    Integer limit = intOrNull(p, root.get("limit"), "limit");
    Integer skip = intOrNull(p, root.get("skip"), "skip");
    if (limit != null && limit <= 0) {
      throw InvalidFormatException.from(p, "limit must be > 0", limit, Integer.class);
    }
    if (skip != null && skip < 0) {
      throw InvalidFormatException.from(p, "skip must be >= 0", skip, Integer.class);
    }
    Page page = Page.of(limit, skip == null ? 0 : skip);

    return new DocumentQuery(filter, sort, page);
  }

  private static SortField parseSort(JsonNode x, ObjectCodec codec) throws IOException {
    if (x.isObject() && x.has("field")) {
      JsonNode dir = x.get("dir");
      SortField.Direction d = (dir == null || dir.isNull())
          ? SortField.Direction.ASC
          : SortField.Direction.fromCode(dir.isNumber() ? dir.numberValue() : dir.asText());
      return new SortField(x.get("field").asText(), d);
    }
    Object raw = codec.treeToValue(x, Object.class);
    return SortField.decode(raw);
  }

  private static Integer intOrNull(JsonParser p, JsonNode n, String name) throws IOException {
    if (n == null || n.isNull()) return null;
    if (n.isIntegralNumber() && n.canConvertToInt()) return n.intValue();
    if (n.isTextual()) {
      try {
        return Integer.parseInt(n.asText().trim());
      } catch (NumberFormatException e) {
        throw InvalidFormatException.from(p, name + " must be an integer", n.asText(), Integer.class);
      }
    }
    throw InvalidFormatException.from(p, name + " must be an integer", n, Integer.class);
  }
}
