package io.intellixity.polystore.persistence.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.List;
import java.util.Objects;

/** Read request for {@code getMany}: filter, ordering and paging in one value. */
@JsonDeserialize(using = DocumentQueryJsonDeserializer.class)
public record DocumentQuery(Filter filter, List<SortField> sort, Page page) {
  public DocumentQuery {
    filter = (filter == null) ? Filter.empty() : filter;
    sort = (sort == null) ? List.of() : List.copyOf(sort);
    page = (page == null) ? Page.ALL : page;
  }

  public static DocumentQuery all() {
    return new DocumentQuery(Filter.empty(), List.of(), Page.ALL);
  }

  public DocumentQuery withFilter(Filter f) { return new DocumentQuery(Objects.requireNonNull(f, "filter"), sort, page); }
  public DocumentQuery withSort(List<SortField> s) { return new DocumentQuery(filter, s, page); }
  public DocumentQuery withPage(Page p) { return new DocumentQuery(filter, sort, p); }
}
