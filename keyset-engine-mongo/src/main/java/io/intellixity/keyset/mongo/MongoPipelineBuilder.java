package io.intellixity.keyset.mongo;

import io.intellixity.keyset.error.PaginationException;
import io.intellixity.keyset.page.Cursor;
import io.intellixity.keyset.page.Page;
import io.intellixity.keyset.page.PageRequest;
import io.intellixity.keyset.page.SortDirection;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Appends keyset paging stages to a caller prefilter and reads the single result document back.
 *
 * <p>Both strategies produce one result document holding the total and the page items:</p>
 * <pre>
 * GROUP: [prefilter..., $sort, $group{items:$push $$ROOT, total:$sum 1}, $project{total, items:$filter(cond, limit)}]
 * FACET: [prefilter..., $sort, $facet{total:[$count n], items:[$match?, $sort, $limit]}]
 * </pre>
 */
public final class MongoPipelineBuilder {
  static final String ITEMS = "items";
  static final String TOTAL = "total";
  static final String COUNT = "n";
  private static final String ITEM_VAR = "item";

  private final String idField;
  private final PipelineStrategy strategy;

  public MongoPipelineBuilder(String idField, PipelineStrategy strategy) {
    this.idField = Objects.requireNonNull(idField, "idField");
    this.strategy = Objects.requireNonNull(strategy, "strategy");
    if (idField.isBlank() || idField.startsWith("$")) {
      throw new IllegalArgumentException("idField must be a plain field path but was '" + idField + "'");
    }
  }

  public String idField() { return idField; }
  public PipelineStrategy strategy() { return strategy; }

  public List<Bson> build(List<? extends Bson> prefilter, PageRequest request) {
    Objects.requireNonNull(request, "request");
    List<Bson> out = new ArrayList<>();
    if (prefilter != null) {
      for (Bson stage : prefilter) out.add(Objects.requireNonNull(stage, "prefilter stage"));
    }
    out.add(sortStage(request.direction()));
    switch (strategy) {
      case GROUP -> {
        out.add(groupStage());
        out.add(projectStage(request));
      }
      case FACET -> out.add(facetStage(request));
    }
    return out;
  }

  /** Empty result list means the prefilter matched nothing. */
  public Page<Document> read(List<Document> results) {
    if (results == null || results.isEmpty()) return Page.empty();
    Document root = results.get(0);
    if (root == null) return Page.empty();

    long total = switch (strategy) {
      case GROUP -> number(root.get(TOTAL), TOTAL);
      case FACET -> facetTotal(root.get(TOTAL));
    };
    List<Document> items = documents(root.get(ITEMS));
    if (items.isEmpty()) return new Page<>(List.of(), total, null);

    Document last = items.get(items.size() - 1);
    Object lastId = idOf(last);
    if (lastId == null) throw new PaginationException("Result item has no identifier field '" + idField + "'");
    return new Page<>(items, total, Cursor.of(lastId));
  }

  // ---- stages ----

  private Document sortStage(SortDirection direction) {
    return new Document("$sort", new Document(idField, direction.sign()));
  }

  private static Document groupStage() {
    return new Document("$group", new Document("_id", new Document())
        .append(ITEMS, new Document("$push", "$$ROOT"))
        .append(TOTAL, new Document("$sum", 1)));
  }

  private Document projectStage(PageRequest request) {
    Object cond = request.cursor()
        .<Object>map(c -> new Document(comparison(request.direction()), Arrays.asList("$$" + ITEM_VAR + "." + idField, c.key())))
        .orElse(Boolean.TRUE);
    Document filter = new Document("input", "$" + ITEMS)
        .append("as", ITEM_VAR)
        .append("cond", cond)
        .append("limit", request.limit());
    return new Document("$project", new Document("_id", 0)
        .append(TOTAL, 1)
        .append(ITEMS, new Document("$filter", filter)));
  }

  private Document facetStage(PageRequest request) {
    List<Document> items = new ArrayList<>();
    request.cursor().ifPresent(c ->
        items.add(new Document("$match", new Document(idField, new Document(comparison(request.direction()), c.key())))));
    items.add(sortStage(request.direction()));
    items.add(new Document("$limit", request.limit()));

    return new Document("$facet", new Document(TOTAL, List.of(new Document("$count", COUNT)))
        .append(ITEMS, items));
  }

  private static String comparison(SortDirection direction) {
    return direction == SortDirection.DESC ? "$lt" : "$gt";
  }

  // ---- result decoding ----

  private Object idOf(Document d) {
    if (!idField.contains(".")) return d.get(idField);
    try {
      return d.getEmbedded(Arrays.asList(idField.split("\\.")), Object.class);
    } catch (ClassCastException e) {
      throw new PaginationException("Result item has a non-document segment in identifier path '" + idField + "'", e);
    }
  }

  private static long facetTotal(Object o) {
    if (o == null) return 0;
    if (!(o instanceof List<?> l)) throw new PaginationException("Result field '" + TOTAL + "' is not an array");
    if (l.isEmpty()) return 0;
    if (!(l.get(0) instanceof Document d)) throw new PaginationException("Result field '" + TOTAL + "' has no count document");
    return number(d.get(COUNT), TOTAL);
  }

  private static long number(Object o, String field) {
    if (o instanceof Number n) return n.longValue();
    throw new PaginationException("Result field '" + field + "' is not numeric: " + (o == null ? "null" : o.getClass().getName()));
  }

  private static List<Document> documents(Object o) {
    if (o == null) return List.of();
    if (!(o instanceof List<?> l)) throw new PaginationException("Result field '" + ITEMS + "' is not an array");
    List<Document> out = new ArrayList<>(l.size());
    for (Object x : l) {
      if (!(x instanceof Document d)) throw new PaginationException("Result field '" + ITEMS + "' holds a non-document element");
      out.add(d);
    }
    return out;
  }
}
