package io.intellixity.keyset.mongo;

import com.mongodb.client.MongoCollection;
import io.intellixity.keyset.config.PagingSettings;
import io.intellixity.keyset.config.PagingSettingsLoader;
import io.intellixity.keyset.error.InvalidPageRequestException;
import io.intellixity.keyset.exec.AggregationExecutor;
import io.intellixity.keyset.exec.CursorPaginator;
import io.intellixity.keyset.page.Cursor;
import io.intellixity.keyset.page.Page;
import io.intellixity.keyset.page.PageRequest;
import io.intellixity.keyset.page.SortDirection;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Keyset paginator over a Mongo aggregation pipeline.
 *
 * <pre>
 * Page&lt;Document&gt; first = MongoCursorPaginator.paginate(orders, 20, null,
 *     List.of(Aggregates.match(Filters.eq("tenantId", tenant))), SortDirection.DESC);
 * Page&lt;Document&gt; second = MongoCursorPaginator.paginate(orders, 20, first.nextCursor(),
 *     List.of(Aggregates.match(Filters.eq("tenantId", tenant))), SortDirection.DESC);
 * </pre>
 *
 * Instances are immutable and may be shared. Store failures propagate unchanged.
 */
public final class MongoCursorPaginator<T> implements CursorPaginator<Bson, T> {
  private static final Logger log = LoggerFactory.getLogger(MongoCursorPaginator.class);

  private final AggregationExecutor<Bson, Document> executor;
  private final Function<Document, T> itemMapper;
  private final PagingSettings settings;
  private final MongoPipelineBuilder pipelines;
  private final MongoCursorCodec cursors;
  private final String source;

  public MongoCursorPaginator(AggregationExecutor<Bson, Document> executor,
                              Function<Document, T> itemMapper,
                              PagingSettings settings) {
    this(executor, itemMapper, settings, "aggregation");
  }

  private MongoCursorPaginator(AggregationExecutor<Bson, Document> executor,
                               Function<Document, T> itemMapper,
                               PagingSettings settings,
                               String source) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.itemMapper = Objects.requireNonNull(itemMapper, "itemMapper");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.pipelines = new MongoPipelineBuilder(settings.idField(), PipelineStrategy.parse(settings.strategy()));
    this.cursors = new MongoCursorCodec(IdType.parse(settings.idType()));
    this.source = source;
  }

  public static <T> MongoCursorPaginator<T> of(MongoCollection<Document> collection,
                                               Function<Document, T> itemMapper,
                                               PagingSettings settings) {
    MongoCollectionExecutor ex = new MongoCollectionExecutor(collection);
    return new MongoCursorPaginator<>(ex, itemMapper, settings, ex.collectionName());
  }

  /** Raw documents, settings from {@link PagingSettingsLoader#load()}. */
  public static MongoCursorPaginator<Document> of(MongoCollection<Document> collection) {
    return of(collection, Function.identity(), PagingSettingsLoader.load());
  }

  // ---- one-shot convenience (limit=configured default, cursor=none, prefilter=[], direction=DESC) ----

  public static Page<Document> paginate(MongoCollection<Document> collection) {
    MongoCursorPaginator<Document> p = of(collection);
    return p.paginate(PageRequest.first(p.settings().defaultLimit()), List.of());
  }

  public static Page<Document> paginate(MongoCollection<Document> collection, int limit) {
    return paginate(collection, limit, null);
  }

  public static Page<Document> paginate(MongoCollection<Document> collection, int limit, Cursor cursor) {
    return paginate(collection, limit, cursor, List.of());
  }

  public static Page<Document> paginate(MongoCollection<Document> collection, int limit, Cursor cursor,
                                        List<? extends Bson> prefilterStages) {
    return paginate(collection, limit, cursor, prefilterStages, SortDirection.DESC);
  }

  public static Page<Document> paginate(MongoCollection<Document> collection, int limit, Cursor cursor,
                                        List<? extends Bson> prefilterStages, SortDirection direction) {
    return of(collection).paginate(new PageRequest(limit, cursor, direction), prefilterStages);
  }

  public PagingSettings settings() { return settings; }

  public MongoCursorCodec cursorCodec() { return cursors; }

  /** Request-parameter entry point: a null limit falls back to the configured default. */
  public Page<T> paginate(Integer limit, String cursorToken, List<? extends Bson> prefilterStages, String direction) {
    int l = (limit == null) ? settings.defaultLimit() : limit;
    Cursor c = cursors.decode(cursorToken);
    return paginate(new PageRequest(l, c, SortDirection.parse(direction, SortDirection.DESC)), prefilterStages);
  }

  @Override
  public Page<T> paginate(PageRequest request, List<? extends Bson> prefilterStages) {
    Objects.requireNonNull(request, "request");
    if (request.limit() > settings.maxLimit()) {
      throw new InvalidPageRequestException("limit must be <= " + settings.maxLimit() + " but was " + request.limit());
    }
    cursors.check(request.after());
    List<? extends Bson> prefilter = (prefilterStages == null) ? List.of() : prefilterStages;
    List<Bson> pipeline = pipelines.build(prefilter, request);

    long t0 = System.nanoTime();
    debugStart(request, prefilter.size());
    List<Document> results = executor.aggregate(pipeline);
    Page<Document> raw = pipelines.read(results);
    Page<T> page = raw.map(itemMapper);
    debugDone(page, System.nanoTime() - t0);
    return page;
  }

  private void debugStart(PageRequest request, int prefilterStages) {
    if (!log.isDebugEnabled()) return;
    // cursor values are not logged
    log.debug("keyset.mongo op=paginate source={} strategy={} idField={} direction={} limit={} hasCursor={} prefilterStages={}",
        source, pipelines.strategy(), pipelines.idField(), request.direction(), request.limit(),
        request.after() != null, prefilterStages);
  }

  private void debugDone(Page<T> page, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("keyset.mongo_done op=paginate source={} items={} total={} hasNext={} durationMs={}",
        source, page.size(), page.total(), page.hasNext(), durationNanos / 1_000_000.0);
  }
}
