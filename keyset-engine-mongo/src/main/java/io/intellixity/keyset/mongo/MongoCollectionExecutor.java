package io.intellixity.keyset.mongo;

import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoCollection;
import io.intellixity.keyset.exec.AggregationExecutor;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs aggregation pipelines against one collection using the official MongoDB Java sync driver.
 * <p>
 * When a {@link ClientSession} is supplied every call runs inside it, so pages can be read within the
 * caller's transaction or snapshot.
 */
public final class MongoCollectionExecutor implements AggregationExecutor<Bson, Document> {
  private final MongoCollection<Document> collection;
  private final ClientSession session;

  public MongoCollectionExecutor(MongoCollection<Document> collection) {
    this(collection, null);
  }

  public MongoCollectionExecutor(MongoCollection<Document> collection, ClientSession session) {
    this.collection = Objects.requireNonNull(collection, "collection");
    this.session = session;
  }

  public String collectionName() {
    return collection.getNamespace().getCollectionName();
  }

  /** Same collection, bound to {@code session} (null unbinds). */
  public MongoCollectionExecutor withSession(ClientSession session) {
    return new MongoCollectionExecutor(collection, session);
  }

  @Override
  public List<Document> aggregate(List<? extends Bson> stages) {
    List<Bson> pipeline = List.copyOf(stages);
    var it = (session == null) ? collection.aggregate(pipeline) : collection.aggregate(session, pipeline);
    return it.into(new ArrayList<>());
  }
}
