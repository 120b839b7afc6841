package io.intellixity.keyset.mongo;

import com.mongodb.MongoNamespace;
import com.mongodb.client.AggregateIterable;
import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoCollection;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * {@link MongoCollection} stand-in that answers {@code getNamespace()} and {@code aggregate(...)}
 * (with or without a session) from an {@link InMemoryAggregationExecutor}. Every other driver
 * method throws.
 */
final class InMemoryMongoCollection {
  private final InMemoryAggregationExecutor data;
  private final List<ClientSession> sessions = new ArrayList<>();
  private final MongoCollection<Document> collection;

  @SuppressWarnings("unchecked")
  InMemoryMongoCollection(String database, String name, InMemoryAggregationExecutor data) {
    this.data = data;
    MongoNamespace ns = new MongoNamespace(database, name);
    InvocationHandler h = (proxy, method, args) -> {
      switch (method.getName()) {
        case "getNamespace":
          return ns;
        case "aggregate":
          if (args.length == 1 && args[0] instanceof List<?> l) {
            sessions.add(null);
            return results((List<? extends Bson>) l);
          }
          if (args.length == 2 && args[0] instanceof ClientSession s && args[1] instanceof List<?> l) {
            sessions.add(s);
            return results((List<? extends Bson>) l);
          }
          throw new UnsupportedOperationException("aggregate" + List.of(method.getParameterTypes()));
        case "toString":
          return "InMemoryMongoCollection[" + ns + "]";
        case "hashCode":
          return System.identityHashCode(proxy);
        case "equals":
          return proxy == args[0];
        default:
          throw new UnsupportedOperationException(method.getName());
      }
    };
    this.collection = (MongoCollection<Document>) Proxy.newProxyInstance(
        MongoCollection.class.getClassLoader(), new Class<?>[]{MongoCollection.class}, h);
  }

  MongoCollection<Document> collection() { return collection; }

  /** One entry per aggregate call; null when no session was passed. */
  List<ClientSession> sessions() { return sessions; }

  InMemoryAggregationExecutor data() { return data; }

  @SuppressWarnings("unchecked")
  private AggregateIterable<Document> results(List<? extends Bson> pipeline) {
    InvocationHandler h = (proxy, method, args) -> {
      if ("into".equals(method.getName())) {
        Collection<Document> target = (Collection<Document>) args[0];
        target.addAll(data.aggregate(pipeline));
        return target;
      }
      throw new UnsupportedOperationException(method.getName());
    };
    return (AggregateIterable<Document>) Proxy.newProxyInstance(
        AggregateIterable.class.getClassLoader(), new Class<?>[]{AggregateIterable.class}, h);
  }

  static ClientSession session() {
    InvocationHandler h = (proxy, method, args) -> {
      switch (method.getName()) {
        case "toString": return "ClientSession[test]";
        case "hashCode": return System.identityHashCode(proxy);
        case "equals": return proxy == args[0];
        default: throw new UnsupportedOperationException(method.getName());
      }
    };
    return (ClientSession) Proxy.newProxyInstance(
        ClientSession.class.getClassLoader(), new Class<?>[]{ClientSession.class}, h);
  }
}
