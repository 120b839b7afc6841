package io.intellixity.keyset.exec;

import java.util.List;

/**
 * The single store capability the paginator consumes: run an ordered stage sequence and return the
 * resulting documents.\n
 *
 * Implementations own nothing else (no connection management, no retries). Failures propagate as
 * thrown by the store client.
 *
 * @param <S> stage type (e.g. Mongo Bson)
 * @param <D> result document type
 */
@FunctionalInterface
public interface AggregationExecutor<S, D> {
  List<D> aggregate(List<? extends S> stages);
}
