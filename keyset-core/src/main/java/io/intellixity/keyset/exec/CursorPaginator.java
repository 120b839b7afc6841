package io.intellixity.keyset.exec;

import io.intellixity.keyset.page.Page;
import io.intellixity.keyset.page.PageRequest;

import java.util.List;

/**
 * Produces one page of a result set ordered by a unique, totally ordered identifier, positioned by a
 * cursor instead of an offset.
 * <p>
 * Implementations are stateless: everything needed to continue is carried by the returned
 * {@link Page#nextCursor()}.
 *
 * @param <S> backend stage type for caller-supplied prefilter stages
 * @param <T> item type
 */
public interface CursorPaginator<S, T> {
  /**
   * @param request limit, cursor and direction
   * @param prefilterStages stages applied unchanged before sorting and paging; may be empty
   */
  Page<T> paginate(PageRequest request, List<? extends S> prefilterStages);

  default Page<T> paginate(PageRequest request) {
    return paginate(request, List.of());
  }
}
