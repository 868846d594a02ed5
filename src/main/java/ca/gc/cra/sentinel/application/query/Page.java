package ca.gc.cra.sentinel.application.query;

import java.util.List;
import java.util.Objects;

/**
 * One page of a newest-first listing.
 *
 * @param <T> item type
 * @param items items on this page
 * @param total items available before pagination
 * @param limit requested page size
 * @param offset items skipped
 * @since 0.1.0
 */
public record Page<T>(List<T> items, int total, int limit, int offset) {
  public Page {
    items = List.copyOf(Objects.requireNonNull(items, "items"));
  }

  static <T> Page<T> slice(List<T> all, int limit, int offset) {
    int from = Math.min(offset, all.size());
    int to = Math.min(all.size(), from + limit);
    return new Page<>(all.subList(from, to), all.size(), limit, offset);
  }

  public boolean hasMore() {
    return offset + items.size() < total;
  }
}
