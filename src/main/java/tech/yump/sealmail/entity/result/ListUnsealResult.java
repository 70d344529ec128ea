package tech.yump.sealmail.entity.result;

import java.util.List;

/**
 * Outcome of unsealing a list of records: either every record was unsealed, or some were
 * degraded to partial results.
 *
 * @param <U> Unsealed record type.
 * @param <P> Partial record type.
 */
public interface ListUnsealResult<U, P> {

  /**
   * @return The records that were unsealed, in input order.
   */
  List<U> items();

  /**
   * @return The records that failed, in input order. Empty for {@link Success}.
   */
  List<PartialResult<P>> failed();

  record Success<U, P>(List<U> items) implements ListUnsealResult<U, P> {

    public Success {
      items = List.copyOf(items);
    }

    @Override
    public List<PartialResult<P>> failed() {
      return List.of();
    }
  }

  record Partial<U, P>(List<U> items, List<PartialResult<P>> failed) implements ListUnsealResult<U, P> {

    public Partial {
      items = List.copyOf(items);
      failed = List.copyOf(failed);
    }
  }
}
