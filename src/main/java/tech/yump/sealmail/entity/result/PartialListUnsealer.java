package tech.yump.sealmail.entity.result;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.sealmail.crypto.SealMailCryptoException;
import tech.yump.sealmail.entity.EntityUnsealer;
import tech.yump.sealmail.keys.KeyStoreException;

/**
 * Unseals a list of top-level records, degrading each record that fails to a partial
 * representation while the rest of the list is still unsealed.
 *
 * @param <S> Sealed record type.
 * @param <U> Unsealed record type.
 * @param <P> Partial record type.
 */
@Slf4j
@RequiredArgsConstructor
public class PartialListUnsealer<S, U, P> {

  private final EntityUnsealer<S, U> unsealer;
  private final Function<S, P> toPartial;
  private final Function<S, String> idOf;

  public ListUnsealResult<U, P> unsealAll(List<S> sealedRecords) {
    List<U> items = new ArrayList<>(sealedRecords.size());
    List<PartialResult<P>> failed = new ArrayList<>();
    for (S sealed : sealedRecords) {
      try {
        items.add(unsealer.unseal(sealed));
      } catch (SealMailCryptoException | KeyStoreException e) {
        log.warn("Failed to unseal record '{}', returning partial result: {}", idOf.apply(sealed), e.getMessage());
        failed.add(new PartialResult<>(toPartial.apply(sealed), e));
      }
    }
    if (failed.isEmpty()) {
      return new ListUnsealResult.Success<>(items);
    }
    log.debug("Unsealed {} record(s), {} partial.", items.size(), failed.size());
    return new ListUnsealResult.Partial<>(items, failed);
  }
}
