package tech.yump.sealmail.entity;

/**
 * Converts a sealed record into its plaintext counterpart.
 *
 * <p>Fields that are not sealed are copied unchanged. An absent sealed field becomes an absent
 * ({@code null}) plaintext field. Child records are unsealed in order. A failure unsealing any
 * field or child aborts the whole record.
 *
 * @param <S> Sealed record type.
 * @param <U> Unsealed record type.
 */
public interface EntityUnsealer<S, U> {

  U unseal(S sealed);
}
