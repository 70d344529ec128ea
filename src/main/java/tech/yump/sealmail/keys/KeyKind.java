package tech.yump.sealmail.keys;

/**
 * Kind of key a sealed value was produced with.
 */
public enum KeyKind {
    /** Symmetric key wrapped with a key pair; the sealed value carries the wrapped key. */
    ASYMMETRIC,
    /** Named symmetric key held by the key store; the sealed value is plain ciphertext. */
    SYMMETRIC
}
