package tech.yump.sealmail.keys;

/**
 * Encoding of a recipient's RSA public key.
 */
public enum PublicKeyFormat {
    /** PKCS#1 {@code RSAPublicKey} DER structure (modulus and exponent only). */
    RSA_PUBLIC_KEY,
    /** X.509 {@code SubjectPublicKeyInfo} DER structure. */
    SPKI
}
