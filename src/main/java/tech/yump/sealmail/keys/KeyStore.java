package tech.yump.sealmail.keys;

/**
 * Interface defining the key operations the sealing and secure e-mail services depend on.
 * Implementations hold asymmetric key pairs and symmetric keys by identifier and perform the
 * cryptographic primitives with them. Key material held by the store never leaves it, except for
 * the freshly generated symmetric keys returned by {@link #generateRandomSymmetricKey()}.
 *
 * <p>Every method may fail with a {@link KeyStoreException}. Thread-safety is the
 * responsibility of the implementation.
 */
public interface KeyStore {

  /**
   * Encrypts data with a recipient's public key.
   *
   * @param publicKey DER encoded public key of the recipient.
   * @param format    The encoding of {@code publicKey}.
   * @param algorithm The RSA padding to use.
   * @param plaintext Data to encrypt, typically a symmetric key.
   * @return The RSA ciphertext.
   * @throws KeyStoreException If the key cannot be decoded or encryption fails.
   */
  byte[] encryptAsymmetric(byte[] publicKey, PublicKeyFormat format, PublicKeyEncryptionAlgorithm algorithm,
                           byte[] plaintext) throws KeyStoreException;

  /**
   * Decrypts data with the private key of the key pair {@code keyId}.
   *
   * @throws KeyStoreException If the key pair does not exist or decryption fails.
   */
  byte[] decryptAsymmetric(String keyId, PublicKeyEncryptionAlgorithm algorithm, byte[] ciphertext)
          throws KeyStoreException;

  /**
   * Encrypts with raw symmetric key bytes using the store's implicit initialization vector.
   */
  byte[] encryptSymmetric(byte[] key, byte[] plaintext) throws KeyStoreException;

  /**
   * Encrypts with raw symmetric key bytes and an explicit 16 byte initialization vector.
   */
  byte[] encryptSymmetric(byte[] key, byte[] plaintext, byte[] iv) throws KeyStoreException;

  /**
   * Decrypts with raw symmetric key bytes using the store's implicit initialization vector.
   */
  byte[] decryptSymmetric(byte[] key, byte[] ciphertext) throws KeyStoreException;

  /**
   * Decrypts with raw symmetric key bytes and an explicit 16 byte initialization vector.
   */
  byte[] decryptSymmetric(byte[] key, byte[] ciphertext, byte[] iv) throws KeyStoreException;

  /**
   * Encrypts with the stored symmetric key {@code keyId}.
   *
   * @throws KeyStoreException If the key does not exist or encryption fails.
   */
  byte[] encryptSymmetricById(String keyId, byte[] plaintext) throws KeyStoreException;

  /**
   * Decrypts with the stored symmetric key {@code keyId}.
   *
   * @throws KeyStoreException If the key does not exist or decryption fails.
   */
  byte[] decryptSymmetricById(String keyId, byte[] ciphertext) throws KeyStoreException;

  /**
   * @return Fresh random symmetric key bytes. The key is not retained by the store.
   */
  byte[] generateRandomSymmetricKey() throws KeyStoreException;

  /**
   * @return {@code length} bytes from a cryptographically secure generator.
   */
  byte[] randomBytes(int length) throws KeyStoreException;

  /**
   * @return true if the private key of the key pair {@code keyId} is held by this store.
   */
  boolean privateKeyExists(String keyId) throws KeyStoreException;

  /**
   * @return true if the symmetric key {@code keyId} is held by this store.
   */
  boolean symmetricKeyExists(String keyId) throws KeyStoreException;
}
