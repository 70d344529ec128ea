package tech.yump.sealmail.sealing;

/**
 * Seals and unseals attribute values with named symmetric keys using AES/CBC/PKCS7Padding.
 */
public interface SealingService {

  /**
   * Encrypts {@code plaintext} with the stored symmetric key {@code keyId}.
   *
   * @throws SealingException If the key store cannot encrypt with the key.
   */
  byte[] seal(String keyId, byte[] plaintext);

  /**
   * Decrypts {@code ciphertext} produced by {@link #seal(String, byte[])} with the same key.
   *
   * @throws SealingException If the key store cannot decrypt with the key.
   */
  byte[] unseal(String keyId, byte[] ciphertext);

  /**
   * Seals a string as a {@link SealedValue} ready to be stored by the remote service.
   */
  SealedValue sealValue(String keyId, String plaintext);
}
