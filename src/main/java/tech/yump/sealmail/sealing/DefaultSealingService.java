package tech.yump.sealmail.sealing;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.sealmail.crypto.CryptoErrorKind;
import tech.yump.sealmail.crypto.SymmetricKeyEncryptionAlgorithm;
import tech.yump.sealmail.keys.KeyStore;
import tech.yump.sealmail.keys.KeyStoreException;

/**
 * {@link SealingService} delegating to the symmetric key operations of a {@link KeyStore}.
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultSealingService implements SealingService {

  private final KeyStore keyStore;

  @Override
  public byte[] seal(String keyId, byte[] plaintext) {
    if (plaintext == null) {
      throw new IllegalArgumentException("Plaintext cannot be null.");
    }
    log.debug("Sealing {} bytes with symmetric key '{}'.", plaintext.length, keyId);
    try {
      return keyStore.encryptSymmetricById(keyId, plaintext);
    } catch (KeyStoreException e) {
      log.error("Failed to seal value with symmetric key '{}': {}", keyId, e.getMessage(), e);
      throw new SealingException(CryptoErrorKind.ENCRYPTION, "Failed to seal value with key: " + keyId, e);
    }
  }

  @Override
  public byte[] unseal(String keyId, byte[] ciphertext) {
    if (ciphertext == null) {
      throw new IllegalArgumentException("Ciphertext cannot be null.");
    }
    log.debug("Unsealing {} bytes with symmetric key '{}'.", ciphertext.length, keyId);
    try {
      return keyStore.decryptSymmetricById(keyId, ciphertext);
    } catch (KeyStoreException e) {
      log.error("Failed to unseal value with symmetric key '{}': {}", keyId, e.getMessage(), e);
      throw new SealingException(CryptoErrorKind.DECRYPTION, "Failed to unseal value with key: " + keyId, e);
    }
  }

  @Override
  public SealedValue sealValue(String keyId, String plaintext) {
    if (plaintext == null) {
      throw new IllegalArgumentException("Plaintext cannot be null.");
    }
    byte[] sealed = seal(keyId, plaintext.getBytes(StandardCharsets.UTF_8));
    return new SealedValue(
            keyId,
            SymmetricKeyEncryptionAlgorithm.AES_CBC_PKCS7PADDING.algorithmName(),
            SealedValue.PLAIN_TEXT_TYPE_STRING,
            Base64.getEncoder().encodeToString(sealed));
  }
}
