package tech.yump.sealmail.sealing;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.sealmail.crypto.SymmetricKeyEncryptionAlgorithm;
import tech.yump.sealmail.keys.KeyDescriptor;
import tech.yump.sealmail.keys.KeyKind;
import tech.yump.sealmail.keys.KeyStore;
import tech.yump.sealmail.keys.PublicKeyEncryptionAlgorithm;

/**
 * Decrypts sealed attribute values.
 *
 * <p>Two layouts are understood. With an {@link KeyKind#ASYMMETRIC} key the sealed bytes are a
 * {@link SealedEnvelope}: the per-value key is unwrapped with the private key {@code keyId} and
 * then used to decrypt the payload. With a {@link KeyKind#SYMMETRIC} key the sealed bytes are
 * ciphertext under the stored symmetric key {@code keyId}.
 *
 * <p>Failures of the {@link KeyStore} propagate unchanged.
 */
@Slf4j
@RequiredArgsConstructor
public class Unsealer {

  private final KeyStore keyStore;

  /**
   * Unseals a value with the symmetric key it names.
   *
   * @throws UnsealerException.UnsupportedAlgorithmException If the value's algorithm is not
   *     supported. No key store call is made in that case.
   */
  public String unseal(SealedValue sealedValue) {
    return unseal(sealedValue, KeyKind.SYMMETRIC);
  }

  /**
   * Unseals a value with the key it names, interpreting the key as {@code keyKind}.
   */
  public String unseal(SealedValue sealedValue, KeyKind keyKind) {
    requireSupportedAlgorithm(sealedValue.algorithmName());
    log.debug("Unsealing value with {} key '{}'.", keyKind, sealedValue.keyId());
    KeyDescriptor descriptor = new KeyDescriptor(sealedValue.keyId(), keyKind, sealedValue.algorithmName());
    return unseal(descriptor, sealedValue.base64EncodedSealedData());
  }

  /**
   * Unseals base64 encoded sealed data with the given key.
   *
   * @return The plaintext decoded as UTF-8.
   */
  public String unseal(KeyDescriptor keyDescriptor, String base64SealedData) {
    byte[] sealedData = decodeBase64(base64SealedData);
    byte[] plaintext;
    switch (keyDescriptor.keyKind()) {
      case ASYMMETRIC:
        plaintext = unsealEnvelope(keyDescriptor, sealedData);
        break;
      case SYMMETRIC:
        plaintext = keyStore.decryptSymmetricById(keyDescriptor.keyId(), sealedData);
        break;
      default:
        throw new IllegalStateException("Unhandled key kind: " + keyDescriptor.keyKind());
    }
    return new String(plaintext, StandardCharsets.UTF_8);
  }

  /**
   * Unseals base64 encoded bytes. The data is always read as a {@link SealedEnvelope}, whatever
   * the key kind of the descriptor.
   *
   * @param keyDescriptor       Identifies the private key and the RSA padding.
   * @param base64SealedData    Base64 text of the sealed data, as bytes.
   * @return The raw plaintext.
   */
  public byte[] unsealBytes(KeyDescriptor keyDescriptor, byte[] base64SealedData) {
    if (base64SealedData == null) {
      throw new UnsealerException.SealedDataMalformedException("Sealed data cannot be null.", null);
    }
    return unsealEnvelope(keyDescriptor, decodeBase64(new String(base64SealedData, StandardCharsets.US_ASCII)));
  }

  private byte[] unsealEnvelope(KeyDescriptor keyDescriptor, byte[] sealedData) {
    SealedEnvelope envelope = SealedEnvelope.parse(sealedData);
    PublicKeyEncryptionAlgorithm padding =
            PublicKeyEncryptionAlgorithm.forKeyAlgorithmName(keyDescriptor.algorithmName());
    log.trace("Unwrapping key with private key '{}' ({}), payload {} bytes.",
            keyDescriptor.keyId(), padding, sealedData.length - SealedEnvelope.WRAPPED_KEY_LENGTH);
    byte[] symmetricKey = keyStore.decryptAsymmetric(keyDescriptor.keyId(), padding, envelope.wrappedKey());
    return keyStore.decryptSymmetric(symmetricKey, envelope.cipherBody());
  }

  private static void requireSupportedAlgorithm(String algorithmName) {
    if (!SymmetricKeyEncryptionAlgorithm.isAlgorithmSupported(algorithmName)) {
      log.warn("Refusing to unseal value with unsupported algorithm '{}'.", algorithmName);
      throw new UnsealerException.UnsupportedAlgorithmException("Unsupported algorithm: " + algorithmName);
    }
  }

  private static byte[] decodeBase64(String base64) {
    if (base64 == null) {
      throw new UnsealerException.SealedDataMalformedException("Sealed data cannot be null.", null);
    }
    try {
      return Base64.getDecoder().decode(base64);
    } catch (IllegalArgumentException e) {
      throw new UnsealerException.SealedDataMalformedException("Sealed data is not valid base64.", e);
    }
  }
}
