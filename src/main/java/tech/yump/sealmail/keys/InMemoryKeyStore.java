package tech.yump.sealmail.keys;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Security;
import java.security.spec.RSAPublicKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.pkcs.RSAPublicKey;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import tech.yump.sealmail.crypto.SymmetricKeyEncryptionAlgorithm;

/**
 * {@link KeyStore} keeping RSA key pairs and AES keys in memory, with the primitives performed by
 * the BouncyCastle JCE provider. Suitable for tests and for hosts that manage key persistence
 * themselves through {@link #addSymmetricKey(String, byte[])} and
 * {@link #importKeyPair(String, KeyPair)}.
 *
 * <p>Symmetric operations use AES/CBC/PKCS7Padding. The call shapes without an explicit
 * initialization vector use an all-zero 16 byte IV; every such call is made with a freshly
 * generated or per-value key.
 */
@Slf4j
public class InMemoryKeyStore implements KeyStore {

  static {
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
  }

  public static final int IV_LENGTH_BYTE = 16;
  public static final int DEFAULT_RSA_KEY_SIZE = 2048;
  public static final int DEFAULT_SYMMETRIC_KEY_SIZE = 256;

  private static final String AES = "AES";
  private static final String RSA = "RSA";
  private static final String SYMMETRIC_TRANSFORMATION = SymmetricKeyEncryptionAlgorithm.AES_CBC_PKCS7PADDING.algorithmName();
  private static final byte[] IMPLICIT_IV = new byte[IV_LENGTH_BYTE];

  private final int rsaKeySize;
  private final int symmetricKeySize;
  private final SecureRandom secureRandom = new SecureRandom();
  private final Map<String, KeyPair> keyPairs = new ConcurrentHashMap<>();
  private final Map<String, SecretKey> symmetricKeys = new ConcurrentHashMap<>();

  public InMemoryKeyStore() {
    this(DEFAULT_RSA_KEY_SIZE, DEFAULT_SYMMETRIC_KEY_SIZE);
  }

  /**
   * @param rsaKeySize       Modulus size in bits of generated key pairs.
   * @param symmetricKeySize Size in bits of generated AES keys (128, 192 or 256).
   */
  public InMemoryKeyStore(int rsaKeySize, int symmetricKeySize) {
    this.rsaKeySize = rsaKeySize;
    this.symmetricKeySize = symmetricKeySize;
    log.debug("InMemoryKeyStore created (RSA {} bits, AES {} bits).", rsaKeySize, symmetricKeySize);
  }

  // --- Key management ---

  /**
   * Generates and stores a new RSA key pair under a random identifier.
   *
   * @return The identifier of the new key pair.
   */
  public String generateKeyPair() {
    String keyId = UUID.randomUUID().toString();
    generateKeyPair(keyId);
    return keyId;
  }

  /**
   * Generates and stores a new RSA key pair, replacing any key pair held under {@code keyId}.
   */
  public void generateKeyPair(String keyId) {
    requireKeyId(keyId);
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance(RSA);
      generator.initialize(rsaKeySize, secureRandom);
      keyPairs.put(keyId, generator.generateKeyPair());
      log.debug("Generated {} bit RSA key pair '{}'.", rsaKeySize, keyId);
    } catch (GeneralSecurityException e) {
      log.error("Failed to generate RSA key pair '{}': {}", keyId, e.getMessage(), e);
      throw new KeyStoreException("Failed to generate key pair: " + keyId, e);
    }
  }

  /**
   * Stores an externally created key pair under {@code keyId}.
   */
  public void importKeyPair(String keyId, KeyPair keyPair) {
    requireKeyId(keyId);
    if (keyPair == null || keyPair.getPrivate() == null || keyPair.getPublic() == null) {
      throw new IllegalArgumentException("Key pair and both of its keys must be present.");
    }
    keyPairs.put(keyId, keyPair);
    log.debug("Imported key pair '{}'.", keyId);
  }

  /**
   * Returns the public key of a stored key pair in the requested encoding.
   *
   * @throws KeyStoreException If the key pair does not exist or cannot be re-encoded.
   */
  public byte[] getPublicKeyData(String keyId, PublicKeyFormat format) {
    PublicKey publicKey = requireKeyPair(keyId).getPublic();
    switch (format) {
      case SPKI:
        return publicKey.getEncoded();
      case RSA_PUBLIC_KEY:
        try {
          return SubjectPublicKeyInfo.getInstance(publicKey.getEncoded()).parsePublicKey().getEncoded();
        } catch (IOException e) {
          throw new KeyStoreException("Failed to encode public key as RSA_PUBLIC_KEY: " + keyId, e);
        }
      default:
        throw new IllegalArgumentException("Unsupported public key format: " + format);
    }
  }

  public void deleteKeyPair(String keyId) {
    if (keyPairs.remove(keyId) != null) {
      log.debug("Deleted key pair '{}'.", keyId);
    }
  }

  /**
   * Generates and stores a new AES key under a random identifier.
   *
   * @return The identifier of the new key.
   */
  public String generateSymmetricKey() {
    String keyId = UUID.randomUUID().toString();
    addSymmetricKey(keyId, generateRandomSymmetricKey());
    return keyId;
  }

  /**
   * Stores raw AES key bytes under {@code keyId}, replacing any existing key.
   */
  public void addSymmetricKey(String keyId, byte[] keyBytes) {
    requireKeyId(keyId);
    if (keyBytes == null || keyBytes.length == 0) {
      throw new IllegalArgumentException("Symmetric key bytes cannot be null or empty.");
    }
    symmetricKeys.put(keyId, new SecretKeySpec(keyBytes, AES));
    log.debug("Stored symmetric key '{}' ({} bits).", keyId, keyBytes.length * 8);
  }

  public void deleteSymmetricKey(String keyId) {
    if (symmetricKeys.remove(keyId) != null) {
      log.debug("Deleted symmetric key '{}'.", keyId);
    }
  }

  public void removeAllKeys() {
    log.warn("Removing all keys ({} key pairs, {} symmetric keys).", keyPairs.size(), symmetricKeys.size());
    keyPairs.clear();
    symmetricKeys.clear();
  }

  // --- KeyStore ---

  @Override
  public byte[] encryptAsymmetric(byte[] publicKey, PublicKeyFormat format, PublicKeyEncryptionAlgorithm algorithm,
                                  byte[] plaintext) {
    if (publicKey == null || format == null || algorithm == null || plaintext == null) {
      throw new IllegalArgumentException("Public key, format, algorithm and plaintext are required.");
    }
    PublicKey key = decodePublicKey(publicKey, format);
    try {
      Cipher cipher = Cipher.getInstance(algorithm.transformation(), BouncyCastleProvider.PROVIDER_NAME);
      cipher.init(Cipher.ENCRYPT_MODE, key, secureRandom);
      byte[] ciphertext = cipher.doFinal(plaintext);
      log.trace("Encrypted {} bytes with {} public key ({}).", plaintext.length, format, algorithm);
      return ciphertext;
    } catch (GeneralSecurityException e) {
      log.error("Public key encryption failed ({}): {}", algorithm, e.getMessage(), e);
      throw new KeyStoreException("Failed to encrypt with public key.", e);
    }
  }

  @Override
  public byte[] decryptAsymmetric(String keyId, PublicKeyEncryptionAlgorithm algorithm, byte[] ciphertext) {
    if (algorithm == null || ciphertext == null) {
      throw new IllegalArgumentException("Algorithm and ciphertext are required.");
    }
    KeyPair keyPair = requireKeyPair(keyId);
    try {
      Cipher cipher = Cipher.getInstance(algorithm.transformation(), BouncyCastleProvider.PROVIDER_NAME);
      cipher.init(Cipher.DECRYPT_MODE, keyPair.getPrivate());
      byte[] plaintext = cipher.doFinal(ciphertext);
      log.trace("Decrypted {} bytes with private key '{}' ({}).", ciphertext.length, keyId, algorithm);
      return plaintext;
    } catch (GeneralSecurityException e) {
      log.error("Private key decryption failed for key '{}' ({}): {}", keyId, algorithm, e.getMessage());
      throw new KeyStoreException("Failed to decrypt with private key: " + keyId, e);
    }
  }

  @Override
  public byte[] encryptSymmetric(byte[] key, byte[] plaintext) {
    return encryptSymmetric(key, plaintext, IMPLICIT_IV);
  }

  @Override
  public byte[] encryptSymmetric(byte[] key, byte[] plaintext, byte[] iv) {
    return symmetric(Cipher.ENCRYPT_MODE, toSecretKey(key), plaintext, iv);
  }

  @Override
  public byte[] decryptSymmetric(byte[] key, byte[] ciphertext) {
    return decryptSymmetric(key, ciphertext, IMPLICIT_IV);
  }

  @Override
  public byte[] decryptSymmetric(byte[] key, byte[] ciphertext, byte[] iv) {
    return symmetric(Cipher.DECRYPT_MODE, toSecretKey(key), ciphertext, iv);
  }

  @Override
  public byte[] encryptSymmetricById(String keyId, byte[] plaintext) {
    return symmetric(Cipher.ENCRYPT_MODE, requireSymmetricKey(keyId), plaintext, IMPLICIT_IV);
  }

  @Override
  public byte[] decryptSymmetricById(String keyId, byte[] ciphertext) {
    return symmetric(Cipher.DECRYPT_MODE, requireSymmetricKey(keyId), ciphertext, IMPLICIT_IV);
  }

  @Override
  public byte[] generateRandomSymmetricKey() {
    try {
      KeyGenerator generator = KeyGenerator.getInstance(AES);
      generator.init(symmetricKeySize, secureRandom);
      return generator.generateKey().getEncoded();
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      log.error("Failed to generate {} bit AES key: {}", symmetricKeySize, e.getMessage(), e);
      throw new KeyStoreException("Failed to generate symmetric key.", e);
    }
  }

  @Override
  public byte[] randomBytes(int length) {
    if (length < 0) {
      throw new IllegalArgumentException("Random data length cannot be negative.");
    }
    byte[] data = new byte[length];
    secureRandom.nextBytes(data);
    return data;
  }

  @Override
  public boolean privateKeyExists(String keyId) {
    return keyId != null && keyPairs.containsKey(keyId);
  }

  @Override
  public boolean symmetricKeyExists(String keyId) {
    return keyId != null && symmetricKeys.containsKey(keyId);
  }

  // --- Helpers ---

  private byte[] symmetric(int mode, SecretKey key, byte[] data, byte[] iv) {
    if (data == null || iv == null) {
      throw new IllegalArgumentException("Data and initialization vector cannot be null.");
    }
    try {
      Cipher cipher = Cipher.getInstance(SYMMETRIC_TRANSFORMATION, BouncyCastleProvider.PROVIDER_NAME);
      cipher.init(mode, key, new IvParameterSpec(iv));
      byte[] result = cipher.doFinal(data);
      log.trace("{} {} bytes with {}.", mode == Cipher.ENCRYPT_MODE ? "Encrypted" : "Decrypted", data.length,
              SYMMETRIC_TRANSFORMATION);
      return result;
    } catch (GeneralSecurityException e) {
      String operation = mode == Cipher.ENCRYPT_MODE ? "encrypt" : "decrypt";
      log.error("Symmetric {} failed: {}", operation, e.getMessage());
      throw new KeyStoreException("Failed to " + operation + " with symmetric key.", e);
    }
  }

  private PublicKey decodePublicKey(byte[] publicKey, PublicKeyFormat format) {
    try {
      KeyFactory keyFactory = KeyFactory.getInstance(RSA);
      switch (format) {
        case SPKI:
          return keyFactory.generatePublic(new X509EncodedKeySpec(publicKey));
        case RSA_PUBLIC_KEY:
          RSAPublicKey rsaPublicKey = RSAPublicKey.getInstance(publicKey);
          return keyFactory.generatePublic(new RSAPublicKeySpec(rsaPublicKey.getModulus(), rsaPublicKey.getPublicExponent()));
        default:
          throw new IllegalArgumentException("Unsupported public key format: " + format);
      }
    } catch (GeneralSecurityException | IllegalStateException e) {
      throw new KeyStoreException("Failed to decode " + format + " public key.", e);
    } catch (IllegalArgumentException e) {
      // BC signals malformed ASN.1 with IllegalArgumentException
      throw new KeyStoreException("Malformed " + format + " public key.", e);
    }
  }

  private SecretKey toSecretKey(byte[] key) {
    if (key == null || key.length == 0) {
      throw new KeyStoreException("Symmetric key bytes cannot be null or empty.");
    }
    return new SecretKeySpec(key, AES);
  }

  private KeyPair requireKeyPair(String keyId) {
    KeyPair keyPair = keyId == null ? null : keyPairs.get(keyId);
    if (keyPair == null) {
      log.warn("Key pair not found: '{}'", keyId);
      throw new KeyStoreException("Key pair not found: " + keyId);
    }
    return keyPair;
  }

  private SecretKey requireSymmetricKey(String keyId) {
    SecretKey key = keyId == null ? null : symmetricKeys.get(keyId);
    if (key == null) {
      log.warn("Symmetric key not found: '{}'", keyId);
      throw new KeyStoreException("Symmetric key not found: " + keyId);
    }
    return key;
  }

  private static void requireKeyId(String keyId) {
    if (keyId == null || keyId.isBlank()) {
      throw new IllegalArgumentException("Key id cannot be null or blank.");
    }
  }
}
