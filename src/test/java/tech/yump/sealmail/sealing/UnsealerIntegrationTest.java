package tech.yump.sealmail.sealing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.sealmail.keys.InMemoryKeyStore;
import tech.yump.sealmail.keys.KeyDescriptor;
import tech.yump.sealmail.keys.KeyKind;
import tech.yump.sealmail.keys.PublicKeyEncryptionAlgorithm;
import tech.yump.sealmail.keys.PublicKeyFormat;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Seals values with a real {@link InMemoryKeyStore} and unseals them again.
 */
class UnsealerIntegrationTest {

  private InMemoryKeyStore keyStore;
  private Unsealer unsealer;
  private SealingService sealingService;

  @BeforeEach
  void setUp() {
    keyStore = new InMemoryKeyStore();
    unsealer = new Unsealer(keyStore);
    sealingService = new DefaultSealingService(keyStore);
  }

  private byte[] sealEnvelope(String keyPairId, PublicKeyEncryptionAlgorithm padding, byte[] plaintext) {
    byte[] symmetricKey = keyStore.generateRandomSymmetricKey();
    byte[] wrappedKey = keyStore.encryptAsymmetric(
            keyStore.getPublicKeyData(keyPairId, PublicKeyFormat.SPKI), PublicKeyFormat.SPKI, padding, symmetricKey);
    return SealedEnvelope.compose(wrappedKey, keyStore.encryptSymmetric(symmetricKey, plaintext));
  }

  @Test
  @DisplayName("A value sealed by the sealing service should unseal to exactly the same string")
  void sealValue_ThenUnseal_HelloWorld() {
    String keyId = keyStore.generateSymmetricKey();

    SealedValue sealed = sealingService.sealValue(keyId, "hello world");

    assertEquals("hello world", unsealer.unseal(sealed));
  }

  @Test
  @DisplayName("Multi-byte UTF-8 text should survive sealing")
  void sealValue_Utf8() {
    String keyId = keyStore.generateSymmetricKey();

    assertEquals("Boîte de réception 📬", unsealer.unseal(sealingService.sealValue(keyId, "Boîte de réception 📬")));
  }

  @Test
  @DisplayName("An OAEP envelope should unseal with the default public key algorithm name")
  void unseal_AsymmetricEnvelope_Oaep() {
    keyStore.generateKeyPair("device");
    byte[] sealed = sealEnvelope("device", PublicKeyEncryptionAlgorithm.RSA_ECB_OAEPSHA1,
            "hello world".getBytes(StandardCharsets.UTF_8));

    String plaintext = unsealer.unseal(
            new KeyDescriptor("device", KeyKind.ASYMMETRIC, PublicKeyEncryptionAlgorithm.DEFAULT_PUBLIC_KEY_ALGORITHM),
            Base64.getEncoder().encodeToString(sealed));

    assertEquals("hello world", plaintext);
  }

  @Test
  @DisplayName("A PKCS#1 envelope should unseal as raw bytes")
  void unsealBytes_AsymmetricEnvelope_Pkcs1() {
    keyStore.generateKeyPair("device");
    byte[] body = new byte[1000];
    new Random(7).nextBytes(body);
    byte[] sealed = sealEnvelope("device", PublicKeyEncryptionAlgorithm.RSA_ECB_PKCS1, body);

    byte[] plaintext = unsealer.unsealBytes(new KeyDescriptor("device", KeyKind.ASYMMETRIC, "RSAEncryptionPKCS1AESCBC"),
            Base64.getEncoder().encode(sealed));

    assertArrayEquals(body, plaintext);
  }

  @Test
  @DisplayName("A key wrapped with a 3072-bit key pair should not fit the envelope")
  void sealEnvelope_LargerRsaKey_Rejected() {
    InMemoryKeyStore largeKeyStore = new InMemoryKeyStore(3072, 256);
    largeKeyStore.generateKeyPair("large");
    byte[] wrappedKey = largeKeyStore.encryptAsymmetric(largeKeyStore.getPublicKeyData("large", PublicKeyFormat.SPKI),
            PublicKeyFormat.SPKI, PublicKeyEncryptionAlgorithm.RSA_ECB_OAEPSHA1, largeKeyStore.generateRandomSymmetricKey());

    assertEquals(384, wrappedKey.length);
    assertThrows(IllegalArgumentException.class, () -> SealedEnvelope.compose(wrappedKey, new byte[16]));
  }
}
