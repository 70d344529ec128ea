package tech.yump.sealmail.sealing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.yump.sealmail.crypto.CryptoErrorKind;
import tech.yump.sealmail.keys.KeyDescriptor;
import tech.yump.sealmail.keys.KeyKind;
import tech.yump.sealmail.keys.KeyStore;
import tech.yump.sealmail.keys.KeyStoreException;
import tech.yump.sealmail.keys.PublicKeyEncryptionAlgorithm;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UnsealerTest {

  private static final String AES_CBC = "AES/CBC/PKCS7Padding";

  @Mock
  private KeyStore mockKeyStore;

  @InjectMocks
  private Unsealer unsealer;

  private static String base64(byte[] data) {
    return Base64.getEncoder().encodeToString(data);
  }

  private static byte[] envelope(int bodyLength) {
    byte[] sealed = new byte[256 + bodyLength];
    Arrays.fill(sealed, 0, 256, (byte) 0x11);
    Arrays.fill(sealed, 256, sealed.length, (byte) 0x22);
    return sealed;
  }

  @Test
  @DisplayName("Unsupported algorithm should fail before any key store call")
  void unseal_UnsupportedAlgorithm_NoKeyStoreCalls() {
    SealedValue value = new SealedValue("key", "AES/GCM/NoPadding", "string", base64(new byte[16]));

    UnsealerException exception = assertThrows(UnsealerException.UnsupportedAlgorithmException.class,
            () -> unsealer.unseal(value));

    assertEquals(CryptoErrorKind.POLICY, exception.kind());
    verifyNoInteractions(mockKeyStore);
  }

  @Test
  @DisplayName("Unsupported algorithm should fail before any key store call for asymmetric keys too")
  void unseal_UnsupportedAlgorithm_Asymmetric_NoKeyStoreCalls() {
    SealedValue value = new SealedValue("key", "RSAEncryptionOAEPAESCBC", "string", base64(envelope(16)));

    assertThrows(UnsealerException.UnsupportedAlgorithmException.class,
            () -> unsealer.unseal(value, KeyKind.ASYMMETRIC));
    verifyNoInteractions(mockKeyStore);
  }

  @Test
  @DisplayName("A sealed value should be decrypted with the symmetric key it names")
  void unseal_SealedValue_UsesSymmetricKeyById() {
    byte[] ciphertext = {1, 2, 3, 4};
    when(mockKeyStore.decryptSymmetricById("folder-key", ciphertext))
            .thenReturn("Receipts".getBytes(StandardCharsets.UTF_8));

    String plaintext = unsealer.unseal(new SealedValue("folder-key", AES_CBC, "string", base64(ciphertext)));

    assertEquals("Receipts", plaintext);
    verify(mockKeyStore).decryptSymmetricById("folder-key", ciphertext);
    verifyNoMoreInteractions(mockKeyStore);
  }

  @Test
  @DisplayName("Asymmetric data shorter than 256 bytes should fail with a framing error")
  void unseal_Asymmetric_TooShort() {
    KeyDescriptor descriptor = new KeyDescriptor("pair", KeyKind.ASYMMETRIC, "RSAEncryptionOAEPAESCBC");

    UnsealerException exception = assertThrows(UnsealerException.SealedDataTooShortException.class,
            () -> unsealer.unseal(descriptor, base64(new byte[255])));

    assertEquals(CryptoErrorKind.FRAMING, exception.kind());
    verifyNoInteractions(mockKeyStore);
  }

  @Test
  @DisplayName("Exactly 256 bytes should be accepted with an empty payload")
  void unseal_Asymmetric_ExactlyWrappedKeyLength() {
    byte[] symmetricKey = new byte[32];
    when(mockKeyStore.decryptAsymmetric(eq("pair"), eq(PublicKeyEncryptionAlgorithm.RSA_ECB_OAEPSHA1), any()))
            .thenReturn(symmetricKey);
    when(mockKeyStore.decryptSymmetric(eq(symmetricKey), any())).thenReturn(new byte[0]);

    String plaintext = unsealer.unseal(
            new KeyDescriptor("pair", KeyKind.ASYMMETRIC, "RSAEncryptionOAEPAESCBC"), base64(envelope(0)));

    assertEquals("", plaintext);
    verify(mockKeyStore).decryptSymmetric(symmetricKey, new byte[0]);
  }

  @Test
  @DisplayName("Asymmetric data should be split at byte 256 and unwrapped with OAEP for the default algorithm")
  void unseal_Asymmetric_SplitsEnvelope_Oaep() {
    byte[] sealed = envelope(32);
    byte[] symmetricKey = new byte[32];
    when(mockKeyStore.decryptAsymmetric("pair", PublicKeyEncryptionAlgorithm.RSA_ECB_OAEPSHA1,
            Arrays.copyOfRange(sealed, 0, 256))).thenReturn(symmetricKey);
    when(mockKeyStore.decryptSymmetric(symmetricKey, Arrays.copyOfRange(sealed, 256, 288)))
            .thenReturn("hello world".getBytes(StandardCharsets.UTF_8));

    String plaintext = unsealer.unseal(
            new KeyDescriptor("pair", KeyKind.ASYMMETRIC, "RSAEncryptionOAEPAESCBC"), base64(sealed));

    assertEquals("hello world", plaintext);
  }

  @Test
  @DisplayName("Any other key algorithm name should unwrap with PKCS#1 padding")
  void unseal_Asymmetric_OtherAlgorithm_Pkcs1() {
    byte[] symmetricKey = new byte[32];
    when(mockKeyStore.decryptAsymmetric(eq("pair"), eq(PublicKeyEncryptionAlgorithm.RSA_ECB_PKCS1), any()))
            .thenReturn(symmetricKey);
    when(mockKeyStore.decryptSymmetric(eq(symmetricKey), any())).thenReturn("x".getBytes(StandardCharsets.UTF_8));

    unsealer.unseal(new KeyDescriptor("pair", KeyKind.ASYMMETRIC, "RSAEncryptionPKCS1AESCBC"), base64(envelope(16)));

    verify(mockKeyStore).decryptAsymmetric(eq("pair"), eq(PublicKeyEncryptionAlgorithm.RSA_ECB_PKCS1), any());
  }

  @Test
  @DisplayName("Key store failures should propagate unwrapped")
  void unseal_KeyStoreFailure_PropagatesUnwrapped() {
    KeyStoreException failure = new KeyStoreException("Symmetric key not found: gone");
    when(mockKeyStore.decryptSymmetricById(eq("gone"), any())).thenThrow(failure);

    KeyStoreException thrown = assertThrows(KeyStoreException.class,
            () -> unsealer.unseal(new SealedValue("gone", AES_CBC, "string", base64(new byte[16]))));

    assertSame(failure, thrown);
  }

  @Test
  @DisplayName("Malformed base64 should fail with a framing error")
  void unseal_MalformedBase64() {
    UnsealerException exception = assertThrows(UnsealerException.SealedDataMalformedException.class,
            () -> unsealer.unseal(new SealedValue("key", AES_CBC, "string", "%%not-base64%%")));

    assertEquals(CryptoErrorKind.FRAMING, exception.kind());
    assertThat(exception).hasCauseInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(mockKeyStore);
  }

  @Test
  @DisplayName("unsealBytes should always read the asymmetric layout, even for a symmetric descriptor")
  void unsealBytes_AlwaysAsymmetric() {
    byte[] sealed = envelope(16);
    byte[] symmetricKey = new byte[16];
    byte[] expected = {9, 8, 7};
    when(mockKeyStore.decryptAsymmetric(eq("pair"), eq(PublicKeyEncryptionAlgorithm.RSA_ECB_PKCS1), any()))
            .thenReturn(symmetricKey);
    when(mockKeyStore.decryptSymmetric(eq(symmetricKey), any())).thenReturn(expected);

    byte[] plaintext = unsealer.unsealBytes(new KeyDescriptor("pair", KeyKind.SYMMETRIC, AES_CBC),
            base64(sealed).getBytes(StandardCharsets.US_ASCII));

    assertArrayEquals(expected, plaintext);
    verify(mockKeyStore, never()).decryptSymmetricById(any(), any());
  }

  @Test
  @DisplayName("unsealBytes should reject short data with a framing error")
  void unsealBytes_TooShort() {
    assertThrows(UnsealerException.SealedDataTooShortException.class,
            () -> unsealer.unsealBytes(new KeyDescriptor("pair", KeyKind.ASYMMETRIC, "RSAEncryptionOAEPAESCBC"),
                    base64(new byte[100]).getBytes(StandardCharsets.US_ASCII)));
    verifyNoInteractions(mockKeyStore);
  }
}
