package tech.yump.sealmail.secure;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import tech.yump.sealmail.crypto.CryptoErrorKind;
import tech.yump.sealmail.keys.InMemoryKeyStore;
import tech.yump.sealmail.keys.KeyStoreException;
import tech.yump.sealmail.keys.PublicKeyEncryptionAlgorithm;
import tech.yump.sealmail.keys.PublicKeyFormat;
import tech.yump.sealmail.secure.EmailCryptoException.InvalidArgumentException;
import tech.yump.sealmail.secure.EmailCryptoException.KeyNotFoundException;
import tech.yump.sealmail.secure.EmailCryptoException.SecureDataDecryptionException;
import tech.yump.sealmail.secure.EmailCryptoException.SecureDataParsingException;
import tech.yump.sealmail.secure.codec.SecureDataCodec;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DefaultMultiRecipientCryptoServiceTest {

  private static KeyPair keyPairA;
  private static KeyPair keyPairB;

  private final SecureDataCodec codec = new SecureDataCodec();
  private InMemoryKeyStore keyStore;
  private MultiRecipientCryptoService service;
  private RecipientPublicKey recipientA;
  private RecipientPublicKey recipientB;
  private byte[] samplePlaintext;

  @BeforeAll
  static void generateKeyPairs() throws Exception {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
    generator.initialize(2048);
    keyPairA = generator.generateKeyPair();
    keyPairB = generator.generateKeyPair();
  }

  @BeforeEach
  void setUp() {
    keyStore = new InMemoryKeyStore();
    keyStore.importKeyPair("key-a", keyPairA);
    keyStore.importKeyPair("key-b", keyPairB);
    service = new DefaultMultiRecipientCryptoService(keyStore, codec);
    recipientA = new RecipientPublicKey("key-a", keyStore.getPublicKeyData("key-a", PublicKeyFormat.SPKI),
            PublicKeyFormat.SPKI);
    recipientB = new RecipientPublicKey("key-b", keyStore.getPublicKeyData("key-b", PublicKeyFormat.RSA_PUBLIC_KEY),
            PublicKeyFormat.RSA_PUBLIC_KEY);
    samplePlaintext = "hello world".getBytes(StandardCharsets.UTF_8);
  }

  @ParameterizedTest(name = "{0} byte body")
  @ValueSource(ints = {1, 15, 16, 17, 32, 100_000})
  @DisplayName("Encrypt then decrypt should return the original body")
  void encryptDecrypt_RoundTrip(int size) {
    byte[] body = new byte[size];
    new Random(size).nextBytes(body);

    SecureBundle bundle = service.encrypt(body, List.of(recipientA, recipientB));

    assertArrayEquals(body, service.decrypt(bundle));
  }

  @Test
  @DisplayName("Two recipients should produce two numbered key attachments and one body attachment")
  void encrypt_FanOut() {
    SecureBundle bundle = service.encrypt(samplePlaintext, List.of(recipientA, recipientB));

    assertThat(bundle.keyAttachments()).extracting(EmailAttachment::fileName)
            .containsExactly("Secure Data 1", "Secure Data 2");
    assertThat(bundle.keyAttachments()).allMatch(SecureEmailAttachmentType.KEY_EXCHANGE::matches);
    assertEquals("Secure Email", bundle.bodyAttachment().fileName());
    assertEquals("application/x-sudomail-body", bundle.bodyAttachment().mimeType());
    assertThat(bundle.toList()).hasSize(3);

    List<String> keyIds = bundle.keyAttachments().stream()
            .map(attachment -> codec.decodeSealedKeyRecord(attachment.data()))
            .peek(keyRecord -> assertEquals(PublicKeyEncryptionAlgorithm.RSA_ECB_OAEPSHA1, keyRecord.getAlgorithm()))
            .map(SealedKeyRecord::getPublicKeyId)
            .collect(Collectors.toList());
    assertEquals(List.of("key-a", "key-b"), keyIds);
    assertEquals(16, codec.decodeSecureData(bundle.bodyAttachment().data()).getInitVectorBytes().length);
  }

  @Test
  @DisplayName("Recipients sharing a key id should produce a single key attachment")
  void encrypt_DeduplicatesByKeyId() {
    RecipientPublicKey duplicateA = new RecipientPublicKey("key-a", recipientB.publicKey(), recipientB.keyFormat());

    SecureBundle bundle = service.encrypt(samplePlaintext, List.of(recipientA, duplicateA));

    assertThat(bundle.keyAttachments()).hasSize(1);
    // first occurrence wins: the record must unwrap with key-a's private key
    assertArrayEquals(samplePlaintext, service.decrypt(bundle));
  }

  @Test
  @DisplayName("Only recipient B's private key present: decrypt should succeed")
  void decrypt_OnlySecondRecipientHeldLocally() {
    SecureBundle bundle = service.encrypt(samplePlaintext, List.of(recipientA, recipientB));
    keyStore.deleteKeyPair("key-a");

    assertArrayEquals(samplePlaintext, service.decrypt(bundle));
  }

  @Test
  @DisplayName("Recipient B's private key dropped before decrypt: decrypt should succeed via A")
  void decrypt_FallsBackToFirstRecipient() {
    SecureBundle bundle = service.encrypt(samplePlaintext, List.of(recipientA, recipientB));
    keyStore.deleteKeyPair("key-b");

    assertEquals("hello world", new String(service.decrypt(bundle), StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("Neither private key present: decrypt should fail with KeyNotFoundException")
  void decrypt_NoLocalKey() {
    SecureBundle bundle = service.encrypt(samplePlaintext, List.of(recipientA, recipientB));
    keyStore.removeAllKeys();

    KeyNotFoundException exception = assertThrows(KeyNotFoundException.class, () -> service.decrypt(bundle));
    assertEquals(CryptoErrorKind.KEY_NOT_FOUND, exception.kind());
  }

  @Test
  @DisplayName("Several matching private keys: the first key attachment in bundle order is used")
  void decrypt_SeveralLocalKeys_FirstAttachmentWins() {
    InMemoryKeyStore spyKeyStore = spy(keyStore);
    MultiRecipientCryptoService spyService = new DefaultMultiRecipientCryptoService(spyKeyStore, codec);
    SecureBundle bundle = spyService.encrypt(samplePlaintext, List.of(recipientB, recipientA));

    assertArrayEquals(samplePlaintext, spyService.decrypt(bundle));

    verify(spyKeyStore).decryptAsymmetric(eq("key-b"), eq(PublicKeyEncryptionAlgorithm.RSA_ECB_OAEPSHA1), any());
    verify(spyKeyStore, never()).decryptAsymmetric(eq("key-a"), any(), any());
    verify(spyKeyStore, never()).privateKeyExists("key-a");
  }

  @Test
  @DisplayName("Empty key attachments should be skipped")
  void decrypt_SkipsEmptyKeyAttachments() {
    SecureBundle encrypted = service.encrypt(samplePlaintext, List.of(recipientA));
    Set<EmailAttachment> keys = new LinkedHashSet<>();
    keys.add(SecureEmailAttachmentType.KEY_EXCHANGE.attachment("Secure Data 0", new byte[0]));
    keys.addAll(encrypted.keyAttachments());

    assertArrayEquals(samplePlaintext, service.decrypt(new SecureBundle(keys, encrypted.bodyAttachment())));
  }

  @Test
  @DisplayName("Empty plaintext or recipient list should be rejected without key store calls")
  void encrypt_EmptyInputs() {
    InMemoryKeyStore mockKeyStore = mock(InMemoryKeyStore.class);
    MultiRecipientCryptoService mockedService = new DefaultMultiRecipientCryptoService(mockKeyStore, codec);

    InvalidArgumentException emptyData = assertThrows(InvalidArgumentException.class,
            () -> mockedService.encrypt(new byte[0], List.of(recipientA)));
    assertThrows(InvalidArgumentException.class, () -> mockedService.encrypt(samplePlaintext, List.of()));

    assertEquals(CryptoErrorKind.INVALID_ARGUMENT, emptyData.kind());
    verifyNoInteractions(mockKeyStore);
  }

  @Test
  @DisplayName("Empty body or no key attachments should be rejected")
  void decrypt_EmptyInputs() {
    SecureBundle encrypted = service.encrypt(samplePlaintext, List.of(recipientA));

    assertThrows(InvalidArgumentException.class, () -> service.decrypt(new SecureBundle(encrypted.keyAttachments(),
            SecureEmailAttachmentType.BODY.attachment("Secure Email", new byte[0]))));
    assertThrows(InvalidArgumentException.class,
            () -> service.decrypt(new SecureBundle(Set.of(), encrypted.bodyAttachment())));
  }

  @Test
  @DisplayName("A corrupt body should raise a parsing error, not a decryption error")
  void decrypt_CorruptBody() {
    SecureBundle encrypted = service.encrypt(samplePlaintext, List.of(recipientA));
    SecureBundle corrupt = new SecureBundle(encrypted.keyAttachments(),
            SecureEmailAttachmentType.BODY.attachment("Secure Email", "{oops".getBytes(StandardCharsets.UTF_8)));

    SecureDataParsingException exception = assertThrows(SecureDataParsingException.class,
            () -> service.decrypt(corrupt));
    assertEquals(CryptoErrorKind.PARSING, exception.kind());
  }

  @Test
  @DisplayName("A body with a truncated initialization vector should raise a parsing error")
  void decrypt_TruncatedInitVector() {
    SecureBundle encrypted = service.encrypt(samplePlaintext, List.of(recipientA));
    SecureData body = codec.decodeSecureData(encrypted.bodyAttachment().data());
    SecureData truncated = new SecureData(body.getEncryptedDataBytes(), new byte[8]);
    SecureBundle corrupt = new SecureBundle(encrypted.keyAttachments(),
            SecureEmailAttachmentType.BODY.attachment("Secure Email", codec.encodeSecureData(truncated)));

    SecureDataParsingException exception = assertThrows(SecureDataParsingException.class,
            () -> service.decrypt(corrupt));
    assertEquals(CryptoErrorKind.PARSING, exception.kind());
  }

  @Test
  @DisplayName("A corrupt key record should raise a parsing error")
  void decrypt_CorruptKeyRecord() {
    SecureBundle encrypted = service.encrypt(samplePlaintext, List.of(recipientA));
    SecureBundle corrupt = new SecureBundle(
            Set.of(SecureEmailAttachmentType.KEY_EXCHANGE.attachment("Secure Data 1", "[]".getBytes(StandardCharsets.UTF_8))),
            encrypted.bodyAttachment());

    assertThrows(SecureDataParsingException.class, () -> service.decrypt(corrupt));
  }

  @Test
  @DisplayName("Key store failure during decryption should be wrapped with its cause")
  void decrypt_KeyStoreFailure_Wrapped() {
    SecureBundle bundle = service.encrypt(samplePlaintext, List.of(recipientA));
    keyStore.deleteKeyPair("key-a");
    keyStore.importKeyPair("key-a", keyPairB);

    SecureDataDecryptionException exception = assertThrows(SecureDataDecryptionException.class,
            () -> service.decrypt(bundle));

    assertEquals(CryptoErrorKind.DECRYPTION, exception.kind());
    assertThat(exception).hasCauseInstanceOf(KeyStoreException.class);
  }

  @Test
  @DisplayName("Key store failure during encryption should be wrapped with its cause")
  void encrypt_KeyStoreFailure_Wrapped() {
    RecipientPublicKey broken = new RecipientPublicKey("broken", new byte[]{1, 2, 3}, PublicKeyFormat.SPKI);

    EmailCryptoException exception = assertThrows(EmailCryptoException.SecureDataEncryptionException.class,
            () -> service.encrypt(samplePlaintext, List.of(broken)));

    assertEquals(CryptoErrorKind.ENCRYPTION, exception.kind());
    assertThat(exception).hasCauseInstanceOf(KeyStoreException.class);
  }
}
