package tech.yump.sealmail.secure;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.yump.sealmail.keys.KeyStore;
import tech.yump.sealmail.keys.KeyStoreException;
import tech.yump.sealmail.keys.PublicKeyEncryptionAlgorithm;
import tech.yump.sealmail.secure.EmailCryptoException.InvalidArgumentException;
import tech.yump.sealmail.secure.EmailCryptoException.KeyNotFoundException;
import tech.yump.sealmail.secure.EmailCryptoException.SecureDataDecryptionException;
import tech.yump.sealmail.secure.EmailCryptoException.SecureDataEncryptionException;
import tech.yump.sealmail.secure.codec.SecureDataCodec;

/**
 * {@link MultiRecipientCryptoService} backed by a {@link KeyStore}.
 *
 * <p>The body is encrypted with AES/CBC/PKCS7Padding under a random key and IV. The key is
 * wrapped for each recipient with RSA OAEP-SHA1. Key exchange attachments are named
 * {@code "Secure Data 1"}, {@code "Secure Data 2"}, ... in recipient order.
 *
 * <p>On decryption the key exchange attachments are scanned in bundle order and the first one
 * naming a locally held private key is used. A key store holding several of the recipients' key
 * pairs therefore decrypts with whichever record comes first.
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultMultiRecipientCryptoService implements MultiRecipientCryptoService {

  public static final int IV_SIZE = SecureDataCodec.INIT_VECTOR_LENGTH;

  private static final PublicKeyEncryptionAlgorithm KEY_WRAP_ALGORITHM = PublicKeyEncryptionAlgorithm.RSA_ECB_OAEPSHA1;

  private final KeyStore keyStore;
  private final SecureDataCodec codec;

  @Override
  public SecureBundle encrypt(byte[] data, List<RecipientPublicKey> recipients) {
    if (data == null || data.length == 0) {
      throw new InvalidArgumentException("Data to encrypt cannot be empty.");
    }
    if (recipients == null || recipients.isEmpty()) {
      throw new InvalidArgumentException("At least one recipient public key is required.");
    }
    Map<String, RecipientPublicKey> distinctRecipients = new LinkedHashMap<>();
    for (RecipientPublicKey recipient : recipients) {
      distinctRecipients.putIfAbsent(recipient.keyId(), recipient);
    }
    log.debug("Encrypting {} bytes for {} recipient key(s) ({} given).",
            data.length, distinctRecipients.size(), recipients.size());

    try {
      byte[] symmetricKey = keyStore.generateRandomSymmetricKey();
      byte[] iv = keyStore.randomBytes(IV_SIZE);
      byte[] encryptedBody = keyStore.encryptSymmetric(symmetricKey, data, iv);

      SecureData secureData = new SecureData(encryptedBody, iv);
      EmailAttachment bodyAttachment = SecureEmailAttachmentType.BODY.attachment(
              SecureEmailAttachmentType.BODY.fileName(), codec.encodeSecureData(secureData));

      Set<EmailAttachment> keyAttachments = new LinkedHashSet<>();
      int index = 1;
      for (RecipientPublicKey recipient : distinctRecipients.values()) {
        byte[] wrappedKey = keyStore.encryptAsymmetric(
                recipient.publicKey(), recipient.keyFormat(), KEY_WRAP_ALGORITHM, symmetricKey);
        SealedKeyRecord keyRecord = new SealedKeyRecord(recipient.keyId(), wrappedKey, KEY_WRAP_ALGORITHM);
        keyAttachments.add(SecureEmailAttachmentType.KEY_EXCHANGE.attachment(
                SecureEmailAttachmentType.KEY_EXCHANGE.fileName() + " " + index,
                codec.encodeSealedKeyRecord(keyRecord)));
        log.trace("Wrapped message key for recipient key '{}'.", recipient.keyId());
        index++;
      }
      return new SecureBundle(keyAttachments, bodyAttachment);
    } catch (KeyStoreException e) {
      log.error("Failed to encrypt secure e-mail data: {}", e.getMessage(), e);
      throw new SecureDataEncryptionException("Failed to encrypt secure e-mail data.", e);
    }
  }

  @Override
  public byte[] decrypt(SecureBundle bundle) {
    if (bundle == null || bundle.bodyAttachment().isEmpty()) {
      throw new InvalidArgumentException("Secure body attachment cannot be empty.");
    }
    if (bundle.keyAttachments().isEmpty()) {
      throw new InvalidArgumentException("At least one key exchange attachment is required.");
    }

    SecureData secureData = codec.decodeSecureData(bundle.bodyAttachment().data());

    try {
      SealedKeyRecord keyRecord = findLocalKeyRecord(bundle.keyAttachments())
              .orElseThrow(() -> new KeyNotFoundException(
                      "No key exchange record matches a locally held private key."));
      log.debug("Decrypting secure e-mail data with private key '{}'.", keyRecord.getPublicKeyId());

      byte[] symmetricKey = keyStore.decryptAsymmetric(
              keyRecord.getPublicKeyId(), keyRecord.getAlgorithm(), keyRecord.getEncryptedKeyBytes());
      return keyStore.decryptSymmetric(
              symmetricKey, secureData.getEncryptedDataBytes(), secureData.getInitVectorBytes());
    } catch (KeyStoreException e) {
      log.error("Failed to decrypt secure e-mail data: {}", e.getMessage(), e);
      throw new SecureDataDecryptionException("Failed to decrypt secure e-mail data.", e);
    }
  }

  private Optional<SealedKeyRecord> findLocalKeyRecord(Set<EmailAttachment> keyAttachments) {
    for (EmailAttachment attachment : keyAttachments) {
      if (attachment.isEmpty()) {
        log.debug("Skipping empty key exchange attachment '{}'.", attachment.fileName());
        continue;
      }
      SealedKeyRecord keyRecord = codec.decodeSealedKeyRecord(attachment.data());
      if (keyStore.privateKeyExists(keyRecord.getPublicKeyId())) {
        return Optional.of(keyRecord);
      }
      log.trace("No local private key '{}' for attachment '{}'.", keyRecord.getPublicKeyId(), attachment.fileName());
    }
    return Optional.empty();
  }
}
