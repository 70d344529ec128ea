package tech.yump.sealmail.secure;

import java.util.List;

/**
 * Encrypts an e-mail body once so that any of several recipients can decrypt it with their own
 * key pair.
 */
public interface MultiRecipientCryptoService {

  /**
   * Encrypts {@code data} with a fresh symmetric key and wraps that key for every distinct
   * recipient key id.
   *
   * @param data       The e-mail body.
   * @param recipients Public keys of the recipients. Duplicate key ids are wrapped once.
   * @return One key exchange attachment per distinct key id and the body attachment.
   * @throws EmailCryptoException.InvalidArgumentException      If data or recipients are empty.
   * @throws EmailCryptoException.SecureDataEncryptionException If a key store operation fails.
   */
  SecureBundle encrypt(byte[] data, List<RecipientPublicKey> recipients);

  /**
   * Decrypts a bundle with the first wrapped key whose key pair is held locally.
   *
   * @throws EmailCryptoException.InvalidArgumentException      If the body or key attachments are empty.
   * @throws EmailCryptoException.SecureDataParsingException    If a record is malformed.
   * @throws EmailCryptoException.KeyNotFoundException          If no wrapped key matches a local key pair.
   * @throws EmailCryptoException.SecureDataDecryptionException If a key store operation fails.
   */
  byte[] decrypt(SecureBundle bundle);
}
