package tech.yump.sealmail.crypto;

/**
 * Classification of every failure raised by the sealing and secure e-mail services.
 */
public enum CryptoErrorKind {
  /** Sealed data does not have the expected binary layout. */
  FRAMING,
  /** A sealed value names an algorithm that is not supported. */
  POLICY,
  /** Empty plaintext, recipients or attachments at the multi-recipient boundary. */
  INVALID_ARGUMENT,
  /** No locally held key matches the sealed data. */
  KEY_NOT_FOUND,
  /** Malformed JSON or base64 in a secure e-mail record. */
  PARSING,
  ENCRYPTION,
  DECRYPTION
}
