package tech.yump.sealmail.sealing;

import tech.yump.sealmail.crypto.CryptoErrorKind;
import tech.yump.sealmail.crypto.SealMailCryptoException;

/**
 * Raised by {@link SealingService} when a value cannot be sealed or unsealed.
 */
public class SealingException extends SealMailCryptoException {

  public SealingException(CryptoErrorKind kind, String message) {
    super(kind, message);
  }

  public SealingException(CryptoErrorKind kind, String message, Throwable cause) {
    super(kind, message, cause);
  }
}
