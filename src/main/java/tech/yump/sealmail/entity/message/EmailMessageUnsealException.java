package tech.yump.sealmail.entity.message;

import tech.yump.sealmail.crypto.CryptoErrorKind;
import tech.yump.sealmail.crypto.SealMailCryptoException;

/**
 * Raised when an unsealed message header or RFC 822 payload cannot be decoded.
 */
public class EmailMessageUnsealException extends SealMailCryptoException {

  public EmailMessageUnsealException(String message) {
    super(CryptoErrorKind.PARSING, message);
  }

  public EmailMessageUnsealException(String message, Throwable cause) {
    super(CryptoErrorKind.PARSING, message, cause);
  }
}
