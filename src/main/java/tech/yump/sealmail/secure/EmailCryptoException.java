package tech.yump.sealmail.secure;

import tech.yump.sealmail.crypto.CryptoErrorKind;
import tech.yump.sealmail.crypto.SealMailCryptoException;

/**
 * Failures of the {@link MultiRecipientCryptoService}. Key store failures are wrapped, with the
 * original exception as cause.
 */
public abstract class EmailCryptoException extends SealMailCryptoException {

  protected EmailCryptoException(CryptoErrorKind kind, String message) {
    super(kind, message);
  }

  protected EmailCryptoException(CryptoErrorKind kind, String message, Throwable cause) {
    super(kind, message, cause);
  }

  public static class InvalidArgumentException extends EmailCryptoException {
    public InvalidArgumentException(String message) {
      super(CryptoErrorKind.INVALID_ARGUMENT, message);
    }
  }

  /** None of the key exchange records names a private key held locally. */
  public static class KeyNotFoundException extends EmailCryptoException {
    public KeyNotFoundException(String message) {
      super(CryptoErrorKind.KEY_NOT_FOUND, message);
    }
  }

  public static class SecureDataParsingException extends EmailCryptoException {
    public SecureDataParsingException(String message, Throwable cause) {
      super(CryptoErrorKind.PARSING, message, cause);
    }
  }

  public static class SecureDataEncryptionException extends EmailCryptoException {
    public SecureDataEncryptionException(String message, Throwable cause) {
      super(CryptoErrorKind.ENCRYPTION, message, cause);
    }
  }

  public static class SecureDataDecryptionException extends EmailCryptoException {
    public SecureDataDecryptionException(String message, Throwable cause) {
      super(CryptoErrorKind.DECRYPTION, message, cause);
    }
  }
}
